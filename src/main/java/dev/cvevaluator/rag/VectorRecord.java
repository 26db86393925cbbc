package dev.cvevaluator.rag;

import java.util.List;
import java.util.Map;

public record VectorRecord(String id, List<Double> values, Map<String, Object> metadata) {
}
