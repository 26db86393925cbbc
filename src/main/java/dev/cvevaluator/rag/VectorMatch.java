package dev.cvevaluator.rag;

import java.util.Map;

/**
 * Raw nearest-neighbour hit as returned by the vector store. Score may be absent.
 */
public record VectorMatch(String id, Double score, Map<String, Object> metadata) {
}
