package dev.cvevaluator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record RetrievedChunk(String content, double score, Map<String, Object> metadata) {

    public RetrievedChunk {
        content = content != null ? content : "";
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }
}
