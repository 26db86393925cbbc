package dev.cvevaluator.rag;

public record Chunk(String content, int index) {
}
