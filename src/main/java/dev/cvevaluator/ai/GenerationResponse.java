package dev.cvevaluator.ai;

public record GenerationResponse(String text, String finishReason, long totalTokens) {

    public GenerationResponse {
        text = text != null ? text : "";
    }

    public boolean isEmpty() {
        return text.isBlank();
    }
}
