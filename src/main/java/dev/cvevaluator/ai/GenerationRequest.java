package dev.cvevaluator.ai;

import java.util.Map;

/**
 * One model call. {@code responseSchema} is null for free-text generation.
 */
public record GenerationRequest(
        String model,
        String systemPrompt,
        String userPrompt,
        double temperature,
        int maxOutputTokens,
        Map<String, Object> responseSchema) {

    public boolean isStructured() {
        return responseSchema != null;
    }
}
