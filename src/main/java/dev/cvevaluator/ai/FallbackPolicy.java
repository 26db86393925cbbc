package dev.cvevaluator.ai;

/**
 * Inner escalation for structured calls: when the first model's output fails schema
 * validation, one more attempt runs on {@code tier} at {@code temperature}.
 */
public record FallbackPolicy(ModelTier tier, double temperature, int maxOutputTokens) {
}
