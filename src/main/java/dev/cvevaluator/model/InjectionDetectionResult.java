package dev.cvevaluator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Verdict of the AI-based prompt-injection check over an extracted document.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InjectionDetectionResult(
        boolean detected,
        Severity severity,
        double confidence,
        String reason,
        @JsonProperty("suspicious_sections") List<FlaggedSpan> flaggedSpans) {

    public InjectionDetectionResult {
        severity = severity != null ? severity : Severity.LOW;
        flaggedSpans = flaggedSpans != null ? List.copyOf(flaggedSpans) : List.of();
    }

    public static InjectionDetectionResult notDetected(String reason) {
        return new InjectionDetectionResult(false, Severity.LOW, 0.0, reason, List.of());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FlaggedSpan(
            String text,
            @JsonProperty("start_index") Integer startIndex,
            @JsonProperty("end_index") Integer endIndex) {
    }
}
