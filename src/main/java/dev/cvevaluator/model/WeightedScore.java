package dev.cvevaluator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of a scoring breakdown; {@code weightedScore} is always {@code score * weight}.
 */
public record WeightedScore(
        double score,
        double weight,
        @JsonProperty("weighted_score") double weightedScore) {

    public static WeightedScore of(double score, double weight) {
        return new WeightedScore(score, weight, score * weight);
    }
}
