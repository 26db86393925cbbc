package dev.cvevaluator.model;

import java.util.Map;

public record CvScoringResult(
        Map<String, WeightedScore> breakdown,
        double cvMatchRate,
        String feedback,
        String recommendation) {
}
