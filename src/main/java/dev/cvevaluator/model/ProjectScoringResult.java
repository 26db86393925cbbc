package dev.cvevaluator.model;

import java.util.Map;

public record ProjectScoringResult(
        Map<String, WeightedScore> breakdown,
        double projectScore,
        String feedback,
        String recommendation) {
}
