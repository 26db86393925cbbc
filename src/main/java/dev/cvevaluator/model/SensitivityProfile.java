package dev.cvevaluator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Blocking thresholds for injection detection. CVs are screened more strictly than project
 * reports because project reports legitimately discuss prompts and LLM instructions.
 */
public enum SensitivityProfile {

    CV("CV", EnumSet.of(Severity.CRITICAL, Severity.HIGH), 0.3),
    PROJECT("Project Report", EnumSet.of(Severity.CRITICAL), 0.6);

    private final String documentLabel;
    private final Set<Severity> blockingSeverities;
    private final double confidenceThreshold;

    SensitivityProfile(String documentLabel, Set<Severity> blockingSeverities, double confidenceThreshold) {
        this.documentLabel = documentLabel;
        this.blockingSeverities = blockingSeverities;
        this.confidenceThreshold = confidenceThreshold;
    }

    public String getDocumentLabel() {
        return documentLabel;
    }

    public boolean shouldBlock(InjectionDetectionResult result) {
        if (result == null || !result.detected()) {
            return false;
        }
        return blockingSeverities.contains(result.severity())
                || result.confidence() >= confidenceThreshold;
    }
}
