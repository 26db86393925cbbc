package dev.cvevaluator.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Ordered pipeline stages with the progress checkpoint committed before each one starts.
 */
public enum EvaluationStage {

    CV_PARSING("cv_parsing", 10),
    CV_EVALUATION("cv_evaluation", 30),
    PROJECT_PARSING("project_parsing", 50),
    PROJECT_EVALUATION("project_evaluation", 65),
    SYNTHESIS("synthesis", 85),
    COMPLETING("completing", 95);

    public static final int COMPLETED_PROGRESS = 100;

    private final String label;
    private final int progress;

    EvaluationStage(String label, int progress) {
        this.label = label;
        this.progress = progress;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public int getProgress() {
        return progress;
    }
}
