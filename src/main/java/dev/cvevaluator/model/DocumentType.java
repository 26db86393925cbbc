package dev.cvevaluator.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Candidate uploads ({@code cv}, {@code project_report}) and the knowledge-base document tags
 * stored as {@code document_type} vector metadata.
 */
public enum DocumentType {

    CV("cv"),
    PROJECT_REPORT("project_report"),
    JOB_DESCRIPTION("job_description"),
    CASE_STUDY_BRIEF("case_study_brief"),
    CV_SCORING_RUBRIC("cv_scoring_rubric"),
    PROJECT_SCORING_RUBRIC("project_scoring_rubric");

    private final String value;

    DocumentType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
