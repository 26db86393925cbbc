package dev.cvevaluator.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record EvaluateRequest(
        @JsonProperty("job_title") String jobTitle,
        @JsonProperty("cv_id") String cvId,
        @JsonProperty("project_report_id") String projectReportId) {
}
