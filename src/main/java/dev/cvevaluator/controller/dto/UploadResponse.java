package dev.cvevaluator.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

public record UploadResponse(
        @JsonProperty("cv_id") String cvId,
        @JsonProperty("project_report_id") String projectReportId,
        @JsonProperty("uploaded_at") LocalDateTime uploadedAt) {
}
