package dev.cvevaluator.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.cvevaluator.model.JobStatus;

import java.time.LocalDateTime;

public record EvaluateResponse(
        String id,
        JobStatus status,
        @JsonProperty("created_at") LocalDateTime createdAt) {
}
