package dev.cvevaluator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.cvevaluator.entity.EvaluationError;
import dev.cvevaluator.entity.EvaluationJob;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Read-side snapshot of a job as returned by the status endpoint.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobView(
        String id,
        JobStatus status,
        @JsonProperty("current_stage") String currentStage,
        @JsonProperty("progress_percentage") int progressPercentage,
        EvaluationResult result,
        ErrorView error,
        @JsonProperty("retry_possible") Boolean retryPossible,
        @JsonProperty("created_at") LocalDateTime createdAt,
        @JsonProperty("started_at") LocalDateTime startedAt,
        @JsonProperty("completed_at") LocalDateTime completedAt,
        @JsonProperty("processing_time_seconds") Long processingTimeSeconds) {

    public static JobView from(EvaluationJob job) {
        boolean failed = job.getStatus() == JobStatus.FAILED;
        Long processingSeconds = job.getStartedAt() != null && job.getCompletedAt() != null
                ? Duration.between(job.getStartedAt(), job.getCompletedAt()).toSeconds()
                : null;

        return new JobView(
                job.getId(),
                job.getStatus(),
                job.getCurrentStage(),
                job.getProgressPercentage(),
                job.getStatus() == JobStatus.COMPLETED ? job.getResult() : null,
                failed ? ErrorView.from(job.getError()) : null,
                failed ? Boolean.TRUE : null,
                job.getCreatedAt(),
                job.getStartedAt(),
                job.getCompletedAt(),
                processingSeconds);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorView(String code, String message, String stage, LocalDateTime timestamp) {

        static ErrorView from(EvaluationError error) {
            if (error == null) {
                return null;
            }
            return new ErrorView(error.getCode(), error.getMessage(), error.getStage(), error.getTimestamp());
        }
    }
}
