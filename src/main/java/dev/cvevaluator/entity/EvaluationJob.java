package dev.cvevaluator.entity;

import dev.cvevaluator.model.EvaluationResult;
import dev.cvevaluator.model.JobStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Durable record of one evaluation request.
 * Mutated only through {@link dev.cvevaluator.service.EvaluationJobStore}.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "evaluation_jobs", indexes = {
        @Index(name = "idx_job_status", columnList = "status"),
        @Index(name = "idx_job_created_at", columnList = "createdAt")
})
public class EvaluationJob {

    @Id
    @Column(length = 64)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private JobStatus status;

    @Column(length = 40)
    private String currentStage;

    @Column(nullable = false)
    private int progressPercentage;

    @Column(nullable = false)
    private String jobTitle;

    @Column(nullable = false, length = 64)
    private String cvDocumentId;

    @Column(nullable = false, length = 64)
    private String projectReportDocumentId;

    @Column(columnDefinition = "TEXT")
    @Convert(converter = EvaluationResultConverter.class)
    private EvaluationResult result;

    @Embedded
    private EvaluationError error;

    @Embedded
    @Builder.Default
    private JobMetadata metadata = new JobMetadata();

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime startedAt;

    private LocalDateTime completedAt;
}
