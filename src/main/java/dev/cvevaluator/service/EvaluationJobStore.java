package dev.cvevaluator.service;

import dev.cvevaluator.entity.EvaluationError;
import dev.cvevaluator.entity.EvaluationJob;
import dev.cvevaluator.entity.JobMetadata;
import dev.cvevaluator.exception.JobNotFoundException;
import dev.cvevaluator.model.EvaluationResult;
import dev.cvevaluator.model.EvaluationStage;
import dev.cvevaluator.model.JobStatus;
import dev.cvevaluator.model.JobView;
import dev.cvevaluator.repository.EvaluationJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

/**
 * The only writer of {@link EvaluationJob} rows. Each method commits on its own so progress is
 * visible to pollers as soon as a stage starts.
 *
 * <p>Guards: progress never decreases, a terminal job is never written again, and the result is
 * stored only together with the {@code completed} status.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EvaluationJobStore {

    static final String JOB_ID_PREFIX = "eval_job_";
    private static final int MAX_ERROR_MESSAGE_LENGTH = 2000;

    private final EvaluationJobRepository repository;

    @Transactional
    public EvaluationJob create(String jobTitle, String cvDocumentId, String projectReportDocumentId) {
        EvaluationJob job = EvaluationJob.builder()
                .id(JOB_ID_PREFIX + UUID.randomUUID().toString().replace("-", ""))
                .status(JobStatus.QUEUED)
                .progressPercentage(0)
                .jobTitle(jobTitle)
                .cvDocumentId(cvDocumentId)
                .projectReportDocumentId(projectReportDocumentId)
                .createdAt(LocalDateTime.now())
                .build();

        EvaluationJob saved = repository.save(job);
        log.info("Created evaluation job {} for '{}'", saved.getId(), jobTitle);
        return saved;
    }

    @Transactional(readOnly = true)
    public EvaluationJob get(String jobId) {
        return repository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    @Transactional(readOnly = true)
    public JobView view(String jobId) {
        return JobView.from(get(jobId));
    }

    @Transactional(readOnly = true)
    public boolean isTerminal(String jobId) {
        return get(jobId).getStatus().isTerminal();
    }

    /**
     * Commit the checkpoint for a stage that is about to start. The first call moves the job to
     * {@code processing}.
     */
    @Transactional
    public void enterStage(String jobId, EvaluationStage stage) {
        EvaluationJob job = get(jobId);
        if (job.getStatus().isTerminal()) {
            log.warn("Ignoring stage {} for job {}: already {}", stage.getLabel(), jobId, job.getStatus().getValue());
            return;
        }

        if (job.getStatus() == JobStatus.QUEUED) {
            job.setStatus(JobStatus.PROCESSING);
            job.setStartedAt(LocalDateTime.now());
        }
        job.setCurrentStage(stage.getLabel());
        job.setProgressPercentage(Math.max(job.getProgressPercentage(), stage.getProgress()));
        repository.save(job);
    }

    @Transactional
    public void complete(String jobId, EvaluationResult result, JobMetadata metadata) {
        EvaluationJob job = get(jobId);
        if (job.getStatus().isTerminal()) {
            log.warn("Job {} is already {}; dropping completion", jobId, job.getStatus().getValue());
            return;
        }

        job.setStatus(JobStatus.COMPLETED);
        job.setCurrentStage(JobStatus.COMPLETED.getValue());
        job.setProgressPercentage(EvaluationStage.COMPLETED_PROGRESS);
        job.setResult(result);
        job.setMetadata(metadata);
        job.setCompletedAt(LocalDateTime.now());
        repository.save(job);
    }

    /**
     * Record a terminal failure. Progress stays where the failing stage left it.
     *
     * @param stage label of the stage that failed, or null when the failure happened outside a stage
     */
    @Transactional
    public void fail(String jobId, String errorCode, String message, String stage) {
        EvaluationJob job = get(jobId);
        if (job.getStatus().isTerminal()) {
            log.warn("Job {} is already {}; dropping failure {}", jobId, job.getStatus().getValue(), errorCode);
            return;
        }

        LocalDateTime now = LocalDateTime.now();
        job.setStatus(JobStatus.FAILED);
        job.setError(EvaluationError.builder()
                .code(errorCode)
                .message(truncate(message))
                .stage(stage)
                .timestamp(now)
                .build());
        job.setCompletedAt(now);
        repository.save(job);
    }

    @Transactional(readOnly = true)
    public List<EvaluationJob> findUnfinished() {
        return repository.findByStatusIn(EnumSet.of(JobStatus.QUEUED, JobStatus.PROCESSING));
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_MESSAGE_LENGTH);
    }
}
