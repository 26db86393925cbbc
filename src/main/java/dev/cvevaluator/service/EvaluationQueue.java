package dev.cvevaluator.service;

import dev.cvevaluator.config.QueueProperties;
import dev.cvevaluator.config.TaskExecutorConfig;
import dev.cvevaluator.entity.EvaluationJob;
import dev.cvevaluator.exception.EvaluationException;
import dev.cvevaluator.model.JobStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * In-process job queue backed by the evaluation worker pool.
 *
 * <p>A delivery that throws (the worker records ordinary failures itself) is retried up to
 * {@code app.queue.max-delivery-attempts}; after that the job is failed with {@code INTERNAL_ERROR}.
 */
@Slf4j
@Service
public class EvaluationQueue {

    private final TaskExecutor executor;
    private final EvaluationWorker worker;
    private final EvaluationJobStore jobStore;
    private final QueueProperties properties;
    private final LocalDateTime startedAt;

    public EvaluationQueue(@Qualifier(TaskExecutorConfig.EVALUATION_EXECUTOR) TaskExecutor executor,
                           EvaluationWorker worker, EvaluationJobStore jobStore, QueueProperties properties) {
        this.executor = executor;
        this.worker = worker;
        this.jobStore = jobStore;
        this.properties = properties;
        this.startedAt = LocalDateTime.now();
    }

    public void enqueue(String jobId) {
        log.debug("Enqueuing job {}", jobId);
        deliver(jobId, 1);
    }

    /**
     * Pick up work left behind by a previous process: queued jobs are enqueued again, jobs that
     * were mid-run are failed since their progress cannot be resumed.
     *
     * <p>Only jobs created before this queue existed are touched. The ready event fires after the
     * web server is up and the startup runners have finished, so jobs accepted in between are
     * already owned by a worker of this process.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void resumeUnfinished() {
        List<EvaluationJob> unfinished = jobStore.findUnfinished().stream()
                .filter(job -> job.getCreatedAt() != null && job.getCreatedAt().isBefore(startedAt))
                .toList();
        if (unfinished.isEmpty()) {
            return;
        }

        log.info("Found {} unfinished jobs from a previous run", unfinished.size());
        for (EvaluationJob job : unfinished) {
            if (job.getStatus() == JobStatus.QUEUED) {
                enqueue(job.getId());
            } else {
                jobStore.fail(job.getId(), EvaluationException.INTERNAL_ERROR,
                        "Job was interrupted by a service restart", job.getCurrentStage());
            }
        }
    }

    private void deliver(String jobId, int attempt) {
        executor.execute(() -> {
            try {
                worker.process(jobId);
            } catch (RuntimeException e) {
                if (attempt < properties.getMaxDeliveryAttempts()) {
                    log.warn("Delivery {} of job {} failed, redelivering: {}", attempt, jobId, e.getMessage());
                    deliver(jobId, attempt + 1);
                    return;
                }
                log.error("Job {} failed after {} delivery attempts: {}", jobId, attempt, e.getMessage(), e);
                jobStore.fail(jobId, EvaluationException.INTERNAL_ERROR, e.getMessage(), null);
            }
        });
    }
}
