package dev.cvevaluator.service;

import dev.cvevaluator.config.QueueProperties;
import dev.cvevaluator.exception.JobTimeoutException;
import dev.cvevaluator.metrics.EvaluationMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Runs one job on the calling worker thread under the queue's wall-clock limit.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EvaluationWorker {

    private static final String SEPARATOR = "========================================";

    private final EvaluationPipeline pipeline;
    private final EvaluationJobStore jobStore;
    private final EvaluationMetrics metrics;
    private final QueueProperties properties;

    /**
     * Process a job to a terminal state. A job that is already terminal is skipped.
     * Errors other than the timeout escape to the queue.
     */
    public void process(String jobId) {
        if (jobStore.isTerminal(jobId)) {
            log.info("Job {} is already finished; skipping", jobId);
            return;
        }

        Duration timeout = properties.getJobTimeout();
        log.info(SEPARATOR);
        log.info("Evaluation job {} starting", jobId);
        log.info(SEPARATOR);

        long start = System.nanoTime();
        metrics.jobStarted();
        try {
            Mono.fromRunnable(() -> pipeline.run(jobId))
                    .subscribeOn(Schedulers.boundedElastic())
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            if (!(Exceptions.unwrap(e) instanceof TimeoutException)) {
                throw e;
            }
            String stage = jobStore.get(jobId).getCurrentStage();
            JobTimeoutException timeoutError = new JobTimeoutException(timeout);
            log.error("Job {} timed out after {}s during {}", jobId, timeout.toSeconds(), stage);
            jobStore.fail(jobId, timeoutError.getErrorCode(), timeoutError.getMessage(), stage);
            metrics.recordJobFailed(timeoutError.getErrorCode());
        } finally {
            metrics.jobFinished();
        }

        log.info(SEPARATOR);
        log.info("Evaluation job {} finished in {} ms", jobId, Duration.ofNanos(System.nanoTime() - start).toMillis());
        log.info(SEPARATOR);
    }
}
