package dev.cvevaluator.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for evaluation jobs and provider calls.
 */
@Component
public class EvaluationMetrics {

    private static final String TAG_MODEL = "model";
    private static final String TAG_CODE = "code";
    private static final String TAG_SOURCE = "source";
    private static final String TAG_STAGE = "stage";

    private final MeterRegistry registry;

    // Counters
    private final Counter jobsEnqueuedCounter;
    private final Counter jobsCompletedCounter;
    private final Counter llmRetriesCounter;
    private final Counter llmFallbacksCounter;

    // Timers (per stage)
    private final ConcurrentHashMap<String, Timer> stageTimers = new ConcurrentHashMap<>();

    // Gauges
    private final AtomicInteger activeJobs = new AtomicInteger(0);

    public EvaluationMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.jobsEnqueuedCounter = Counter.builder("cv_evaluator_jobs_enqueued_total")
                .description("Total evaluation jobs accepted and queued")
                .register(registry);

        this.jobsCompletedCounter = Counter.builder("cv_evaluator_jobs_completed_total")
                .description("Total evaluation jobs that reached completed")
                .register(registry);

        this.llmRetriesCounter = Counter.builder("cv_evaluator_llm_retries_total")
                .description("Total backoff retries of generation and OCR calls")
                .register(registry);

        this.llmFallbacksCounter = Counter.builder("cv_evaluator_llm_fallbacks_total")
                .description("Total escalations to the fallback model after schema validation failures")
                .register(registry);

        Gauge.builder("cv_evaluator_jobs_active", activeJobs, AtomicInteger::get)
                .description("Jobs currently occupying a worker slot")
                .register(registry);
    }

    /**
     * Get or create a timer for a pipeline stage.
     */
    public Timer getStageTimer(String stage) {
        return stageTimers.computeIfAbsent(stage, name ->
                Timer.builder("cv_evaluator_stage_duration")
                        .description("Time spent in a pipeline stage")
                        .tag(TAG_STAGE, name)
                        .register(registry)
        );
    }

    public void recordJobEnqueued() {
        jobsEnqueuedCounter.increment();
    }

    public void recordJobCompleted() {
        jobsCompletedCounter.increment();
    }

    /**
     * Record a failed job, tagged by its error code.
     */
    public void recordJobFailed(String code) {
        Counter.builder("cv_evaluator_jobs_failed_total")
                .tag(TAG_CODE, code != null ? code : "UNKNOWN")
                .register(registry)
                .increment();
    }

    public void recordLlmCall(String model) {
        Counter.builder("cv_evaluator_llm_calls_total")
                .tag(TAG_MODEL, model)
                .register(registry)
                .increment();
    }

    public void recordLlmRetry() {
        llmRetriesCounter.increment();
    }

    public void recordLlmFallback() {
        llmFallbacksCounter.increment();
    }

    /**
     * Record a security veto; source is file, prompt, response or injection.
     */
    public void recordSecurityBlock(String source) {
        Counter.builder("cv_evaluator_security_blocks_total")
                .tag(TAG_SOURCE, source)
                .register(registry)
                .increment();
    }

    public void recordStageDuration(String stage, Duration duration) {
        getStageTimer(stage).record(duration);
    }

    public void jobStarted() {
        activeJobs.incrementAndGet();
    }

    public void jobFinished() {
        activeJobs.decrementAndGet();
    }
}
