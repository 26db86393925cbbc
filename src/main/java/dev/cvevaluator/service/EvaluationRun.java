package dev.cvevaluator.service;

import dev.cvevaluator.ai.UsageTracker;
import dev.cvevaluator.entity.EvaluationJob;
import dev.cvevaluator.entity.JobMetadata;
import lombok.Getter;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * State of one pipeline execution: the job's inputs and the usage counters its provider calls
 * report into.
 */
@Getter
class EvaluationRun {

    private final String jobId;
    private final String jobTitle;
    private final String cvDocumentId;
    private final String projectReportDocumentId;
    private final UsageTracker usage = new UsageTracker();
    private final long startNanos = System.nanoTime();

    EvaluationRun(EvaluationJob job) {
        this.jobId = job.getId();
        this.jobTitle = job.getJobTitle();
        this.cvDocumentId = job.getCvDocumentId();
        this.projectReportDocumentId = job.getProjectReportDocumentId();
    }

    /**
     * Block on a provider call with this run's {@link UsageTracker} in the subscriber context.
     */
    <T> T await(Mono<T> call) {
        return call.contextWrite(context -> context.put(UsageTracker.CONTEXT_KEY, usage)).block();
    }

    Duration elapsed() {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    JobMetadata toMetadata() {
        return JobMetadata.builder()
                .llmCallsCount(usage.getLlmCalls())
                .totalTokensUsed(usage.getTotalTokens())
                .retryCount(usage.getRetries())
                .fallbackCount(usage.getFallbacks())
                .securityWarnings(usage.getSecurityWarnings())
                .processingTimeMs(elapsed().toMillis())
                .build();
    }
}
