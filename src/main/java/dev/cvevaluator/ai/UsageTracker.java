package dev.cvevaluator.ai;

import reactor.util.context.ContextView;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-job counters for provider usage. Travels with a job's reactive calls through the
 * Reactor context under {@link #CONTEXT_KEY}.
 */
public class UsageTracker {

    public static final String CONTEXT_KEY = "cv-evaluator.usage";

    private final AtomicInteger llmCalls = new AtomicInteger();
    private final AtomicLong totalTokens = new AtomicLong();
    private final AtomicInteger retries = new AtomicInteger();
    private final AtomicInteger fallbacks = new AtomicInteger();
    private final AtomicInteger securityWarnings = new AtomicInteger();

    public static UsageTracker from(ContextView context) {
        return context.getOrDefault(CONTEXT_KEY, new UsageTracker());
    }

    public void recordCall(long tokens) {
        llmCalls.incrementAndGet();
        totalTokens.addAndGet(tokens);
    }

    public void recordRetry() {
        retries.incrementAndGet();
    }

    /**
     * An escalation to the fallback model also counts as a retry of the structured call.
     */
    public void recordFallback() {
        fallbacks.incrementAndGet();
        retries.incrementAndGet();
    }

    public void recordSecurityWarning() {
        securityWarnings.incrementAndGet();
    }

    public int getLlmCalls() {
        return llmCalls.get();
    }

    public long getTotalTokens() {
        return totalTokens.get();
    }

    public int getRetries() {
        return retries.get();
    }

    public int getFallbacks() {
        return fallbacks.get();
    }

    public int getSecurityWarnings() {
        return securityWarnings.get();
    }
}
