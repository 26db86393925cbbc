package dev.cvevaluator.ai;

import dev.cvevaluator.config.AiProperties;
import dev.cvevaluator.exception.EvaluationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Outer retry loop for provider calls: bounded attempts, exponential backoff with jitter,
 * and only for errors classified as transient.
 */
@Slf4j
@Component
public class RetryPolicy {

    private static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 500, 503);

    private final AiProperties.Retry settings;

    public RetryPolicy(AiProperties properties) {
        this.settings = properties.getRetry();
    }

    /**
     * Backoff spec for one logical call. {@code onRetry} runs before every re-subscription.
     *
     * @param operation name used in log lines
     * @param onRetry   hook for usage counters and metrics
     */
    public Retry backoff(String operation, Runnable onRetry) {
        int retries = Math.max(0, settings.getMaxAttempts() - 1);
        return Retry.backoff(retries, settings.getBaseDelay())
                .maxBackoff(settings.getMaxDelay())
                .jitter(settings.getJitter())
                .filter(RetryPolicy::isRetryable)
                .doBeforeRetry(signal -> {
                    onRetry.run();
                    log.warn("Retrying {} (attempt {}/{}): {}", operation,
                            signal.totalRetries() + 2, settings.getMaxAttempts(), signal.failure().getMessage());
                })
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    /**
     * Linear backoff: the n-th retry waits {@code n * baseDelay}.
     */
    public static Retry linear(int maxAttempts, Duration baseDelay, Predicate<Throwable> filter, String operation) {
        return Retry.from(signals -> signals.concatMap(signal -> {
            long attempt = signal.totalRetries() + 1;
            if (!filter.test(signal.failure()) || attempt >= maxAttempts) {
                return Mono.error(signal.failure());
            }
            log.warn("Retrying {} in {} ms (attempt {}/{}): {}", operation,
                    baseDelay.toMillis() * attempt, attempt + 1, maxAttempts, signal.failure().getMessage());
            return Mono.delay(baseDelay.multipliedBy(attempt));
        }));
    }

    /**
     * Transient failures: HTTP 429/500/503, timeouts, connection resets, DNS failures, or a
     * message mentioning a timeout or the network. Typed evaluation errors decide for themselves.
     */
    public static boolean isRetryable(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof EvaluationException evaluationException) {
                return evaluationException.isRetryable();
            }
            if (current instanceof WebClientResponseException responseException) {
                return RETRYABLE_STATUSES.contains(responseException.getStatusCode().value());
            }
            if (isTransportFailure(current)) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }

    /**
     * Network-level failures only; used where HTTP status codes are not worth retrying.
     */
    public static boolean isNetworkError(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof EvaluationException) {
                return false;
            }
            if (isTransportFailure(current)) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }

    private static boolean isTransportFailure(Throwable error) {
        if (error instanceof TimeoutException
                || error instanceof SocketTimeoutException
                || error instanceof ConnectException
                || error instanceof UnknownHostException
                || error instanceof WebClientRequestException) {
            return true;
        }
        String message = error.getMessage();
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("timeout")
                || lower.contains("timed out")
                || lower.contains("network")
                || lower.contains("connection reset")
                || lower.contains("econnreset")
                || lower.contains("etimedout")
                || lower.contains("enotfound");
    }
}
