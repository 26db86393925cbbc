package dev.cvevaluator.exception;

import lombok.Getter;

import java.io.Serial;
import java.util.Set;

/**
 * HTTP-level failure from an external provider.
 *
 * <p>Rate limits (429) and the transient server errors 500 and 503 are retryable; anything
 * else (authentication, malformed request) propagates immediately.
 */
@Getter
public class ProviderException extends EvaluationException {

    @Serial
    private static final long serialVersionUID = 1398562270581957640L;

    public static final String CODE = "PROVIDER_ERROR";

    private static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 500, 503);

    private final String provider;
    private final int statusCode;

    public ProviderException(String provider, int statusCode, String message) {
        super(CODE, String.format("%s request failed with status %d: %s", provider, statusCode, message));
        this.provider = provider;
        this.statusCode = statusCode;
    }

    @Override
    public boolean isRetryable() {
        return RETRYABLE_STATUSES.contains(statusCode);
    }
}
