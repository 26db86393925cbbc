package dev.cvevaluator.exception;

import lombok.Getter;

import java.io.Serial;

/**
 * Base class for errors raised while evaluating a submission.
 *
 * <p>Every subclass carries a stable error code that ends up on the failed job's error record,
 * so callers never have to infer the failure kind from the message text.
 */
@Getter
public class EvaluationException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = -3518870436221750912L;

    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private final String errorCode;

    public EvaluationException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public EvaluationException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Whether repeating the same call could succeed.
     */
    public boolean isRetryable() {
        return false;
    }
}
