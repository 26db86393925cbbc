package dev.cvevaluator.exception;

import java.io.Serial;

/**
 * Missing or invalid input, or a malformed document. Surfaced immediately, never retried.
 */
public class ValidationException extends EvaluationException {

    @Serial
    private static final long serialVersionUID = 6105249032684135779L;

    public static final String CODE = "VALIDATION_ERROR";

    public ValidationException(String message) {
        super(CODE, message);
    }
}
