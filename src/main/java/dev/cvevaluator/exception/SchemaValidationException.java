package dev.cvevaluator.exception;

import java.io.Serial;

/**
 * Model output was empty, unparsable, or outside the declared schema.
 */
public class SchemaValidationException extends EvaluationException {

    @Serial
    private static final long serialVersionUID = 4477050815924380263L;

    public static final String CODE = "SCHEMA_INVALID";

    public SchemaValidationException(String message) {
        super(CODE, message);
    }

    public SchemaValidationException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
