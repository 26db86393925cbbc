package dev.cvevaluator.exception;

import java.io.Serial;

/**
 * A provider answered successfully but the payload did not match its documented shape.
 */
public class ProviderResponseException extends EvaluationException {

    @Serial
    private static final long serialVersionUID = -5009476950335174424L;

    public static final String CODE = "PROVIDER_RESPONSE_INVALID";

    public ProviderResponseException(String provider, String message) {
        super(CODE, provider + " returned an unexpected response: " + message);
    }

    public ProviderResponseException(String provider, String message, Throwable cause) {
        super(CODE, provider + " returned an unexpected response: " + message, cause);
    }
}
