package dev.cvevaluator.exception;

import lombok.Getter;

import java.io.Serial;
import java.util.List;

/**
 * Veto from the safety screener or the injection detector. Never retried.
 */
@Getter
public class SecurityBlockedException extends EvaluationException {

    @Serial
    private static final long serialVersionUID = 8867311934416578215L;

    public static final String CODE = "SECURITY_BLOCKED";

    private final transient List<String> reasons;

    public SecurityBlockedException(String message, List<String> reasons) {
        super(CODE, message);
        this.reasons = reasons != null ? List.copyOf(reasons) : List.of();
    }

    public SecurityBlockedException(String message) {
        this(message, List.of());
    }
}
