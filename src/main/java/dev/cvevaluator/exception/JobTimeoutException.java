package dev.cvevaluator.exception;

import java.io.Serial;
import java.time.Duration;

/**
 * A job ran past the queue's wall-clock limit.
 */
public class JobTimeoutException extends EvaluationException {

    @Serial
    private static final long serialVersionUID = -1944027353370182741L;

    public static final String CODE = "JOB_TIMEOUT";

    public JobTimeoutException(Duration timeout) {
        super(CODE, "Job exceeded the " + timeout.toSeconds() + "s processing timeout");
    }
}
