package dev.cvevaluator.exception;

import java.io.Serial;

public class JobNotFoundException extends EvaluationException {

    @Serial
    private static final long serialVersionUID = 2747436511953043790L;

    public static final String CODE = "JOB_NOT_FOUND";

    public JobNotFoundException(String jobId) {
        super(CODE, "Evaluation job not found: " + jobId);
    }
}
