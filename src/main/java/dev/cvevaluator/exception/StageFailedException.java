package dev.cvevaluator.exception;

import dev.cvevaluator.model.EvaluationStage;
import lombok.Getter;

import java.io.Serial;

/**
 * Wraps any error raised inside a pipeline stage together with the stage that raised it.
 * The error code is taken from the cause when it carries one.
 */
@Getter
public class StageFailedException extends EvaluationException {

    @Serial
    private static final long serialVersionUID = -7206153370963581402L;

    private final EvaluationStage stage;

    public StageFailedException(EvaluationStage stage, Throwable cause) {
        super(codeOf(cause), messageOf(cause), cause);
        this.stage = stage;
    }

    private static String codeOf(Throwable cause) {
        return cause instanceof EvaluationException ee ? ee.getErrorCode() : INTERNAL_ERROR;
    }

    private static String messageOf(Throwable cause) {
        if (cause == null) {
            return "Unknown error";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
