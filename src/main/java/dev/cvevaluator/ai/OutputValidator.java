package dev.cvevaluator.ai;

/**
 * Semantic check applied after a model response has been parsed.
 * Implementations throw {@link dev.cvevaluator.exception.SchemaValidationException} on failure.
 */
@FunctionalInterface
public interface OutputValidator<T> {

    void validate(T value);

    static <T> OutputValidator<T> none() {
        return value -> {
        };
    }
}
