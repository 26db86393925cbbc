package dev.cvevaluator.model;

/**
 * A named scoring criterion with a fixed weight. Weights within one breakdown sum to 1.0.
 */
public interface Criterion {

    String key();

    double weight();
}
