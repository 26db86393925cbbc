package dev.cvevaluator.ai;

/**
 * Which configured model serves a call: the slower higher-quality one or the fast cheap one.
 */
public enum ModelTier {
    PRIMARY,
    FAST
}
