package dev.cvevaluator.ai;

import reactor.core.publisher.Mono;

/**
 * Vendor seam for text generation. Implementations perform exactly one remote call per
 * subscription; retry and fallback live in {@link GenerationClient}.
 */
public interface GenerationProvider {

    /**
     * Run a single generation call.
     *
     * @param request model, prompts, sampling settings and optional response schema
     * @return Mono with the generated text, or an error of type
     *         {@link dev.cvevaluator.exception.ProviderException} /
     *         {@link dev.cvevaluator.exception.ProviderResponseException}
     */
    Mono<GenerationResponse> generate(GenerationRequest request);

    /**
     * Provider name used in logs and metrics.
     */
    String getName();
}
