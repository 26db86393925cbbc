package dev.cvevaluator.rag;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Vendor seam for text embeddings. One remote call per subscription.
 */
public interface EmbeddingProvider {

    Mono<List<Double>> embed(String text);
}
