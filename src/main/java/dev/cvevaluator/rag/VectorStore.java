package dev.cvevaluator.rag;

import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Namespaced vector index.
 */
public interface VectorStore {

    /**
     * Nearest-neighbour search scoped to one namespace.
     *
     * @param namespace partition to search
     * @param vector    query embedding
     * @param topK      maximum number of matches
     * @param filter    metadata equality filter, may be empty
     * @return matches including their metadata; empty when the namespace holds nothing
     */
    Mono<List<VectorMatch>> query(String namespace, List<Double> vector, int topK, Map<String, Object> filter);

    Mono<Void> upsert(String namespace, List<VectorRecord> records);

    /**
     * Remove every vector in the namespace.
     */
    Mono<Void> deleteAll(String namespace);
}
