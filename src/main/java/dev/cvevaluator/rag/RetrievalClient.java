package dev.cvevaluator.rag;

import dev.cvevaluator.ai.RetryPolicy;
import dev.cvevaluator.config.RetrievalProperties;
import dev.cvevaluator.model.RetrievedChunk;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Retrieval over the knowledge base: embedding, namespaced filtered search, batched ingestion
 * and namespace purge.
 */
@Slf4j
@Service
public class RetrievalClient {

    static final String CONTENT_KEY = "content";

    private final EmbeddingProvider embeddingProvider;
    private final VectorStore vectorStore;
    private final RetrievalProperties.Embedding embeddingSettings;
    private final int upsertBatchSize;

    public RetrievalClient(EmbeddingProvider embeddingProvider, VectorStore vectorStore,
                           RetrievalProperties properties) {
        this.embeddingProvider = embeddingProvider;
        this.vectorStore = vectorStore;
        this.embeddingSettings = properties.getEmbedding();
        this.upsertBatchSize = properties.getVectorStore().getUpsertBatchSize();
    }

    /**
     * Embed one text, retrying network failures with linear backoff.
     */
    public Mono<List<Double>> embed(String text) {
        return Mono.defer(() -> embeddingProvider.embed(text))
                .retryWhen(RetryPolicy.linear(embeddingSettings.getMaxAttempts(),
                        embeddingSettings.getRetryBaseDelay(), RetryPolicy::isNetworkError, "embedding"));
    }

    /**
     * Top-K chunks for {@code text} in {@code namespace}, best match first. A match without a
     * score ranks as 0; the stored chunk text is returned as content, not as metadata.
     */
    public Mono<List<RetrievedChunk>> query(String text, Map<String, Object> filter, int topK, String namespace) {
        return embed(text)
                .flatMap(vector -> vectorStore.query(namespace, vector, topK, filter))
                .map(matches -> matches.stream()
                        .map(this::toChunk)
                        .sorted(Comparator.comparingDouble(RetrievedChunk::score).reversed())
                        .toList())
                .doOnNext(chunks -> {
                    if (chunks.isEmpty()) {
                        log.warn("No chunks found in namespace '{}' for filter {}", namespace, filter);
                    } else {
                        log.debug("Retrieved {} chunks from namespace '{}'", chunks.size(), namespace);
                    }
                });
    }

    /**
     * Embed and store chunks. Embeddings are computed in batches with a pause between batches;
     * vectors are written in larger batches afterwards.
     *
     * @param namespace target namespace
     * @param chunks    chunks in document order
     * @param metadata  common metadata, must contain document_type; job_title is optional
     * @return number of vectors written
     */
    public Mono<Integer> upsert(String namespace, List<Chunk> chunks, Map<String, Object> metadata) {
        if (chunks.isEmpty()) {
            return Mono.just(0);
        }
        String idPrefix = metadata.getOrDefault("document_type", "document") + "_"
                + metadata.getOrDefault("job_title", "default");

        List<List<Chunk>> embedBatches = partition(chunks, embeddingSettings.getBatchSize());
        log.info("Embedding {} chunks for namespace '{}' in {} batches", chunks.size(), namespace, embedBatches.size());

        return Flux.range(0, embedBatches.size())
                .concatMap(batchIndex -> {
                    Mono<Long> pause = batchIndex == 0 ? Mono.just(0L) : Mono.delay(embeddingSettings.getBatchDelay());
                    return pause.thenMany(Flux.fromIterable(embedBatches.get(batchIndex))
                            .flatMapSequential(chunk -> embed(chunk.content())
                                    .map(vector -> toRecord(idPrefix, chunk, vector, metadata))));
                })
                .collectList()
                .flatMap(records -> Flux.fromIterable(partition(records, upsertBatchSize))
                        .concatMap(batch -> vectorStore.upsert(namespace, batch))
                        .then(Mono.just(records.size())))
                .doOnNext(count -> log.info("Upserted {} vectors into namespace '{}'", count, namespace));
    }

    public Mono<Void> deleteNamespace(String namespace) {
        return vectorStore.deleteAll(namespace)
                .doOnSuccess(v -> log.info("Cleared namespace '{}'", namespace));
    }

    private RetrievedChunk toChunk(VectorMatch match) {
        Map<String, Object> metadata = new HashMap<>(match.metadata() != null ? match.metadata() : Map.of());
        Object content = metadata.remove(CONTENT_KEY);
        double score = match.score() != null ? match.score() : 0.0;
        return new RetrievedChunk(content != null ? content.toString() : "", score, metadata);
    }

    private VectorRecord toRecord(String idPrefix, Chunk chunk, List<Double> vector, Map<String, Object> metadata) {
        Map<String, Object> recordMetadata = new LinkedHashMap<>(metadata);
        recordMetadata.put("chunk_index", chunk.index());
        recordMetadata.put(CONTENT_KEY, chunk.content());
        return new VectorRecord(idPrefix + "_chunk_" + chunk.index(), vector, recordMetadata);
    }

    private static <T> List<List<T>> partition(List<T> list, int size) {
        List<List<T>> partitions = new ArrayList<>();
        for (int i = 0; i < list.size(); i += size) {
            partitions.add(list.subList(i, Math.min(i + size, list.size())));
        }
        return partitions;
    }
}
