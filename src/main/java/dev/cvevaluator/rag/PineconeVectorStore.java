package dev.cvevaluator.rag;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import dev.cvevaluator.config.RetrievalProperties;
import dev.cvevaluator.exception.ProviderException;
import dev.cvevaluator.exception.ProviderResponseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Vector store backed by the Pinecone data-plane REST API of a single index.
 */
@Slf4j
@Service
public class PineconeVectorStore implements VectorStore {

    private static final String PROVIDER = "Pinecone";
    private static final String API_VERSION = "2024-10";

    private final WebClient webClient;
    private final Duration requestTimeout;

    public PineconeVectorStore(RetrievalProperties properties) {
        RetrievalProperties.VectorStore settings = properties.getVectorStore();
        this.requestTimeout = settings.getRequestTimeout();
        this.webClient = WebClient.builder()
                .baseUrl(Objects.requireNonNull(settings.getIndexHost(), "app.retrieval.vector-store.index-host"))
                .defaultHeader("Api-Key", settings.getApiKey() != null ? settings.getApiKey() : "")
                .defaultHeader("X-Pinecone-API-Version", API_VERSION)
                .defaultHeader("Content-Type", "application/json")
                .build();

        if (settings.getApiKey() == null || settings.getApiKey().isBlank()) {
            log.warn("Pinecone API Key is missing! Retrieval will fail.");
        }
    }

    @Override
    public Mono<List<VectorMatch>> query(String namespace, List<Double> vector, int topK, Map<String, Object> filter) {
        QueryRequest request = new QueryRequest(namespace, vector, topK,
                filter == null || filter.isEmpty() ? null : filter, true, false);

        return post("/query", request, QueryResponse.class)
                .map(response -> response.matches() == null
                        ? List.<VectorMatch>of()
                        : response.matches().stream()
                                .map(match -> new VectorMatch(match.id(), match.score(),
                                        match.metadata() != null ? match.metadata() : Map.of()))
                                .toList());
    }

    @Override
    public Mono<Void> upsert(String namespace, List<VectorRecord> records) {
        if (records.isEmpty()) {
            return Mono.empty();
        }
        List<UpsertRequest.Vector> vectors = records.stream()
                .map(r -> new UpsertRequest.Vector(r.id(), r.values(), r.metadata()))
                .toList();

        return post("/vectors/upsert", new UpsertRequest(vectors, namespace), UpsertResponse.class)
                .doOnNext(response -> log.debug("Upserted {} vectors into namespace '{}'",
                        response.upsertedCount(), namespace))
                .then();
    }

    @Override
    public Mono<Void> deleteAll(String namespace) {
        return webClient.post()
                .uri("/vectors/delete")
                .contentType(Objects.requireNonNull(MediaType.APPLICATION_JSON))
                .bodyValue(new DeleteRequest(true, namespace))
                .retrieve()
                .onStatus(status -> status.value() == HttpStatus.NOT_FOUND.value(), response -> {
                    log.info("Namespace '{}' does not exist yet, nothing to delete", namespace);
                    return Mono.empty();
                })
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new ProviderException(PROVIDER, response.statusCode().value(), body)))
                .toBodilessEntity()
                .timeout(requestTimeout)
                .then();
    }

    private <T> Mono<T> post(String path, Object body, Class<T> responseType) {
        return webClient.post()
                .uri(path)
                .contentType(Objects.requireNonNull(MediaType.APPLICATION_JSON))
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(text -> new ProviderException(PROVIDER, response.statusCode().value(), text)))
                .bodyToMono(responseType)
                .timeout(requestTimeout)
                .onErrorMap(DecodingException.class,
                        e -> new ProviderResponseException(PROVIDER, "unexpected body for " + path, e))
                .switchIfEmpty(Mono.error(() -> new ProviderResponseException(PROVIDER, "empty body for " + path)));
    }

    // Request DTOs
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record QueryRequest(
            String namespace,
            List<Double> vector,
            int topK,
            Map<String, Object> filter,
            boolean includeMetadata,
            boolean includeValues) {
    }

    record UpsertRequest(List<Vector> vectors, String namespace) {
        record Vector(String id, List<Double> values, Map<String, Object> metadata) {
        }
    }

    record DeleteRequest(boolean deleteAll, String namespace) {
    }

    // Response DTOs
    @JsonIgnoreProperties(ignoreUnknown = true)
    record QueryResponse(List<Match> matches, String namespace) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Match(String id, Double score, Map<String, Object> metadata) {
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record UpsertResponse(Long upsertedCount) {
    }
}
