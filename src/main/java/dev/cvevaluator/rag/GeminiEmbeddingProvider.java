package dev.cvevaluator.rag;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.cvevaluator.config.AiProperties;
import dev.cvevaluator.config.RetrievalProperties;
import dev.cvevaluator.exception.ProviderException;
import dev.cvevaluator.exception.ProviderResponseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Embeddings from the Gemini embedContent endpoint. Shares the API key and base URL with
 * the generation provider.
 */
@Slf4j
@Service
public class GeminiEmbeddingProvider implements EmbeddingProvider {

    private static final String PROVIDER = "Gemini embeddings";
    private static final String EMBED_PATH = "/v1beta/models/%s:embedContent";

    private final WebClient webClient;
    private final String apiKey;
    private final String model;
    private final Duration requestTimeout;

    public GeminiEmbeddingProvider(AiProperties aiProperties, RetrievalProperties retrievalProperties) {
        this.apiKey = aiProperties.getApiKey();
        this.model = retrievalProperties.getEmbedding().getModel();
        this.requestTimeout = aiProperties.getRequestTimeout();
        this.webClient = WebClient.builder()
                .baseUrl(Objects.requireNonNull(aiProperties.getBaseUrl()))
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public Mono<List<Double>> embed(String text) {
        String uri = String.format(EMBED_PATH, model) + "?key=" + apiKey;
        EmbedRequest request = new EmbedRequest("models/" + model,
                new EmbedRequest.Content(List.of(new EmbedRequest.Part(text))));

        return webClient.post()
                .uri(uri)
                .contentType(Objects.requireNonNull(MediaType.APPLICATION_JSON))
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new ProviderException(PROVIDER, response.statusCode().value(), body)))
                .bodyToMono(EmbedResponse.class)
                .timeout(requestTimeout)
                .onErrorMap(DecodingException.class,
                        e -> new ProviderResponseException(PROVIDER, "body is not an embedContent response", e))
                .switchIfEmpty(Mono.error(() -> new ProviderResponseException(PROVIDER, "empty body")))
                .map(this::parseResponse);
    }

    private List<Double> parseResponse(EmbedResponse response) {
        if (response.embedding() == null || response.embedding().values() == null
                || response.embedding().values().isEmpty()) {
            throw new ProviderResponseException(PROVIDER, "missing embedding.values");
        }
        return response.embedding().values();
    }

    record EmbedRequest(String model, Content content) {
        record Content(List<Part> parts) {
        }

        record Part(String text) {
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbedResponse(Embedding embedding) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Embedding(List<Double> values) {
        }
    }
}
