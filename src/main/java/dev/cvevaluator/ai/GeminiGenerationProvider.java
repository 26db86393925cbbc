package dev.cvevaluator.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import dev.cvevaluator.config.AiProperties;
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
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Generation provider backed by the Google AI Studio (Gemini) REST API.
 * Uses API key authentication passed as a query parameter.
 */
@Slf4j
@Service
public class GeminiGenerationProvider implements GenerationProvider {

    static final String PROVIDER = "Gemini";
    private static final String GENERATE_PATH = "/v1beta/models/%s:generateContent";

    private final WebClient webClient;
    private final String apiKey;
    private final Duration requestTimeout;

    public GeminiGenerationProvider(AiProperties properties) {
        this.apiKey = properties.getApiKey();
        this.requestTimeout = properties.getRequestTimeout();
        this.webClient = WebClient.builder()
                .baseUrl(Objects.requireNonNull(properties.getBaseUrl()))
                .defaultHeader("Content-Type", "application/json")
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                .build();

        if (apiKey == null || apiKey.isBlank()) {
            log.warn("Gemini API Key is missing! Evaluations will fail at the first generation call.");
        } else {
            log.info("Gemini generation enabled (primary: {}, fast: {})",
                    properties.getPrimaryModel(), properties.getFastModel());
        }
    }

    @Override
    public Mono<GenerationResponse> generate(GenerationRequest request) {
        String uri = String.format(GENERATE_PATH, request.model()) + "?key=" + apiKey;

        return webClient.post()
                .uri(uri)
                .contentType(Objects.requireNonNull(MediaType.APPLICATION_JSON))
                .bodyValue(buildRequest(request))
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new ProviderException(PROVIDER, response.statusCode().value(), abbreviate(body))))
                .bodyToMono(GeminiResponse.class)
                .timeout(requestTimeout)
                .onErrorMap(DecodingException.class,
                        e -> new ProviderResponseException(PROVIDER, "body is not a generateContent response", e))
                .switchIfEmpty(Mono.error(() -> new ProviderResponseException(PROVIDER, "empty body")))
                .map(this::parseResponse);
    }

    @Override
    public String getName() {
        return PROVIDER;
    }

    GeminiRequest buildRequest(GenerationRequest request) {
        GeminiRequest.Content system = request.systemPrompt() == null || request.systemPrompt().isBlank()
                ? null
                : new GeminiRequest.Content(null, List.of(new GeminiRequest.Part(request.systemPrompt())));

        GeminiRequest.GenerationConfig config = new GeminiRequest.GenerationConfig(
                request.temperature(),
                request.maxOutputTokens(),
                request.isStructured() ? "application/json" : null,
                request.responseSchema());

        return new GeminiRequest(
                system,
                List.of(new GeminiRequest.Content("user", List.of(new GeminiRequest.Part(request.userPrompt())))),
                config);
    }

    /**
     * Maps the documented generateContent response. A response without candidates (for example
     * a prompt rejected by the vendor's own filter) is an empty generation, not a parse error.
     */
    GenerationResponse parseResponse(GeminiResponse response) {
        long tokens = response.usageMetadata() != null && response.usageMetadata().totalTokenCount() != null
                ? response.usageMetadata().totalTokenCount()
                : 0L;

        if (response.candidates() == null || response.candidates().isEmpty()) {
            String blockReason = response.promptFeedback() != null ? response.promptFeedback().blockReason() : null;
            log.warn("Gemini returned no candidates (block reason: {})", blockReason);
            return new GenerationResponse("", blockReason, tokens);
        }

        GeminiResponse.Candidate candidate = response.candidates().get(0);
        if (candidate.finishReason() != null && !"STOP".equals(candidate.finishReason())) {
            log.warn("Gemini finish reason: {}", candidate.finishReason());
        }

        if (candidate.content() == null || candidate.content().parts() == null) {
            return new GenerationResponse("", candidate.finishReason(), tokens);
        }

        String text = candidate.content().parts().stream()
                .map(GeminiResponse.Part::text)
                .filter(Objects::nonNull)
                .collect(Collectors.joining());

        return new GenerationResponse(text, candidate.finishReason(), tokens);
    }

    private static String abbreviate(String body) {
        return body.length() > 300 ? body.substring(0, 300) + "..." : body;
    }

    // Request DTOs
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record GeminiRequest(
            Content systemInstruction,
            List<Content> contents,
            GenerationConfig generationConfig) {

        @JsonInclude(JsonInclude.Include.NON_NULL)
        record Content(String role, List<Part> parts) {
        }

        record Part(String text) {
        }

        @JsonInclude(JsonInclude.Include.NON_NULL)
        record GenerationConfig(
                double temperature,
                int maxOutputTokens,
                String responseMimeType,
                Map<String, Object> responseSchema) {
        }
    }

    // Response DTOs
    @JsonIgnoreProperties(ignoreUnknown = true)
    record GeminiResponse(List<Candidate> candidates, PromptFeedback promptFeedback, UsageMetadata usageMetadata) {

        @JsonIgnoreProperties(ignoreUnknown = true)
        record Candidate(Content content, String finishReason) {
        }

        @JsonIgnoreProperties(ignoreUnknown = true)
        record Content(List<Part> parts) {
        }

        @JsonIgnoreProperties(ignoreUnknown = true)
        record Part(String text) {
        }

        @JsonIgnoreProperties(ignoreUnknown = true)
        record PromptFeedback(String blockReason) {
        }

        @JsonIgnoreProperties(ignoreUnknown = true)
        record UsageMetadata(Long totalTokenCount) {
        }
    }
}
