package dev.cvevaluator.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.cvevaluator.ai.RetryPolicy;
import dev.cvevaluator.ai.UsageTracker;
import dev.cvevaluator.config.OcrProperties;
import dev.cvevaluator.exception.ProviderException;
import dev.cvevaluator.exception.ProviderResponseException;
import dev.cvevaluator.metrics.EvaluationMetrics;
import dev.cvevaluator.model.ParsedContent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Text extraction through the Mistral OCR API. Plain-text uploads are decoded locally.
 */
@Slf4j
@Service
public class MistralOcrExtractor implements TextExtractor {

    private static final String PROVIDER = "Mistral OCR";

    private final WebClient webClient;
    private final OcrProperties properties;
    private final RetryPolicy retryPolicy;
    private final EvaluationMetrics metrics;

    public MistralOcrExtractor(OcrProperties properties, RetryPolicy retryPolicy, EvaluationMetrics metrics) {
        this.properties = properties;
        this.retryPolicy = retryPolicy;
        this.metrics = metrics;
        this.webClient = WebClient.builder()
                .baseUrl(Objects.requireNonNull(properties.getBaseUrl()))
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .build();
    }

    @Override
    public Mono<ParsedContent> extract(byte[] content, String mimeType) {
        if (content == null || content.length == 0) {
            return Mono.just(new ParsedContent("", 0));
        }
        if (mimeType != null && mimeType.startsWith("text/")) {
            return Mono.just(new ParsedContent(new String(content, StandardCharsets.UTF_8), 1));
        }

        String dataUrl = "data:" + (mimeType != null ? mimeType : "application/pdf") + ";base64,"
                + Base64.getEncoder().encodeToString(content);
        OcrRequest.Document document = mimeType != null && mimeType.startsWith("image/")
                ? new OcrRequest.Document("image_url", null, dataUrl)
                : new OcrRequest.Document("document_url", dataUrl, null);

        OcrRequest request = new OcrRequest(properties.getModel(), document, false);
        return Mono.deferContextual(context -> {
                    UsageTracker usage = UsageTracker.from(context);
                    return Mono.defer(() -> callOcr(request))
                            .retryWhen(retryPolicy.backoff("OCR extraction", () -> {
                                usage.recordRetry();
                                metrics.recordLlmRetry();
                            }));
                })
                .map(this::parseResponse)
                .doOnNext(parsed -> log.info("OCR extracted {} characters from {} pages",
                        parsed.text().length(), parsed.pages()));
    }

    private Mono<OcrResponse> callOcr(OcrRequest request) {
        return webClient.post()
                .uri("/v1/ocr")
                .contentType(Objects.requireNonNull(MediaType.APPLICATION_JSON))
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new ProviderException(PROVIDER, response.statusCode().value(), body)))
                .bodyToMono(OcrResponse.class)
                .timeout(properties.getRequestTimeout())
                .onErrorMap(DecodingException.class,
                        e -> new ProviderResponseException(PROVIDER, "body is not an OCR response", e))
                .switchIfEmpty(Mono.error(() -> new ProviderResponseException(PROVIDER, "empty body")));
    }

    ParsedContent parseResponse(OcrResponse response) {
        if (response.pages() == null) {
            throw new ProviderResponseException(PROVIDER, "missing pages");
        }
        String text = response.pages().stream()
                .map(OcrResponse.Page::markdown)
                .filter(Objects::nonNull)
                .collect(Collectors.joining("\n\n"));
        return new ParsedContent(text, response.pages().size());
    }

    // Request DTOs
    record OcrRequest(
            String model,
            Document document,
            @JsonProperty("include_image_base64") boolean includeImageBase64) {

        @JsonInclude(JsonInclude.Include.NON_NULL)
        record Document(
                String type,
                @JsonProperty("document_url") String documentUrl,
                @JsonProperty("image_url") String imageUrl) {
        }
    }

    // Response DTOs
    @JsonIgnoreProperties(ignoreUnknown = true)
    record OcrResponse(List<Page> pages, String model) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Page(Integer index, String markdown) {
        }
    }
}
