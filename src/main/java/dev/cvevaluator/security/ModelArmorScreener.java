package dev.cvevaluator.security;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import dev.cvevaluator.config.ScreeningProperties;
import dev.cvevaluator.exception.ProviderException;
import dev.cvevaluator.exception.ProviderResponseException;
import dev.cvevaluator.model.ScreeningResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * SafetyScreener backed by the Google Cloud Model Armor REST API.
 * Template management is done outside this service; only sanitize calls are issued here.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.screening.enabled", havingValue = "true")
public class ModelArmorScreener implements SafetyScreener {

    private static final String PROVIDER = "Model Armor";
    private static final String MATCH_FOUND = "MATCH_FOUND";

    private static final Map<String, String> BYTE_DATA_TYPES = Map.of(
            "application/pdf", "PDF",
            "text/plain", "PLAINTEXT_UTF8",
            "text/csv", "CSV",
            "application/vnd.openxmlformats-officedocument.wordprocessingml.document", "WORD_DOCUMENT");

    private final WebClient webClient;
    private final ScreeningProperties properties;

    public ModelArmorScreener(ScreeningProperties properties) {
        this.properties = properties;
        String baseUrl = properties.getBaseUrl() != null
                ? properties.getBaseUrl()
                : "https://modelarmor." + properties.getLocation() + ".rep.googleapis.com";
        this.webClient = WebClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getAccessToken())
                .defaultHeader("Content-Type", "application/json")
                .build();

        if (properties.getProjectId() == null || properties.getProjectId().isBlank()) {
            log.warn("Model Armor enabled but project id is not configured - screening calls will fail open");
        } else {
            log.info("Model Armor screening enabled with template: {}", properties.getTemplateName());
        }
    }

    @Override
    public Mono<ScreeningResult> screenFile(byte[] content, String mimeType) {
        String byteDataType = mimeType != null ? BYTE_DATA_TYPES.get(mimeType) : null;
        if (content == null || content.length == 0 || byteDataType == null) {
            log.debug("Skipping file screening for mime type {}", mimeType);
            return Mono.just(ScreeningResult.allowed());
        }
        SanitizeRequest request = SanitizeRequest.userPrompt(
                new DataItem(null, new ByteItem(byteDataType, Base64.getEncoder().encodeToString(content))));
        return sanitize("sanitizeUserPrompt", request, "file");
    }

    @Override
    public Mono<ScreeningResult> screenPrompt(String text) {
        if (text == null || text.isBlank()) {
            return Mono.just(ScreeningResult.allowed());
        }
        return sanitize("sanitizeUserPrompt", SanitizeRequest.userPrompt(new DataItem(text, null)), "prompt");
    }

    @Override
    public Mono<ScreeningResult> screenResponse(String text) {
        if (text == null || text.isBlank()) {
            return Mono.just(ScreeningResult.allowed());
        }
        return sanitize("sanitizeModelResponse", SanitizeRequest.modelResponse(new DataItem(text, null)), "response");
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    private Mono<ScreeningResult> sanitize(String method, SanitizeRequest request, String subject) {
        String uri = "/v1/" + properties.getTemplateName() + ":" + method;

        return webClient.post()
                .uri(uri)
                .contentType(Objects.requireNonNull(MediaType.APPLICATION_JSON))
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new ProviderException(PROVIDER, response.statusCode().value(), body)))
                .bodyToMono(SanitizeResponse.class)
                .timeout(properties.getRequestTimeout())
                .map(this::parseResponse)
                .doOnNext(result -> {
                    if (result.blocked()) {
                        log.warn("{} blocked by Model Armor: {}", subject, result.reasons());
                    }
                })
                .onErrorResume(e -> {
                    log.warn("Model Armor {} screening failed, allowing content: {}", subject, e.getMessage());
                    return Mono.just(ScreeningResult.allowed());
                });
    }

    /**
     * A verdict is a block only when the overall filter state is MATCH_FOUND; the reasons are
     * the names of the individual filters that matched.
     */
    ScreeningResult parseResponse(SanitizeResponse response) {
        if (response == null || response.sanitizationResult() == null) {
            throw new ProviderResponseException(PROVIDER, "missing sanitizationResult");
        }
        SanitizationResult result = response.sanitizationResult();
        if (!MATCH_FOUND.equals(result.filterMatchState())) {
            return ScreeningResult.allowed();
        }

        List<String> reasons = new ArrayList<>();
        if (result.filterResults() != null) {
            result.filterResults().forEach((filter, node) -> {
                boolean matched = node.findValuesAsText("matchState").stream().anyMatch(MATCH_FOUND::equals);
                if (matched) {
                    reasons.add(filter);
                }
            });
        }
        if (reasons.isEmpty()) {
            reasons.add("content policy violation");
        }
        return ScreeningResult.blocked(reasons);
    }

    // Request DTOs
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record SanitizeRequest(DataItem userPromptData, DataItem modelResponseData) {
        static SanitizeRequest userPrompt(DataItem item) {
            return new SanitizeRequest(item, null);
        }

        static SanitizeRequest modelResponse(DataItem item) {
            return new SanitizeRequest(null, item);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record DataItem(String text, ByteItem byteItem) {
    }

    record ByteItem(String byteDataType, String byteData) {
    }

    // Response DTOs
    @JsonIgnoreProperties(ignoreUnknown = true)
    record SanitizeResponse(SanitizationResult sanitizationResult) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SanitizationResult(String filterMatchState, Map<String, JsonNode> filterResults, String invocationResult) {
    }
}
