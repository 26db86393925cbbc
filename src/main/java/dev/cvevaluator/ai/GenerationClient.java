package dev.cvevaluator.ai;

import dev.cvevaluator.config.AiProperties;
import dev.cvevaluator.exception.SchemaValidationException;
import dev.cvevaluator.metrics.EvaluationMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Model calls with the two-level failure policy: an outer backoff retry for transient provider
 * errors and, for structured calls, an inner one-shot escalation to the fallback model when the
 * output fails schema validation. A retry re-runs the whole primary-then-fallback sequence.
 *
 * <p>Usage is recorded on the {@link UsageTracker} found in the subscriber context, if any.
 */
@Slf4j
@Service
public class GenerationClient {

    private final GenerationProvider provider;
    private final RetryPolicy retryPolicy;
    private final ModelJsonParser parser;
    private final EvaluationMetrics metrics;
    private final AiProperties properties;

    public GenerationClient(GenerationProvider provider, RetryPolicy retryPolicy, ModelJsonParser parser,
                            EvaluationMetrics metrics, AiProperties properties) {
        this.provider = provider;
        this.retryPolicy = retryPolicy;
        this.parser = parser;
        this.metrics = metrics;
        this.properties = properties;
    }

    /**
     * Free-text generation. Empty text is a valid result; callers decide how to substitute it.
     */
    public Mono<GenerationResponse> generateText(String systemPrompt, String userPrompt, ModelTier tier,
                                                 double temperature, int maxOutputTokens) {
        return Mono.deferContextual(context -> {
            UsageTracker usage = UsageTracker.from(context);
            GenerationRequest request = new GenerationRequest(
                    modelFor(tier), systemPrompt, userPrompt, temperature, maxOutputTokens, null);

            return Mono.defer(() -> call(request, usage))
                    .retryWhen(retryPolicy.backoff("text generation", () -> onRetry(usage)));
        });
    }

    /**
     * Schema-validated generation.
     *
     * @return Mono with the parsed and validated value, or a {@link SchemaValidationException}
     *         when both the first model and the fallback produced no valid output
     */
    public <T> Mono<T> generateStructured(String systemPrompt, String userPrompt, StructuredOutputSpec<T> spec) {
        return Mono.deferContextual(context -> {
            UsageTracker usage = UsageTracker.from(context);

            return Mono.defer(() -> attemptWithFallback(systemPrompt, userPrompt, spec, usage))
                    .retryWhen(retryPolicy.backoff(spec.name(), () -> onRetry(usage)));
        });
    }

    public String modelFor(ModelTier tier) {
        return tier == ModelTier.PRIMARY ? properties.getPrimaryModel() : properties.getFastModel();
    }

    private <T> Mono<T> attemptWithFallback(String systemPrompt, String userPrompt, StructuredOutputSpec<T> spec,
                                            UsageTracker usage) {
        FallbackPolicy fallback = spec.fallback();

        return attempt(systemPrompt, userPrompt, spec, spec.tier(), spec.temperature(), spec.maxOutputTokens(), usage)
                .onErrorResume(SchemaValidationException.class, primaryError -> {
                    log.warn("{} output from {} failed validation ({}); escalating to {} at temperature {}",
                            spec.name(), modelFor(spec.tier()), primaryError.getMessage(),
                            modelFor(fallback.tier()), fallback.temperature());
                    usage.recordFallback();
                    metrics.recordLlmFallback();

                    return attempt(systemPrompt, userPrompt, spec, fallback.tier(), fallback.temperature(),
                            fallback.maxOutputTokens(), usage)
                            .onErrorMap(SchemaValidationException.class, fallbackError -> new SchemaValidationException(
                                    "Both primary and fallback models produced no valid output for " + spec.name()
                                            + ": " + fallbackError.getMessage(), fallbackError));
                });
    }

    private <T> Mono<T> attempt(String systemPrompt, String userPrompt, StructuredOutputSpec<T> spec,
                                ModelTier tier, double temperature, int maxOutputTokens, UsageTracker usage) {
        GenerationRequest request = new GenerationRequest(
                modelFor(tier), systemPrompt, userPrompt, temperature, maxOutputTokens, spec.schema());

        return call(request, usage).map(response -> {
            T value = parser.parse(response.text(), spec.type());
            spec.validator().validate(value);
            return value;
        });
    }

    private Mono<GenerationResponse> call(GenerationRequest request, UsageTracker usage) {
        return provider.generate(request)
                .doOnNext(response -> {
                    usage.recordCall(response.totalTokens());
                    metrics.recordLlmCall(request.model());
                    log.debug("{} call to {} finished ({} tokens, finish reason {})",
                            provider.getName(), request.model(), response.totalTokens(), response.finishReason());
                });
    }

    private void onRetry(UsageTracker usage) {
        usage.recordRetry();
        metrics.recordLlmRetry();
    }
}
