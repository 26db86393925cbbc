package dev.cvevaluator.security;

import dev.cvevaluator.model.ScreeningResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * No-op implementation of SafetyScreener.
 * Used when content-safety screening is not enabled.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.screening.enabled", havingValue = "false", matchIfMissing = true)
public class NoOpSafetyScreener implements SafetyScreener {

    public NoOpSafetyScreener() {
        log.info("Content-safety screening disabled - using no-op screener");
    }

    @Override
    public Mono<ScreeningResult> screenFile(byte[] content, String mimeType) {
        return Mono.just(ScreeningResult.allowed());
    }

    @Override
    public Mono<ScreeningResult> screenPrompt(String text) {
        return Mono.just(ScreeningResult.allowed());
    }

    @Override
    public Mono<ScreeningResult> screenResponse(String text) {
        return Mono.just(ScreeningResult.allowed());
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
