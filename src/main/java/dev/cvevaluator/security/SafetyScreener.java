package dev.cvevaluator.security;

import dev.cvevaluator.model.ScreeningResult;
import reactor.core.publisher.Mono;

/**
 * Content-safety screening of uploaded files, outbound prompts and inbound model responses.
 * Implementations fail open: a screening outage yields an allow verdict.
 */
public interface SafetyScreener {

    /**
     * Screen an uploaded file before its text is extracted.
     *
     * @param content  raw file bytes
     * @param mimeType declared media type of the file
     * @return Mono with the verdict
     */
    Mono<ScreeningResult> screenFile(byte[] content, String mimeType);

    /**
     * Screen a prompt before it is sent to a model.
     */
    Mono<ScreeningResult> screenPrompt(String text);

    /**
     * Screen model output before it is stored.
     */
    Mono<ScreeningResult> screenResponse(String text);

    boolean isEnabled();
}
