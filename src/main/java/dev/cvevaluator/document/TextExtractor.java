package dev.cvevaluator.document;

import dev.cvevaluator.model.ParsedContent;
import reactor.core.publisher.Mono;

/**
 * Turns an uploaded file into plain text.
 */
public interface TextExtractor {

    /**
     * Extract text from a document.
     *
     * @param content  raw file bytes
     * @param mimeType declared media type
     * @return Mono with the text and page count; blank text is a valid outcome
     */
    Mono<ParsedContent> extract(byte[] content, String mimeType);
}
