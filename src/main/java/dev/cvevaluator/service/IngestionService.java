package dev.cvevaluator.service;

import dev.cvevaluator.config.IngestProperties;
import dev.cvevaluator.document.TextExtractor;
import dev.cvevaluator.exception.ValidationException;
import dev.cvevaluator.rag.Chunk;
import dev.cvevaluator.rag.RetrievalClient;
import dev.cvevaluator.rag.TextChunker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads reference documents (job descriptions, case study briefs, scoring rubrics) into the
 * vector store so the scoring stages can retrieve them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionService {

    private final TextExtractor textExtractor;
    private final TextChunker textChunker;
    private final RetrievalClient retrievalClient;

    /**
     * Read, chunk and upsert one source file.
     *
     * @return Mono with the number of vectors written
     */
    public Mono<Integer> ingest(IngestProperties.Source source) {
        return Mono.fromCallable(() -> read(source.getPath()))
                .flatMap(content -> textExtractor.extract(content, mimeTypeOf(source.getPath())))
                .flatMap(parsed -> {
                    List<Chunk> chunks = textChunker.chunk(parsed.text());
                    if (chunks.isEmpty()) {
                        log.warn("No text extracted from {}; nothing to ingest", source.getPath());
                        return Mono.just(0);
                    }
                    log.info("Ingesting {} ({} chunks) into namespace '{}' as {}",
                            source.getPath(), chunks.size(), source.getNamespace(), source.getDocumentType());
                    return retrievalClient.upsert(source.getNamespace(), chunks, metadataFor(source));
                });
    }

    private static Map<String, Object> metadataFor(IngestProperties.Source source) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("document_type", source.getDocumentType());
        if (source.getJobTitle() != null && !source.getJobTitle().isBlank()) {
            metadata.put("job_title", source.getJobTitle());
        }
        return metadata;
    }

    private static byte[] read(String path) {
        try {
            return Files.readAllBytes(Path.of(path));
        } catch (IOException e) {
            throw new ValidationException("Knowledge-base file is missing or unreadable: " + path);
        }
    }

    static String mimeTypeOf(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".pdf")) {
            return "application/pdf";
        }
        if (lower.endsWith(".md")) {
            return "text/markdown";
        }
        return "text/plain";
    }
}
