package dev.cvevaluator.service;

import dev.cvevaluator.config.IngestProperties;
import dev.cvevaluator.rag.RetrievalClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Rebuilds the knowledge base at startup when {@code app.ingest.enabled=true}: every configured
 * namespace is purged once, then each source is ingested in order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.ingest.enabled", havingValue = "true")
public class KnowledgeBaseLoader implements CommandLineRunner {

    private static final String SEPARATOR = "========================================";

    private final IngestProperties properties;
    private final IngestionService ingestionService;
    private final RetrievalClient retrievalClient;

    @Override
    public void run(String... args) {
        log.info(SEPARATOR);
        log.info("Knowledge Base Ingestion Starting ({} sources)", properties.getSources().size());
        log.info(SEPARATOR);

        Set<String> namespaces = new LinkedHashSet<>();
        properties.getSources().forEach(source -> namespaces.add(source.getNamespace()));
        for (String namespace : namespaces) {
            try {
                retrievalClient.deleteNamespace(namespace).block();
            } catch (RuntimeException e) {
                log.warn("Could not clear namespace '{}' (it may not exist yet): {}", namespace, e.getMessage());
            }
        }

        int total = 0;
        for (IngestProperties.Source source : properties.getSources()) {
            Integer written = ingestionService.ingest(source).block();
            total += written != null ? written : 0;
        }

        log.info(SEPARATOR);
        log.info("Knowledge Base Ingestion Completed: {} vectors", total);
        log.info(SEPARATOR);
    }
}
