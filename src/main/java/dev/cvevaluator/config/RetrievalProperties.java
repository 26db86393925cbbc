package dev.cvevaluator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Embedding and vector store settings.
 * Loaded from application.yml under 'app.retrieval' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "app.retrieval")
public class RetrievalProperties {

    private Embedding embedding = new Embedding();
    private VectorStore vectorStore = new VectorStore();

    @Data
    public static class Embedding {
        private String model = "text-embedding-004";
        private int maxAttempts = 3;
        private Duration retryBaseDelay = Duration.ofSeconds(2);
        private int batchSize = 10;
        private Duration batchDelay = Duration.ofMillis(500);
    }

    @Data
    public static class VectorStore {
        private String apiKey;
        private String indexHost;
        private int upsertBatchSize = 100;
        private Duration requestTimeout = Duration.ofSeconds(30);
    }
}
