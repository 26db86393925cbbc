package dev.cvevaluator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Knowledge-base documents loaded into the vector store at startup.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "app.ingest")
public class IngestProperties {

    private boolean enabled = false;
    private List<Source> sources = new ArrayList<>();

    @Data
    public static class Source {
        private String path;
        private String documentType;
        private String namespace;
        private String jobTitle;
    }
}
