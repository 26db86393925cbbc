package dev.cvevaluator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Generation provider settings.
 * Loaded from application.yml under 'app.ai' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "app.ai")
public class AiProperties {

    private String apiKey;
    private String baseUrl = "https://generativelanguage.googleapis.com";
    private String primaryModel = "gemini-1.5-pro-latest";
    private String fastModel = "gemini-1.5-flash-latest";
    private Duration requestTimeout = Duration.ofSeconds(120);
    private Retry retry = new Retry();

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double jitter = 0.3;
    }
}
