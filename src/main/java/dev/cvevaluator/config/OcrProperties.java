package dev.cvevaluator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "app.ocr")
public class OcrProperties {

    private String apiKey;
    private String baseUrl = "https://api.mistral.ai";
    private String model = "mistral-ocr-latest";
    private Duration requestTimeout = Duration.ofSeconds(120);
}
