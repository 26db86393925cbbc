package dev.cvevaluator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Content-safety screening and injection detection settings.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "app.screening")
public class ScreeningProperties {

    private boolean enabled = false;
    private String baseUrl;
    private String projectId;
    private String location = "asia-southeast1";
    private String templateId = "cv-evaluator";
    private String accessToken;
    private Duration requestTimeout = Duration.ofSeconds(30);
    private int injectionMaxChars = 8000;

    /**
     * Resource name of the screening template, e.g.
     * {@code projects/p/locations/l/templates/t}.
     */
    public String getTemplateName() {
        return String.format("projects/%s/locations/%s/templates/%s", projectId, location, templateId);
    }
}
