package dev.cvevaluator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Worker pool settings.
 * A job occupies one slot for its whole run, retry sleeps included.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "app.queue")
public class QueueProperties {

    private int concurrency = 5;
    private Duration jobTimeout = Duration.ofMinutes(5);
    private int maxDeliveryAttempts = 1;
}
