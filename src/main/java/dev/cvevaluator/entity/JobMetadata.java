package dev.cvevaluator.entity;

import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Advisory counters collected while a job runs.
 */
@Data
@Builder
@Embeddable
@NoArgsConstructor
@AllArgsConstructor
public class JobMetadata {

    private int llmCallsCount;
    private long totalTokensUsed;
    private int retryCount;
    private int fallbackCount;
    private int securityWarnings;
    private long processingTimeMs;
}
