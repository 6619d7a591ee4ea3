package com.mafiaindexer.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * RPC retry policy (exponential backoff ± jitter). Documented in application.yml.
 */
@ConfigurationProperties(prefix = "mafiaindexer.ingestion.retry")
@NoArgsConstructor
@Getter
@Setter
public class IngestionRetryProperties {

    /** Base delay in ms for first retry; doubles each attempt. Default 500. */
    private long baseDelayMs = 500L;

    /** Jitter factor 0..1 (e.g. 0.2 = ±20%). Default 0.2. */
    private double jitterFactor = 0.2;

    /** Max attempts per RPC call including the first. Default 3. */
    private int maxAttempts = 3;
}
