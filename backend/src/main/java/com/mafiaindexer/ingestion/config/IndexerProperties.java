package com.mafiaindexer.ingestion.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Indexer behaviour: program to index, source mode switching, backfill window and retry budgets.
 * Documented in application.yml.
 */
@ConfigurationProperties(prefix = "mafiaindexer.indexer")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class IndexerProperties {

    /** Solana Base58 program id whose events are indexed. */
    @NotBlank
    @Pattern(regexp = "^[1-9A-HJ-NP-Za-km-z]{32,44}$")
    private String programId;

    /** Start the indexer when the application is ready. */
    private boolean autoStart = true;

    /** Commitment for subscription and RPC reads. */
    private String commitment = "confirmed";

    /** Fallback mode: interval between head-slot polls. */
    @Min(100)
    private long pollIntervalMs = 5_000;

    /** Fallback mode and backfill: slots per range fetch. */
    @Min(1)
    private int batchSize = 1000;

    /** Startup backfill: slots replayed below the checkpoint. */
    @Min(0)
    private long backfillWindowSlots = 500;

    /** Live mode: consecutive subscription failures before switching to fallback. */
    @Min(1)
    private int liveFailureThreshold = 3;

    /** Live mode: pause before resubscribing after a disconnect. */
    @Min(0)
    private long liveReconnectDelayMs = 500;

    /** Fallback mode: consecutive poll failures before the indexer is marked ERRORED. */
    @Min(1)
    private int maxRetries = 3;

    /** Fallback mode: base delay of the poll backoff; doubles per consecutive failure. */
    @Min(0)
    private long retryDelayMs = 10_000;

    /** Fallback mode: backoff ceiling. */
    @Min(0)
    private long maxRetryDelayMs = 300_000;

    /** Storage attempts per transaction unit before it is dropped. */
    @Min(1)
    private int storageMaxAttempts = 3;

    /** Base delay between storage attempts; doubles per attempt. */
    @Min(0)
    private long storageRetryBaseDelayMs = 100;

    /** Written to every stored event. */
    private String indexerVersion = "1.0.0";

    /** How often processing stats are logged. */
    private long statsLogIntervalMs = 60_000;
}
