package com.mafiaindexer.ingestion.config;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Solana endpoints: HTTP JSON-RPC urls (rotated round-robin) and the WebSocket url for log subscriptions.
 */
@ConfigurationProperties(prefix = "mafiaindexer.ingestion.rpc")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class IngestionRpcProperties {

    private List<String> urls = new ArrayList<>(List.of("https://api.devnet.solana.com"));

    /** Derived from the first HTTP url (http→ws) when blank. */
    private String wsUrl;

    /** Local limiter for JSON-RPC calls. */
    @Min(1)
    private int maxRequestsPerSecond = 10;

    /** Max wait for a limiter permit before the call fails. */
    @Min(0)
    private long localLimiterTimeoutMs = 5_000;

    /** Max signatures per getSignaturesForAddress page (Solana RPC limit 1 to 1000). */
    @Min(1)
    private int signaturesLimit = 1000;

    /** Per-request timeout for HTTP JSON-RPC calls. */
    @Min(1)
    private long requestTimeoutMs = 30_000;

    /** How long a failing url is skipped while another one is healthy. */
    @Min(0)
    private long endpointCooldownMs = 30_000;

    public String resolveWsUrl() {
        if (wsUrl != null && !wsUrl.isBlank()) {
            return wsUrl;
        }
        String http = urls.isEmpty() ? "https://api.devnet.solana.com" : urls.get(0);
        return http.replaceFirst("^http", "ws");
    }
}
