package com.mafiaindexer.ingestion.adapter;

import com.mafiaindexer.common.RetryPolicy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Picks the Solana RPC url for the next attempt. Urls that failed recently are benched for a cooldown
 * and skipped while a healthy one remains; when every url is benched plain round-robin applies.
 */
public class RpcEndpointRotator {

    static final Duration DEFAULT_COOLDOWN = Duration.ofSeconds(30);

    private final List<String> endpoints;
    private final RetryPolicy retryPolicy;
    private final Duration cooldown;
    private final Clock clock;
    private final AtomicInteger cursor = new AtomicInteger();
    private final Map<String, Instant> benchedUntil = new ConcurrentHashMap<>();

    public RpcEndpointRotator(List<String> endpoints, RetryPolicy retryPolicy) {
        this(endpoints, retryPolicy, DEFAULT_COOLDOWN, Clock.systemUTC());
    }

    public RpcEndpointRotator(List<String> endpoints, RetryPolicy retryPolicy, Duration cooldown) {
        this(endpoints, retryPolicy, cooldown, Clock.systemUTC());
    }

    RpcEndpointRotator(List<String> endpoints, RetryPolicy retryPolicy, Duration cooldown, Clock clock) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one RPC url required");
        }
        this.endpoints = List.copyOf(endpoints);
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
        this.cooldown = cooldown;
        this.clock = clock;
    }

    public String getNextEndpoint() {
        Instant now = clock.instant();
        int size = endpoints.size();
        int start = cursor.getAndIncrement();
        for (int i = 0; i < size; i++) {
            String candidate = endpoints.get(Math.floorMod(start + i, size));
            Instant until = benchedUntil.get(candidate);
            if (until == null || !now.isBefore(until)) {
                if (i > 0) {
                    cursor.set(start + i + 1);
                }
                return candidate;
            }
        }
        return endpoints.get(Math.floorMod(start, size));
    }

    public void markFailed(String endpoint) {
        if (endpoints.size() > 1) {
            benchedUntil.put(endpoint, clock.instant().plus(cooldown));
        }
    }

    public void markHealthy(String endpoint) {
        benchedUntil.remove(endpoint);
    }

    /**
     * Delay in ms before the retry that follows the given 0-based attempt.
     */
    public long retryDelayMs(int attempt) {
        return retryPolicy.delayMs(attempt);
    }

    public int getMaxAttempts() {
        return retryPolicy.getMaxAttempts();
    }

    public List<String> getEndpoints() {
        return endpoints;
    }
}
