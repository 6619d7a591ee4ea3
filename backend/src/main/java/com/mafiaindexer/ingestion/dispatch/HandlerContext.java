package com.mafiaindexer.ingestion.dispatch;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Instant;

/**
 * What a handler gets besides the event: the transaction it came from, the transaction-bound MongoTemplate
 * and a failure boundary for secondary side effects.
 */
@Slf4j
public final class HandlerContext {

    private final String signature;
    private final long slot;
    private final Instant blockTime;
    private final MongoTemplate mongoTemplate;

    public HandlerContext(String signature, long slot, Instant blockTime, MongoTemplate mongoTemplate) {
        this.signature = signature;
        this.slot = slot;
        this.blockTime = blockTime;
        this.mongoTemplate = mongoTemplate;
    }

    public String signature() {
        return signature;
    }

    public long slot() {
        return slot;
    }

    /** Null when the source did not report it (live notifications). */
    public Instant blockTime() {
        return blockTime;
    }

    public MongoTemplate mongoTemplate() {
        return mongoTemplate;
    }

    /**
     * Runs a secondary action (point award, cache eviction, ...). A failure is logged, never
     * propagated, so it cannot undo the handler's primary state change.
     */
    public boolean sideEffect(String name, Runnable action) {
        try {
            action.run();
            return true;
        } catch (RuntimeException e) {
            log.warn("Side effect '{}' failed for tx {}: {}", name, signature, e.getMessage(), e);
            return false;
        }
    }
}
