package com.mafiaindexer.ingestion.stats;

import com.mafiaindexer.domain.EventKind;
import com.mafiaindexer.domain.ParsedEvent;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single owner of the indexer's counters. Counters only grow; {@link #reset()} is used when a new run starts.
 */
@Component
public class ProcessingStatsTracker {

    private static final long NO_SLOT = -1L;

    private final AtomicLong transactionsProcessed = new AtomicLong();
    private final AtomicLong eventsProcessed = new AtomicLong();
    private final Map<EventKind, AtomicLong> eventsByKind = new EnumMap<>(EventKind.class);
    private final AtomicLong duplicatesSkipped = new AtomicLong();
    private final AtomicLong partialDecodes = new AtomicLong();
    private final AtomicLong handlerErrors = new AtomicLong();
    private final AtomicLong droppedTransactions = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final AtomicLong lastProcessedSlot = new AtomicLong(NO_SLOT);
    private final AtomicReference<Instant> startTime = new AtomicReference<>();

    public ProcessingStatsTracker() {
        for (EventKind kind : EventKind.values()) {
            eventsByKind.put(kind, new AtomicLong());
        }
    }

    public void reset() {
        transactionsProcessed.set(0);
        eventsProcessed.set(0);
        eventsByKind.values().forEach(c -> c.set(0));
        duplicatesSkipped.set(0);
        partialDecodes.set(0);
        handlerErrors.set(0);
        droppedTransactions.set(0);
        errors.set(0);
        lastProcessedSlot.set(NO_SLOT);
        startTime.set(Instant.now());
    }

    public void recordStored(ParsedEvent event) {
        eventsProcessed.incrementAndGet();
        eventsByKind.get(event.kind()).incrementAndGet();
        if (event.partial()) {
            partialDecodes.incrementAndGet();
        }
    }

    public void recordDuplicate() {
        duplicatesSkipped.incrementAndGet();
    }

    public void recordHandlerError() {
        handlerErrors.incrementAndGet();
        errors.incrementAndGet();
    }

    public void recordTransactionCommitted(long slot) {
        transactionsProcessed.incrementAndGet();
        lastProcessedSlot.accumulateAndGet(slot, Math::max);
    }

    public void recordTransactionDropped() {
        droppedTransactions.incrementAndGet();
        errors.incrementAndGet();
    }

    public void recordError() {
        errors.incrementAndGet();
    }

    public ProcessingStats snapshot() {
        Map<String, Long> byKind = new LinkedHashMap<>();
        eventsByKind.forEach((kind, count) -> {
            long n = count.get();
            if (n > 0) {
                byKind.put(kind.getEventName(), n);
            }
        });
        long slot = lastProcessedSlot.get();
        return new ProcessingStats(
                transactionsProcessed.get(),
                eventsProcessed.get(),
                Collections.unmodifiableMap(byKind),
                duplicatesSkipped.get(),
                partialDecodes.get(),
                handlerErrors.get(),
                droppedTransactions.get(),
                errors.get(),
                slot == NO_SLOT ? null : slot,
                startTime.get());
    }
}
