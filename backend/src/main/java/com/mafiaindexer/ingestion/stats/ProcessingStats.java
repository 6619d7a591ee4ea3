package com.mafiaindexer.ingestion.stats;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time copy of the processing counters.
 *
 * @param eventsByKind stored events per event name, only kinds seen so far
 */
public record ProcessingStats(
        long transactionsProcessed,
        long eventsProcessed,
        Map<String, Long> eventsByKind,
        long duplicatesSkipped,
        long partialDecodes,
        long handlerErrors,
        long droppedTransactions,
        long errors,
        Long lastProcessedSlot,
        Instant startTime
) {
}
