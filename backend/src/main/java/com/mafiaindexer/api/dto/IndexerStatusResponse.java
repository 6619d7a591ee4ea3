package com.mafiaindexer.api.dto;

import com.mafiaindexer.indexer.IndexerStatusSnapshot;
import com.mafiaindexer.ingestion.stats.ProcessingStats;

import java.time.Instant;
import java.util.Map;

/**
 * GET /api/v1/indexer/status body.
 */
public record IndexerStatusResponse(
        String state,
        String mode,
        boolean healthy,
        long uptimeSeconds,
        Long checkpointSlot,
        int consecutiveLiveFailures,
        String lastError,
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

    public static IndexerStatusResponse from(IndexerStatusSnapshot snapshot) {
        ProcessingStats s = snapshot.stats();
        return new IndexerStatusResponse(
                snapshot.state().name(),
                snapshot.mode().name(),
                snapshot.healthy(),
                snapshot.uptime().getSeconds(),
                snapshot.checkpointSlot(),
                snapshot.consecutiveLiveFailures(),
                snapshot.lastError(),
                s.transactionsProcessed(),
                s.eventsProcessed(),
                s.eventsByKind(),
                s.duplicatesSkipped(),
                s.partialDecodes(),
                s.handlerErrors(),
                s.droppedTransactions(),
                s.errors(),
                s.lastProcessedSlot(),
                s.startTime());
    }
}
