package com.mafiaindexer.indexer;

import com.mafiaindexer.domain.IndexerState;
import com.mafiaindexer.ingestion.source.SourceMode;
import com.mafiaindexer.ingestion.stats.ProcessingStats;

import java.time.Duration;

/**
 * Point-in-time view for health checks.
 *
 * @param uptime           zero unless the indexer is starting or running
 * @param checkpointSlot   durable high-water mark, null before the first commit
 * @param lastError        message of the failure that put the indexer in ERRORED
 */
public record IndexerStatusSnapshot(
        IndexerState state,
        SourceMode mode,
        ProcessingStats stats,
        Duration uptime,
        Long checkpointSlot,
        int consecutiveLiveFailures,
        String lastError
) {

    public boolean healthy() {
        return state == IndexerState.RUNNING;
    }
}
