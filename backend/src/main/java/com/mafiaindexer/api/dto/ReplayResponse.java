package com.mafiaindexer.api.dto;

import com.mafiaindexer.indexer.ReplayRequest;

import java.time.Instant;

/**
 * Replay or reindex request as returned by the replay endpoints.
 */
public record ReplayResponse(
        String id,
        String kind,
        String status,
        String signature,
        Long fromSlot,
        Long toSlot,
        int transactionsProcessed,
        String error,
        Instant queuedAt,
        Instant finishedAt
) {

    public static ReplayResponse from(ReplayRequest request) {
        return new ReplayResponse(
                request.id(),
                request.kind().name(),
                request.status().name(),
                request.signature(),
                request.fromSlot(),
                request.toSlot(),
                request.transactionsProcessed(),
                request.error(),
                request.queuedAt(),
                request.finishedAt());
    }
}
