package com.mafiaindexer.indexer;

import java.time.Instant;

/**
 * An out-of-band processing request and where it stands. Immutable; every status change is a new instance.
 * SIGNATURE requests carry {@code signature}; REINDEX requests carry {@code fromSlot} and, once resolved,
 * {@code toSlot}.
 */
public record ReplayRequest(
        String id,
        Kind kind,
        String signature,
        Long fromSlot,
        Long toSlot,
        ReplayStatus status,
        int transactionsProcessed,
        String error,
        Instant queuedAt,
        Instant finishedAt
) {

    public enum Kind {
        SIGNATURE,
        REINDEX
    }

    static ReplayRequest forSignature(String signature) {
        return new ReplayRequest(signature, Kind.SIGNATURE, signature, null, null, ReplayStatus.QUEUED, 0, null,
                Instant.now(), null);
    }

    static ReplayRequest forReindex(String id, long fromSlot, Long toSlot) {
        return new ReplayRequest(id, Kind.REINDEX, null, fromSlot, toSlot, ReplayStatus.QUEUED, 0, null,
                Instant.now(), null);
    }

    ReplayRequest processing() {
        return new ReplayRequest(id, kind, signature, fromSlot, toSlot, ReplayStatus.PROCESSING, 0, null,
                queuedAt, null);
    }

    ReplayRequest completed(Long resolvedToSlot, int processed) {
        return new ReplayRequest(id, kind, signature, fromSlot, resolvedToSlot, ReplayStatus.COMPLETED, processed,
                null, queuedAt, Instant.now());
    }

    ReplayRequest failed(String reason) {
        return new ReplayRequest(id, kind, signature, fromSlot, toSlot, ReplayStatus.FAILED, transactionsProcessed,
                reason, queuedAt, Instant.now());
    }
}
