package com.mafiaindexer.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A ledger transaction that mentions the indexed program, as delivered by either the live log subscription
 * or the poll adapter. {@code blockTime} and {@code feePayer} are null when the source does not provide them.
 */
public record ProgramTransaction(
        String signature,
        long slot,
        Instant blockTime,
        List<String> logs,
        boolean failed,
        String feePayer
) {

    public ProgramTransaction {
        Objects.requireNonNull(signature, "signature");
        logs = logs != null ? List.copyOf(logs) : List.of();
    }

    public static ProgramTransaction of(String signature, long slot, List<String> logs) {
        return new ProgramTransaction(signature, slot, null, logs, false, null);
    }
}
