package com.mafiaindexer.ingestion.decoder;

import java.time.Instant;

/**
 * Transaction coordinates of one encoded event.
 */
public record DecodeContext(String signature, long slot, Instant blockTime, int instructionIndex, int eventIndex) {
}
