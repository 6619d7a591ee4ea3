package com.mafiaindexer.ingestion.source;

/**
 * Inclusive slot range.
 */
public record SlotRange(long start, long end) {

    public boolean isEmpty() {
        return end < start;
    }

    /**
     * Trailing window replayed at startup: {@code [max(0, checkpoint - window), checkpoint]}.
     */
    public static SlotRange backfillWindow(long checkpoint, long window) {
        return new SlotRange(Math.max(0, checkpoint - window), checkpoint);
    }
}
