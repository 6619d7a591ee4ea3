package com.mafiaindexer.ingestion.source;

/**
 * Mutually exclusive delivery modes of {@link EventSource}.
 */
public enum SourceMode {
    /** Push: log subscription over WebSocket. */
    LIVE,
    /** Pull: periodic head poll plus range fetch. Entered after repeated live failures. */
    FALLBACK
}
