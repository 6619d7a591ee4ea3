package com.mafiaindexer.ingestion.store;

public enum StoreOutcome {
    INSERTED,
    /** A row with the same dedup key already exists; nothing written. */
    DUPLICATE
}
