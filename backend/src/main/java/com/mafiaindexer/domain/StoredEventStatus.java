package com.mafiaindexer.domain;

public enum StoredEventStatus {
    /** Stored, handler not yet finished. */
    PENDING,
    PROCESSED,
    /** Handler failed; raw event kept for manual replay. */
    FAILED
}
