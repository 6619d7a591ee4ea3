package com.mafiaindexer.indexer;

public enum ReplayStatus {
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isActive() {
        return this == QUEUED || this == PROCESSING;
    }
}
