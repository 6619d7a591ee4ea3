package com.mafiaindexer.domain;

/**
 * Lifecycle of the indexer. Forward transitions only, plus ERRORED from an active state.
 */
public enum IndexerState {
    STOPPED,
    STARTING,
    RUNNING,
    STOPPING,
    ERRORED;

    public boolean canTransitionTo(IndexerState next) {
        return switch (this) {
            case STOPPED -> next == STARTING;
            case STARTING -> next == RUNNING || next == STOPPING || next == ERRORED;
            case RUNNING -> next == STOPPING || next == ERRORED;
            case STOPPING -> next == STOPPED;
            case ERRORED -> next == STARTING || next == STOPPED;
        };
    }

    public boolean isActive() {
        return this == STARTING || this == RUNNING;
    }
}
