package com.mafiaindexer.domain;

/**
 * How an event was recovered from a transaction.
 */
public enum EventOrigin {
    /** Decoded from a "Program data:" payload by discriminator. */
    PROGRAM_DATA,
    /** Regex-extracted from human-readable log text; reduced fidelity. */
    LOG_TEXT
}
