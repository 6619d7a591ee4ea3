package com.mafiaindexer.ingestion.adapter;

/**
 * The live log subscription failed to open, was rejected, or dropped.
 */
public class LiveSubscriptionException extends RuntimeException {

    public LiveSubscriptionException(String message) {
        super(message);
    }

    public LiveSubscriptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
