package com.mafiaindexer.ingestion.dispatch;

/**
 * A handler rejected or failed to apply an event. The stored raw event is kept and marked FAILED.
 */
public class EventHandlerException extends RuntimeException {

    public EventHandlerException(String message) {
        super(message);
    }

    public EventHandlerException(String message, Throwable cause) {
        super(message, cause);
    }
}
