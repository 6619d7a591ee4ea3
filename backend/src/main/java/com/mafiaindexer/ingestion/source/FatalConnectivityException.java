package com.mafiaindexer.ingestion.source;

/**
 * Fallback polling exhausted its retries; the indexer cannot make progress without a restart.
 */
public class FatalConnectivityException extends RuntimeException {

    public FatalConnectivityException(String message, Throwable cause) {
        super(message, cause);
    }
}
