package com.mafiaindexer.ingestion.dispatch;

/**
 * Wraps the last storage failure of a transaction unit whose retries were exhausted.
 */
public class TransactionUnitException extends RuntimeException {

    private final String signature;

    public TransactionUnitException(String signature, int attempts, Throwable cause) {
        super("Transaction " + signature + " dropped after " + attempts + " storage attempt(s)", cause);
        this.signature = signature;
    }

    public String getSignature() {
        return signature;
    }
}
