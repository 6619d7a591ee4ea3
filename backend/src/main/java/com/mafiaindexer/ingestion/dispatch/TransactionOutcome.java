package com.mafiaindexer.ingestion.dispatch;

public enum TransactionOutcome {
    /** Unit committed: new events stored and handled, duplicates skipped, checkpoint advanced. */
    COMMITTED,
    /** Failed on chain, or already committed recently; nothing done. */
    SKIPPED,
    /** Storage retries exhausted; logged with the signature for manual replay. */
    DROPPED,
    /** Stop requested while waiting to retry. */
    INTERRUPTED
}
