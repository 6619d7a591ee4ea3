package com.mafiaindexer.ingestion.adapter;

import com.mafiaindexer.domain.ProgramTransaction;
import reactor.core.publisher.Flux;

/**
 * Push access to the ledger: a subscription to the indexed program's logs.
 */
public interface LogSubscriptionAdapter {

    /**
     * Cold stream; each subscription opens a new connection. Completes or errors with
     * {@link LiveSubscriptionException} when the connection ends.
     */
    Flux<ProgramTransaction> subscribe();
}
