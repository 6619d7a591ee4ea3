package com.mafiaindexer.ingestion.adapter.solana;

import reactor.core.publisher.Mono;

/**
 * Solana JSON-RPC client abstraction for testing and endpoint rotation.
 * Methods used: getSlot, getSignaturesForAddress, getTransaction. Retries are handled by the adapter.
 */
public interface SolanaRpcClient {

    Mono<String> call(String endpointUrl, String method, Object params);
}
