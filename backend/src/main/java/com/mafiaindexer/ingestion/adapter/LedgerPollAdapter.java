package com.mafiaindexer.ingestion.adapter;

import com.mafiaindexer.domain.ProgramTransaction;

import java.util.List;
import java.util.Optional;

/**
 * Pull access to the ledger: chain head, the program's signatures in a slot range and the transactions behind
 * them. Used by the fallback poll loop, startup backfill, reindexing and single-signature replay.
 * All methods throw {@link RpcException} when the node cannot be reached after retries.
 */
public interface LedgerPollAdapter {

    long currentSlot();

    /**
     * Signatures of successful program transactions with {@code start <= slot <= end}, ascending by slot.
     * The whole range is listed in one backwards walk so callers can batch over it without re-reading pages.
     */
    List<SignatureRef> signaturesInRange(long start, long end);

    /**
     * Transactions for the given signatures, in the same order. Signatures the node no longer returns are left out.
     */
    List<ProgramTransaction> fetchTransactions(List<SignatureRef> signatures);

    /**
     * A single transaction by signature, failed ones included, or empty when the node does not know it.
     */
    Optional<ProgramTransaction> transaction(String signature);
}
