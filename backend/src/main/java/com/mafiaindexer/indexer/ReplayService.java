package com.mafiaindexer.indexer;

import com.mafiaindexer.common.Base58;
import com.mafiaindexer.domain.ProgramTransaction;
import com.mafiaindexer.ingestion.adapter.LedgerPollAdapter;
import com.mafiaindexer.ingestion.dispatch.TransactionOutcome;
import com.mafiaindexer.ingestion.dispatch.TransactionProcessor;
import com.mafiaindexer.ingestion.source.EventSource;
import com.mafiaindexer.ingestion.source.SlotRange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Single-signature replays and slot-range reindexing, queued on the replay executor and run next to the event
 * source, whatever its state. Both go through {@link TransactionProcessor#replay}, so stored events are skipped
 * by the dedup index and the checkpoint is never moved. Requests are kept in the replayRequests cache for status
 * lookups; a signature that is already queued or processing returns the pending request.
 */
@Component
@Slf4j
public class ReplayService {

    public static final String REPLAY_REQUESTS_CACHE = "replayRequests";

    private static final int SIGNATURE_BYTES = 64;

    private final LedgerPollAdapter pollAdapter;
    private final TransactionProcessor processor;
    private final EventSource eventSource;
    private final Executor replayExecutor;
    private final Cache requests;

    public ReplayService(LedgerPollAdapter pollAdapter,
                         TransactionProcessor processor,
                         EventSource eventSource,
                         @Qualifier("replay-executor") Executor replayExecutor,
                         CacheManager cacheManager) {
        this.pollAdapter = pollAdapter;
        this.processor = processor;
        this.eventSource = eventSource;
        this.replayExecutor = replayExecutor;
        this.requests = cacheManager.getCache(REPLAY_REQUESTS_CACHE);
        if (this.requests == null) {
            throw new IllegalStateException("Cache " + REPLAY_REQUESTS_CACHE + " is not configured");
        }
    }

    /**
     * @throws IllegalArgumentException if {@code signature} is not a Base58 transaction signature
     * @throws IllegalStateException if the replay queue is full
     */
    public synchronized ReplayRequest queueSignature(String signature) {
        validateSignature(signature);
        ReplayRequest pending = requests.get(signature, ReplayRequest.class);
        if (pending != null && pending.status().isActive()) {
            log.debug("Signature {} already {}", signature, pending.status());
            return pending;
        }
        ReplayRequest request = ReplayRequest.forSignature(signature);
        submit(request, () -> runSignature(request));
        log.info("Queued replay of tx {}", signature);
        return request;
    }

    /**
     * Reindexes {@code [fromSlot, toSlot]}; without {@code toSlot} the head slot at run time is the end.
     *
     * @throws IllegalArgumentException on a negative start or an end below the start
     * @throws IllegalStateException if the replay queue is full
     */
    public ReplayRequest queueReindex(long fromSlot, Long toSlot) {
        if (fromSlot < 0) {
            throw new IllegalArgumentException("fromSlot must not be negative");
        }
        if (toSlot != null && new SlotRange(fromSlot, toSlot).isEmpty()) {
            throw new IllegalArgumentException("toSlot " + toSlot + " is below fromSlot " + fromSlot);
        }
        ReplayRequest request = ReplayRequest.forReindex("reindex-" + UUID.randomUUID(), fromSlot, toSlot);
        submit(request, () -> runReindex(request));
        log.info("Queued reindex from slot {} to {}", fromSlot, toSlot != null ? toSlot : "head");
        return request;
    }

    public Optional<ReplayRequest> find(String id) {
        return Optional.ofNullable(requests.get(id, ReplayRequest.class));
    }

    private void submit(ReplayRequest request, Runnable task) {
        requests.put(request.id(), request);
        try {
            replayExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            requests.evict(request.id());
            throw new IllegalStateException("Replay queue is full; try again later", e);
        }
    }

    private static void validateSignature(String signature) {
        byte[] decoded = Base58.decode(signature);
        if (decoded.length != SIGNATURE_BYTES) {
            throw new IllegalArgumentException("Not a transaction signature: " + decoded.length + " bytes");
        }
    }

    void runSignature(ReplayRequest queued) {
        ReplayRequest request = update(queued.processing());
        try {
            Optional<ProgramTransaction> tx = pollAdapter.transaction(request.signature());
            if (tx.isEmpty()) {
                update(request.failed("Transaction not found"));
                return;
            }
            if (tx.get().failed()) {
                update(request.failed("Transaction failed on chain"));
                return;
            }
            TransactionOutcome outcome = processor.replay(tx.get());
            switch (outcome) {
                case COMMITTED -> update(request.completed(null, 1));
                case DROPPED -> update(request.failed("Storage failed; transaction dropped"));
                default -> update(request.failed("Not processed: " + outcome));
            }
        } catch (RuntimeException e) {
            log.debug("Replay of tx {} failed", request.signature(), e);
            update(request.failed(reason(e)));
        }
    }

    void runReindex(ReplayRequest queued) {
        ReplayRequest request = update(queued.processing());
        try {
            long end = request.toSlot() != null ? request.toSlot() : pollAdapter.currentSlot();
            int processed = eventSource.reindex(new SlotRange(request.fromSlot(), end));
            if (Thread.currentThread().isInterrupted()) {
                update(request.failed("Interrupted after " + processed + " tx(s)"));
            } else {
                update(request.completed(end, processed));
            }
        } catch (RuntimeException e) {
            log.debug("Reindex {} from slot {} failed", request.id(), request.fromSlot(), e);
            update(request.failed(reason(e)));
        }
    }

    private static String reason(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getName();
    }

    private ReplayRequest update(ReplayRequest request) {
        requests.put(request.id(), request);
        if (request.status() == ReplayStatus.FAILED) {
            log.warn("{} {} failed: {}", request.kind(), request.id(), request.error());
        } else if (request.status() == ReplayStatus.COMPLETED) {
            log.info("{} {} completed: {} tx(s)", request.kind(), request.id(), request.transactionsProcessed());
        }
        return request;
    }
}
