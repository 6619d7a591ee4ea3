package com.mafiaindexer.ingestion.dispatch;

import com.mafiaindexer.common.RetryPolicy;
import com.mafiaindexer.domain.ParsedEvent;
import com.mafiaindexer.domain.ProgramTransaction;
import com.mafiaindexer.ingestion.config.IndexerProperties;
import com.mafiaindexer.ingestion.decoder.TransactionEventDecoder;
import com.mafiaindexer.ingestion.notify.AsyncNotificationDispatcher;
import com.mafiaindexer.ingestion.stats.ProcessingStatsTracker;
import com.mafiaindexer.ingestion.store.CheckpointStore;
import com.mafiaindexer.ingestion.store.IdempotentEventStore;
import com.mafiaindexer.ingestion.store.StoreOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-transaction unit of work shared by live, poll and backfill paths: decode → for each event dedup check,
 * store, handle → advance checkpoint, all in one Mongo transaction. A storage failure rolls the unit back and
 * it is retried with exponential backoff; after the last attempt the transaction is dropped.
 * Notifications for handled events go out only after commit.
 */
@Component
@Slf4j
public class TransactionProcessor {

    public static final String RECENT_SIGNATURES_CACHE = "recentSignatures";

    private final TransactionEventDecoder decoder;
    private final IdempotentEventStore eventStore;
    private final CheckpointStore checkpointStore;
    private final EventHandlerRegistry handlerRegistry;
    private final AsyncNotificationDispatcher notificationDispatcher;
    private final ProcessingStatsTracker stats;
    private final TransactionTemplate transactionTemplate;
    private final MongoTemplate mongoTemplate;
    private final Cache recentSignatures;
    private final RetryPolicy storageRetryPolicy;

    public TransactionProcessor(TransactionEventDecoder decoder,
                                IdempotentEventStore eventStore,
                                CheckpointStore checkpointStore,
                                EventHandlerRegistry handlerRegistry,
                                AsyncNotificationDispatcher notificationDispatcher,
                                ProcessingStatsTracker stats,
                                TransactionTemplate transactionTemplate,
                                MongoTemplate mongoTemplate,
                                CacheManager cacheManager,
                                IndexerProperties properties) {
        this.decoder = decoder;
        this.eventStore = eventStore;
        this.checkpointStore = checkpointStore;
        this.handlerRegistry = handlerRegistry;
        this.notificationDispatcher = notificationDispatcher;
        this.stats = stats;
        this.transactionTemplate = transactionTemplate;
        this.mongoTemplate = mongoTemplate;
        this.recentSignatures = cacheManager.getCache(RECENT_SIGNATURES_CACHE);
        this.storageRetryPolicy = new RetryPolicy(properties.getStorageRetryBaseDelayMs(), 0, properties.getStorageMaxAttempts());
    }

    public TransactionOutcome process(ProgramTransaction tx) {
        if (tx.failed()) {
            log.debug("Skipping failed tx {} at slot {}", tx.signature(), tx.slot());
            return TransactionOutcome.SKIPPED;
        }
        if (recentSignatures != null && recentSignatures.get(tx.signature()) != null) {
            log.debug("Tx {} already committed, skipping", tx.signature());
            return TransactionOutcome.SKIPPED;
        }
        return commit(tx, true);
    }

    /**
     * Same unit of work for a transaction requested out of band (single signature or reindex). The
     * recent-signature shortcut is bypassed so the dedup index decides, and the checkpoint is left where the
     * event source put it: a replayed slot says nothing about the slots before it.
     */
    public TransactionOutcome replay(ProgramTransaction tx) {
        if (tx.failed()) {
            log.debug("Skipping failed tx {} at slot {}", tx.signature(), tx.slot());
            return TransactionOutcome.SKIPPED;
        }
        return commit(tx, false);
    }

    private TransactionOutcome commit(ProgramTransaction tx, boolean advanceCheckpoint) {
        List<ParsedEvent> events = decode(tx);
        int maxAttempts = storageRetryPolicy.getMaxAttempts();
        RuntimeException lastFailure = null;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            if (attempt > 0) {
                try {
                    Thread.sleep(storageRetryPolicy.delayMs(attempt - 1));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while retrying tx {}; not committed", tx.signature());
                    return TransactionOutcome.INTERRUPTED;
                }
            }
            try {
                UnitResult result = transactionTemplate.execute(status -> runUnit(tx, events, advanceCheckpoint));
                afterCommit(tx, result);
                return TransactionOutcome.COMMITTED;
            } catch (DataAccessException | TransactionException e) {
                lastFailure = e;
                log.warn("Storage failure for tx {} (attempt {}/{}): {}", tx.signature(), attempt + 1, maxAttempts, e.getMessage());
            }
        }
        TransactionUnitException dropped = new TransactionUnitException(tx.signature(), maxAttempts, lastFailure);
        log.error("{} at slot {}; {} event(s) not stored", dropped.getMessage(), tx.slot(), events.size(), dropped);
        stats.recordTransactionDropped();
        return TransactionOutcome.DROPPED;
    }

    private List<ParsedEvent> decode(ProgramTransaction tx) {
        try {
            return decoder.decode(tx);
        } catch (RuntimeException e) {
            log.warn("Undecodable logs in tx {} at slot {}; no events taken: {}", tx.signature(), tx.slot(), e.toString(), e);
            stats.recordError();
            return List.of();
        }
    }

    private UnitResult runUnit(ProgramTransaction tx, List<ParsedEvent> events, boolean advanceCheckpoint) {
        UnitResult result = new UnitResult();
        HandlerContext context = new HandlerContext(tx.signature(), tx.slot(), tx.blockTime(), mongoTemplate);
        for (ParsedEvent event : events) {
            if (eventStore.storeEvent(event) == StoreOutcome.DUPLICATE) {
                result.duplicates++;
                continue;
            }
            result.inserted.add(event);
            if (applyHandler(context, event)) {
                result.handled.add(event);
            } else {
                result.handlerErrors++;
            }
        }
        if (advanceCheckpoint) {
            checkpointStore.advance(tx.slot(), tx.signature());
        }
        return result;
    }

    /**
     * @return true when the handler ran cleanly (or no handler is registered for the kind)
     */
    private boolean applyHandler(HandlerContext context, ParsedEvent event) {
        EventHandler handler = handlerRegistry.handlerFor(event.kind()).orElse(null);
        if (handler == null) {
            log.warn("No handler for {} in tx {}; stored only", event.kind().getEventName(), event.signature());
            eventStore.markProcessed(event.dedupKey());
            return true;
        }
        try {
            handler.handle(context, event);
        } catch (DataAccessException e) {
            throw e;
        } catch (RuntimeException e) {
            EventHandlerException failure = e instanceof EventHandlerException handlerException
                    ? handlerException
                    : new EventHandlerException(handler.getClass().getSimpleName() + " failed for "
                            + event.kind().getEventName() + " " + event.dedupKey(), e);
            log.error("{}: {}", failure.getMessage(), String.valueOf(e.getMessage()), failure);
            eventStore.markFailed(event.dedupKey(), e.getMessage() != null ? e.getMessage() : e.getClass().getName());
            return false;
        }
        eventStore.markProcessed(event.dedupKey());
        return true;
    }

    private void afterCommit(ProgramTransaction tx, UnitResult result) {
        stats.recordTransactionCommitted(tx.slot());
        result.inserted.forEach(stats::recordStored);
        for (int i = 0; i < result.duplicates; i++) {
            stats.recordDuplicate();
        }
        for (int i = 0; i < result.handlerErrors; i++) {
            stats.recordHandlerError();
        }
        if (recentSignatures != null) {
            recentSignatures.put(tx.signature(), Boolean.TRUE);
        }
        if (!result.inserted.isEmpty() || result.duplicates > 0) {
            log.debug("Tx {} slot {}: {} stored, {} duplicate, {} handler error(s)",
                    tx.signature(), tx.slot(), result.inserted.size(), result.duplicates, result.handlerErrors);
        }
        notificationDispatcher.dispatch(result.handled);
    }

    private static final class UnitResult {
        private final List<ParsedEvent> inserted = new ArrayList<>();
        private final List<ParsedEvent> handled = new ArrayList<>();
        private int duplicates;
        private int handlerErrors;
    }
}
