package com.mafiaindexer.indexer;

import com.mafiaindexer.domain.IndexerState;
import com.mafiaindexer.ingestion.config.IndexerProperties;
import com.mafiaindexer.ingestion.source.EventSource;
import com.mafiaindexer.ingestion.source.FatalConnectivityException;
import com.mafiaindexer.ingestion.stats.ProcessingStats;
import com.mafiaindexer.ingestion.stats.ProcessingStatsTracker;
import com.mafiaindexer.ingestion.store.CheckpointStore;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the indexer lifecycle: STOPPED → STARTING → RUNNING → STOPPING → STOPPED, and ERRORED when the
 * event source fails for good. The source runs on the single-thread indexer-source executor.
 */
@Component
@Slf4j
public class EventIndexer {

    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    private final EventSource eventSource;
    private final ProcessingStatsTracker stats;
    private final CheckpointStore checkpointStore;
    private final IndexerProperties properties;
    private final Executor sourceExecutor;

    private final AtomicReference<IndexerState> state = new AtomicReference<>(IndexerState.STOPPED);
    private volatile Thread sourceThread;
    private volatile CountDownLatch finished = new CountDownLatch(0);
    private volatile Instant startedAt;
    private volatile String lastError;

    public EventIndexer(EventSource eventSource,
                        ProcessingStatsTracker stats,
                        CheckpointStore checkpointStore,
                        IndexerProperties properties,
                        @Qualifier("indexer-source-executor") Executor sourceExecutor) {
        this.eventSource = eventSource;
        this.stats = stats;
        this.checkpointStore = checkpointStore;
        this.properties = properties;
        this.sourceExecutor = sourceExecutor;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.isAutoStart()) {
            start();
        } else {
            log.info("Indexer auto-start disabled; waiting for an explicit start");
        }
    }

    /**
     * Starts the event source. No-op unless STOPPED or ERRORED.
     *
     * @return state after the call
     */
    public synchronized IndexerState start() {
        IndexerState current = state.get();
        if (!current.canTransitionTo(IndexerState.STARTING)) {
            log.debug("start() ignored in state {}", current);
            return current;
        }
        transition(current, IndexerState.STARTING);
        stats.reset();
        eventSource.reset();
        lastError = null;
        startedAt = Instant.now();
        CountDownLatch done = new CountDownLatch(1);
        finished = done;
        try {
            sourceExecutor.execute(() -> runSource(done));
        } catch (RejectedExecutionException e) {
            done.countDown();
            fail("Source executor rejected the indexer task", e);
            return state.get();
        }
        log.info("Indexer starting for program {}", properties.getProgramId());
        return state.get();
    }

    /**
     * Asks the event source to stop and returns without waiting. The state stays STOPPING until the source
     * thread has actually exited; only then does it become STOPPED and a new start() is accepted.
     * From ERRORED this only resets to STOPPED.
     *
     * @return state after the call
     */
    public synchronized IndexerState stop() {
        IndexerState current = state.get();
        if (current == IndexerState.STOPPED || current == IndexerState.STOPPING) {
            return current;
        }
        if (current == IndexerState.ERRORED) {
            transition(current, IndexerState.STOPPED);
            return IndexerState.STOPPED;
        }
        transition(current, IndexerState.STOPPING);
        log.info("Indexer stopping");
        eventSource.stop();
        Thread t = sourceThread;
        if (t != null) {
            t.interrupt();
        }
        if (finished.getCount() == 0) {
            completeStop();
        }
        return state.get();
    }

    /**
     * Waits for a pending stop to complete.
     *
     * @return true when the indexer is STOPPED or ERRORED within the timeout
     */
    public boolean awaitStopped(Duration timeout) throws InterruptedException {
        if (!finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            return false;
        }
        synchronized (this) {
            IndexerState current = state.get();
            return current == IndexerState.STOPPED || current == IndexerState.ERRORED;
        }
    }

    @PreDestroy
    public void shutdown() {
        stop();
        try {
            if (!awaitStopped(SHUTDOWN_TIMEOUT)) {
                log.warn("Event source did not finish within {} s of shutdown", SHUTDOWN_TIMEOUT.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public IndexerState state() {
        return state.get();
    }

    public IndexerStatusSnapshot snapshot() {
        IndexerState current = state.get();
        Duration uptime = current.isActive() && startedAt != null
                ? Duration.between(startedAt, Instant.now()) : Duration.ZERO;
        Long checkpoint;
        try {
            checkpoint = checkpointStore.lastProcessedSlot().orElse(null);
        } catch (RuntimeException e) {
            log.debug("Checkpoint unavailable for status: {}", e.getMessage());
            checkpoint = null;
        }
        return new IndexerStatusSnapshot(current, eventSource.mode(), stats.snapshot(), uptime, checkpoint,
                eventSource.consecutiveLiveFailures(), lastError);
    }

    @Scheduled(fixedDelayString = "${mafiaindexer.indexer.stats-log-interval-ms:60000}")
    public void logStats() {
        if (state.get() != IndexerState.RUNNING) {
            return;
        }
        ProcessingStats s = stats.snapshot();
        log.info("Indexer {} mode: {} tx, {} events {}, {} duplicates, {} errors, last slot {}",
                eventSource.mode(), s.transactionsProcessed(), s.eventsProcessed(), s.eventsByKind(),
                s.duplicatesSkipped(), s.errors(), s.lastProcessedSlot());
    }

    private void runSource(CountDownLatch done) {
        sourceThread = Thread.currentThread();
        try {
            if (state.get() != IndexerState.STARTING) {
                return;
            }
            eventSource.run(() -> {
                if (state.compareAndSet(IndexerState.STARTING, IndexerState.RUNNING)) {
                    log.info("Indexer running in {} mode", eventSource.mode());
                }
            });
        } catch (FatalConnectivityException e) {
            fail(e.getMessage(), e);
        } catch (RuntimeException e) {
            fail("Event source failed unexpectedly: " + e.getMessage(), e);
        } finally {
            sourceThread = null;
            synchronized (this) {
                done.countDown();
                completeStop();
            }
        }
    }

    private void completeStop() {
        if (state.compareAndSet(IndexerState.STOPPING, IndexerState.STOPPED)) {
            log.info("Indexer stopped; {}", stats.snapshot());
        }
    }

    private void fail(String message, Throwable cause) {
        IndexerState current = state.get();
        if (current.isActive() && state.compareAndSet(current, IndexerState.ERRORED)) {
            lastError = message;
            log.error("Indexer ERRORED: {}; restart required", message, cause);
        }
    }

    private void transition(IndexerState from, IndexerState to) {
        if (!from.canTransitionTo(to) || !state.compareAndSet(from, to)) {
            throw new IllegalStateException("Illegal indexer transition " + from + " -> " + to);
        }
    }
}
