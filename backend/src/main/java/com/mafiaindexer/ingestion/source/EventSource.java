package com.mafiaindexer.ingestion.source;

import com.mafiaindexer.common.RetryPolicy;
import com.mafiaindexer.domain.ProgramTransaction;
import com.mafiaindexer.ingestion.adapter.LedgerPollAdapter;
import com.mafiaindexer.ingestion.adapter.LogSubscriptionAdapter;
import com.mafiaindexer.ingestion.adapter.SignatureRef;
import com.mafiaindexer.ingestion.config.IndexerProperties;
import com.mafiaindexer.ingestion.dispatch.TransactionOutcome;
import com.mafiaindexer.ingestion.dispatch.TransactionProcessor;
import com.mafiaindexer.ingestion.stats.ProcessingStatsTracker;
import com.mafiaindexer.ingestion.store.CheckpointStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Sinks;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

/**
 * Feeds transactions to the {@link TransactionProcessor} on the calling thread.
 * Startup: bounded backfill below the checkpoint, then catch-up to the head. Then LIVE until
 * {@code liveFailureThreshold} consecutive subscription failures, then FALLBACK polling for the rest of the run.
 * In FALLBACK, {@code maxRetries} consecutive poll failures end the run with {@link FatalConnectivityException}.
 */
@Component
@Slf4j
public class EventSource {

    private final LogSubscriptionAdapter liveAdapter;
    private final LedgerPollAdapter pollAdapter;
    private final TransactionProcessor processor;
    private final CheckpointStore checkpointStore;
    private final ProcessingStatsTracker stats;
    private final IndexerProperties properties;
    private final RetryPolicy pollRetryPolicy;

    private volatile SourceMode mode = SourceMode.LIVE;
    private volatile int consecutiveLiveFailures;
    private volatile boolean stopRequested;
    private volatile Sinks.Empty<Void> stopSignal = Sinks.empty();

    public EventSource(LogSubscriptionAdapter liveAdapter,
                       LedgerPollAdapter pollAdapter,
                       TransactionProcessor processor,
                       CheckpointStore checkpointStore,
                       ProcessingStatsTracker stats,
                       IndexerProperties properties) {
        this.liveAdapter = liveAdapter;
        this.pollAdapter = pollAdapter;
        this.processor = processor;
        this.checkpointStore = checkpointStore;
        this.stats = stats;
        this.properties = properties;
        this.pollRetryPolicy = new RetryPolicy(
                properties.getRetryDelayMs(), 0, properties.getMaxRetries(), properties.getMaxRetryDelayMs());
    }

    /**
     * Runs until {@link #stop()} or a fatal failure. {@code onStarted} is called once backfill is done.
     *
     * @throws FatalConnectivityException when fallback polling exhausts its retries
     */
    public void run(Runnable onStarted) {
        runStartupBackfill();
        if (stopped()) {
            return;
        }
        onStarted.run();
        while (!stopped()) {
            if (mode == SourceMode.LIVE) {
                runLive();
            } else {
                runFallback();
                return;
            }
        }
    }

    /**
     * Back to LIVE with cleared counters and stop flag. Called before each run.
     */
    public void reset() {
        stopRequested = false;
        stopSignal = Sinks.empty();
        mode = SourceMode.LIVE;
        consecutiveLiveFailures = 0;
    }

    public void stop() {
        stopRequested = true;
        stopSignal.tryEmitEmpty();
    }

    public SourceMode mode() {
        return mode;
    }

    public int consecutiveLiveFailures() {
        return consecutiveLiveFailures;
    }

    void runStartupBackfill() {
        Optional<Long> checkpoint = checkpointStore.lastProcessedSlot();
        if (checkpoint.isEmpty()) {
            log.info("No checkpoint yet; starting without backfill");
            return;
        }
        long cp = checkpoint.get();
        SlotRange window = SlotRange.backfillWindow(cp, properties.getBackfillWindowSlots());
        log.info("Backfilling slots [{}, {}] below checkpoint {}", window.start(), window.end(), cp);
        try {
            processRange(window);
        } catch (RuntimeException e) {
            log.warn("Backfill of [{}, {}] incomplete: {}", window.start(), window.end(), e.getMessage());
        }
        if (stopped()) {
            return;
        }
        try {
            long head = pollAdapter.currentSlot();
            if (head > cp) {
                log.info("Catching up slots [{}, {}]", cp + 1, head);
                processRange(new SlotRange(cp + 1, head));
            }
        } catch (RuntimeException e) {
            log.warn("Catch-up from checkpoint {} incomplete: {}", cp, e.getMessage());
        }
    }

    /**
     * Consumes the live subscription, resubscribing after each failure, until stop or the failure threshold.
     */
    void runLive() {
        while (!stopped()) {
            try (Stream<ProgramTransaction> stream = liveAdapter.subscribe()
                    .takeUntilOther(stopSignal.asMono())
                    .toStream()) {
                Iterator<ProgramTransaction> it = stream.iterator();
                while (it.hasNext()) {
                    ProgramTransaction tx = it.next();
                    consecutiveLiveFailures = 0;
                    if (processor.process(tx) == TransactionOutcome.INTERRUPTED || stopped()) {
                        return;
                    }
                }
                if (stopped()) {
                    return;
                }
                onLiveFailure(new IllegalStateException("subscription completed"));
            } catch (RuntimeException e) {
                if (stopped()) {
                    return;
                }
                onLiveFailure(e);
            }
            if (mode == SourceMode.FALLBACK) {
                return;
            }
            if (!sleep(properties.getLiveReconnectDelayMs())) {
                return;
            }
        }
    }

    private void onLiveFailure(RuntimeException e) {
        int failures = ++consecutiveLiveFailures;
        stats.recordError();
        log.warn("Live subscription failure {}/{}: {}", failures, properties.getLiveFailureThreshold(), e.getMessage());
        if (failures >= properties.getLiveFailureThreshold()) {
            mode = SourceMode.FALLBACK;
            log.warn("Switching to fallback polling every {} ms after {} consecutive live failures",
                    properties.getPollIntervalMs(), failures);
        }
    }

    /**
     * Poll loop. Returns on stop; throws once {@code maxRetries} consecutive iterations failed.
     */
    void runFallback() {
        int failures = 0;
        while (!stopped()) {
            long delay;
            try {
                pollOnce();
                failures = 0;
                delay = properties.getPollIntervalMs();
            } catch (RuntimeException e) {
                if (stopped()) {
                    return;
                }
                failures++;
                stats.recordError();
                if (failures >= properties.getMaxRetries()) {
                    throw new FatalConnectivityException(
                            "Fallback polling failed " + failures + " consecutive times", e);
                }
                delay = pollRetryPolicy.delayMs(failures - 1);
                log.warn("Poll failed ({}/{}), retrying in {} ms: {}", failures, properties.getMaxRetries(), delay, e.getMessage());
            }
            if (!sleep(delay)) {
                return;
            }
        }
    }

    /**
     * One fallback iteration: read the head and process everything between the checkpoint and it.
     * Without a checkpoint the head becomes the starting point.
     */
    void pollOnce() {
        long head = pollAdapter.currentSlot();
        Optional<Long> checkpoint = checkpointStore.lastProcessedSlot();
        if (checkpoint.isEmpty()) {
            checkpointStore.advance(head, null);
            log.info("Checkpoint initialised at head slot {}", head);
            return;
        }
        long cp = checkpoint.get();
        if (head <= cp) {
            return;
        }
        processRange(new SlotRange(cp + 1, head));
    }

    /**
     * Lists the range's signatures once, then fetches and processes them in batches of {@code batchSize} slots,
     * moving the checkpoint to the end of each completed batch. Stops early on stop or interrupt.
     *
     * @return number of transactions that reached the processor
     */
    int processRange(SlotRange range) {
        return processRange(range, false);
    }

    /**
     * Re-runs every transaction of the range through {@link TransactionProcessor#replay}, oldest first.
     * Independent of the running source: only an interrupt of the calling thread ends it early, and the
     * checkpoint is not moved. Events already stored come back as duplicates.
     *
     * @return number of transactions that reached the processor
     * @throws com.mafiaindexer.ingestion.adapter.RpcException when listing or fetching fails after retries
     */
    public int reindex(SlotRange range) {
        log.info("Reindexing slots [{}, {}]", range.start(), range.end());
        int processed = processRange(range, true);
        log.info("Reindex of [{}, {}] done: {} tx(s)", range.start(), range.end(), processed);
        return processed;
    }

    private int processRange(SlotRange range, boolean replay) {
        BooleanSupplier halted = replay ? () -> Thread.currentThread().isInterrupted() : this::stopped;
        if (range.isEmpty() || halted.getAsBoolean()) {
            return 0;
        }
        List<SignatureRef> signatures = pollAdapter.signaturesInRange(range.start(), range.end());
        int batchSize = Math.max(1, properties.getBatchSize());
        int next = 0;
        int processed = 0;
        for (long batchStart = range.start(); batchStart <= range.end() && !halted.getAsBoolean(); batchStart += batchSize) {
            long batchEnd = Math.min(range.end(), batchStart + batchSize - 1);
            int from = next;
            while (next < signatures.size() && signatures.get(next).slot() <= batchEnd) {
                next++;
            }
            List<ProgramTransaction> txs = from == next
                    ? List.of()
                    : pollAdapter.fetchTransactions(signatures.subList(from, next));
            for (ProgramTransaction tx : txs) {
                TransactionOutcome outcome = replay ? processor.replay(tx) : processor.process(tx);
                if (outcome == TransactionOutcome.INTERRUPTED || halted.getAsBoolean()) {
                    return processed;
                }
                processed++;
            }
            if (!replay) {
                checkpointStore.advance(batchEnd, null);
            }
            if (!txs.isEmpty()) {
                log.debug("Processed {} tx(s) in slots [{}, {}]", txs.size(), batchStart, batchEnd);
            }
        }
        return processed;
    }

    private boolean stopped() {
        return stopRequested || Thread.currentThread().isInterrupted();
    }

    private boolean sleep(long ms) {
        if (ms <= 0) {
            return !stopped();
        }
        try {
            Thread.sleep(ms);
            return !stopped();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
