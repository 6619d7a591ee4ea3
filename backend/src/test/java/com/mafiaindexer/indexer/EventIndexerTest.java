package com.mafiaindexer.indexer;

import com.mafiaindexer.domain.IndexerState;
import com.mafiaindexer.ingestion.adapter.RpcException;
import com.mafiaindexer.ingestion.config.IndexerProperties;
import com.mafiaindexer.ingestion.source.EventSource;
import com.mafiaindexer.ingestion.source.FatalConnectivityException;
import com.mafiaindexer.ingestion.source.SourceMode;
import com.mafiaindexer.ingestion.stats.ProcessingStatsTracker;
import com.mafiaindexer.ingestion.store.CheckpointStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class EventIndexerTest {

    @Mock
    EventSource eventSource;
    @Mock
    CheckpointStore checkpointStore;

    private ExecutorService executor;
    private IndexerProperties properties;
    private EventIndexer indexer;
    private CountDownLatch released;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        properties = new IndexerProperties();
        properties.setProgramId("HifXYhFJapXPeBgKKZu8gmdc7cZvfERJ9aEkchHxyBLS");
        released = new CountDownLatch(1);
        when(eventSource.mode()).thenReturn(SourceMode.LIVE);
        when(checkpointStore.lastProcessedSlot()).thenReturn(Optional.of(4242L));
        doAnswer(inv -> {
            released.countDown();
            return null;
        }).when(eventSource).stop();
        indexer = new EventIndexer(eventSource, new ProcessingStatsTracker(), checkpointStore, properties, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private void sourceRunsUntilStopped() {
        doAnswer(inv -> {
            Runnable onStarted = inv.getArgument(0);
            onStarted.run();
            try {
                released.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        }).when(eventSource).run(any());
    }

    private void awaitState(IndexerState expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (indexer.state() != expected && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(indexer.state()).isEqualTo(expected);
    }

    @Test
    @DisplayName("start moves through STARTING to RUNNING once the source reports started")
    void start_reachesRunning() throws Exception {
        sourceRunsUntilStopped();

        IndexerState afterStart = indexer.start();

        assertThat(afterStart).isIn(IndexerState.STARTING, IndexerState.RUNNING);
        awaitState(IndexerState.RUNNING);
        verify(eventSource).reset();
        assertThat(indexer.snapshot().healthy()).isTrue();
    }

    @Test
    void start_whileRunning_isNoOp() throws Exception {
        sourceRunsUntilStopped();
        indexer.start();
        awaitState(IndexerState.RUNNING);

        assertThat(indexer.start()).isEqualTo(IndexerState.RUNNING);

        verify(eventSource, times(1)).reset();
        verify(eventSource, times(1)).run(any());
    }

    @Test
    @DisplayName("stop cancels the source without blocking and reaches STOPPED once the source exits")
    void stop_cancelsSource_thenStopped() throws Exception {
        sourceRunsUntilStopped();
        indexer.start();
        awaitState(IndexerState.RUNNING);

        IndexerState afterStop = indexer.stop();

        assertThat(afterStop).isIn(IndexerState.STOPPING, IndexerState.STOPPED);
        verify(eventSource).stop();
        assertThat(indexer.awaitStopped(Duration.ofSeconds(5))).isTrue();
        assertThat(indexer.state()).isEqualTo(IndexerState.STOPPED);
        assertThat(indexer.snapshot().uptime()).isZero();
    }

    @Test
    @DisplayName("a source that has not exited keeps the indexer STOPPING and start is refused until it does")
    void stop_slowSource_staysStoppingAndBlocksRestart() throws Exception {
        CountDownLatch exit = new CountDownLatch(1);
        doAnswer(inv -> {
            Runnable onStarted = inv.getArgument(0);
            onStarted.run();
            while (exit.getCount() > 0) {
                try {
                    exit.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    // keeps running like a source stuck in a blocking call
                }
            }
            return null;
        }).doAnswer(inv -> {
            Runnable onStarted = inv.getArgument(0);
            onStarted.run();
            return null;
        }).when(eventSource).run(any());
        indexer.start();
        awaitState(IndexerState.RUNNING);

        assertThat(indexer.stop()).isEqualTo(IndexerState.STOPPING);
        assertThat(indexer.awaitStopped(Duration.ofMillis(100))).isFalse();
        assertThat(indexer.start()).isEqualTo(IndexerState.STOPPING);
        verify(eventSource, times(1)).reset();

        exit.countDown();

        awaitState(IndexerState.STOPPED);
        assertThat(indexer.start()).isIn(IndexerState.STARTING, IndexerState.RUNNING);
        verify(eventSource, times(2)).reset();
    }

    @Test
    void shutdown_waitsForSource() throws Exception {
        sourceRunsUntilStopped();
        indexer.start();
        awaitState(IndexerState.RUNNING);

        indexer.shutdown();

        assertThat(indexer.state()).isEqualTo(IndexerState.STOPPED);
    }

    @Test
    void stop_whenStopped_isNoOp() {
        assertThat(indexer.stop()).isEqualTo(IndexerState.STOPPED);
        verify(eventSource, never()).stop();
    }

    @Test
    @DisplayName("fatal connectivity failure puts the indexer in ERRORED with the cause")
    void fatalFailure_errored() throws Exception {
        doAnswer(inv -> {
            Runnable onStarted = inv.getArgument(0);
            onStarted.run();
            throw new FatalConnectivityException("Fallback polling failed 3 consecutive times",
                    new RpcException("getSlot failed after 3 attempts"));
        }).when(eventSource).run(any());

        indexer.start();

        awaitState(IndexerState.ERRORED);
        IndexerStatusSnapshot snapshot = indexer.snapshot();
        assertThat(snapshot.lastError()).contains("Fallback polling failed");
        assertThat(snapshot.healthy()).isFalse();
    }

    @Test
    void errored_canBeStoppedOrRestarted() throws Exception {
        doAnswer(inv -> {
            throw new FatalConnectivityException("down", null);
        }).doAnswer(inv -> {
            Runnable onStarted = inv.getArgument(0);
            onStarted.run();
            released.await(10, TimeUnit.SECONDS);
            return null;
        }).when(eventSource).run(any());
        indexer.start();
        awaitState(IndexerState.ERRORED);

        indexer.start();

        awaitState(IndexerState.RUNNING);
        assertThat(indexer.snapshot().lastError()).isNull();
        verify(eventSource, times(2)).reset();
        indexer.stop();
        awaitState(IndexerState.STOPPED);
    }

    @Test
    void stop_fromErrored_resetsToStopped() throws Exception {
        doAnswer(inv -> {
            throw new IllegalStateException("unexpected");
        }).when(eventSource).run(any());
        indexer.start();
        awaitState(IndexerState.ERRORED);

        assertThat(indexer.stop()).isEqualTo(IndexerState.STOPPED);
        verify(eventSource, never()).stop();
    }

    @Test
    void snapshot_reportsCheckpointAndMode() {
        IndexerStatusSnapshot snapshot = indexer.snapshot();

        assertThat(snapshot.state()).isEqualTo(IndexerState.STOPPED);
        assertThat(snapshot.mode()).isEqualTo(SourceMode.LIVE);
        assertThat(snapshot.checkpointSlot()).isEqualTo(4242L);
    }

    @Test
    void onApplicationReady_autoStartDisabled_staysStopped() {
        properties.setAutoStart(false);

        indexer.onApplicationReady();

        assertThat(indexer.state()).isEqualTo(IndexerState.STOPPED);
        verify(eventSource, never()).run(any());
    }
}
