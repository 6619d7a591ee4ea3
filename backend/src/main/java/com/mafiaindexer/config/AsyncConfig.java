package com.mafiaindexer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: the event source loop runs alone on indexer-source-executor;
 * notification publishing runs on notification-executor so it never delays a commit;
 * replays and reindexing run one at a time on replay-executor.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String INDEXER_SOURCE_EXECUTOR = "indexer-source-executor";
    public static final String NOTIFICATION_EXECUTOR = "notification-executor";
    public static final String REPLAY_EXECUTOR = "replay-executor";

    @Bean(name = INDEXER_SOURCE_EXECUTOR)
    public Executor indexerSourceExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setThreadNamePrefix("indexer-source-");
        e.setWaitForTasksToCompleteOnShutdown(false);
        e.initialize();
        return e;
    }

    /** Bounded queue; when full, notifications are dropped with a warning. */
    @Bean(name = NOTIFICATION_EXECUTOR)
    public Executor notificationExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(2);
        e.setMaxPoolSize(2);
        e.setQueueCapacity(10_000);
        e.setThreadNamePrefix("notify-");
        e.initialize();
        return e;
    }

    /** Rejects when 100 requests are waiting; the API answers 409. */
    @Bean(name = REPLAY_EXECUTOR)
    public Executor replayExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setQueueCapacity(100);
        e.setThreadNamePrefix("replay-");
        e.initialize();
        return e;
    }
}
