package com.mafiaindexer.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.mafiaindexer.indexer.ReplayService;
import com.mafiaindexer.ingestion.dispatch.TransactionProcessor;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches. recentSignatures short-circuits transactions that both the live
 * stream and a catch-up pass deliver; the unique dedup index stays authoritative. replayRequests holds
 * replay and reindex status for an hour after the last change.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(TransactionProcessor.RECENT_SIGNATURES_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(30, TimeUnit.MINUTES)
                .maximumSize(50_000)
                .build());
        manager.registerCustomCache(ReplayService.REPLAY_REQUESTS_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(1, TimeUnit.HOURS)
                .maximumSize(10_000)
                .build());
        return manager;
    }
}
