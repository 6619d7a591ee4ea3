package com.mafiaindexer.ingestion.config;

import com.mafiaindexer.common.RetryPolicy;
import com.mafiaindexer.ingestion.adapter.RpcEndpointRotator;
import com.mafiaindexer.ingestion.adapter.solana.SolanaRpcClient;
import com.mafiaindexer.ingestion.adapter.solana.WebClientSolanaRpcClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import org.springframework.web.reactive.socket.client.WebSocketClient;

import java.time.Duration;

/**
 * Solana adapters: HTTP JSON-RPC client with endpoint rotation and a local rate limiter, and the WebSocket
 * client used by the live log subscription.
 */
@Configuration
@EnableConfigurationProperties({ IndexerProperties.class, IngestionRpcProperties.class, IngestionRetryProperties.class })
public class IngestionAdapterConfig {

    @Bean
    public RetryPolicy rpcRetryPolicy(IngestionRetryProperties retryProperties) {
        return new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                retryProperties.getJitterFactor(),
                retryProperties.getMaxAttempts());
    }

    @Bean(name = "solanaRpcEndpointRotator")
    public RpcEndpointRotator solanaRpcEndpointRotator(IngestionRpcProperties rpcProperties, RetryPolicy rpcRetryPolicy) {
        return new RpcEndpointRotator(rpcProperties.getUrls(), rpcRetryPolicy,
                Duration.ofMillis(rpcProperties.getEndpointCooldownMs()));
    }

    @Bean
    public SolanaRpcClient solanaRpcClient(WebClient.Builder webClientBuilder, IngestionRpcProperties rpcProperties) {
        return new WebClientSolanaRpcClient(webClientBuilder, Duration.ofMillis(rpcProperties.getRequestTimeoutMs()));
    }

    @Bean(name = "solanaRpcRateLimiter")
    public RateLimiter solanaRpcRateLimiter(IngestionRpcProperties rpcProperties) {
        int rps = Math.max(1, rpcProperties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, rpcProperties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("solana-rpc", config);
    }

    @Bean
    public WebSocketClient solanaWebSocketClient() {
        return new ReactorNettyWebSocketClient();
    }
}
