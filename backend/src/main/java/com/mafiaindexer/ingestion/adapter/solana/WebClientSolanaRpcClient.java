package com.mafiaindexer.ingestion.adapter.solana;

import com.mafiaindexer.ingestion.adapter.RpcException;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSON-RPC 2.0 over HTTP POST using WebClient. Transport failures surface as {@link RpcException}.
 */
public class WebClientSolanaRpcClient implements SolanaRpcClient {

    private final WebClient webClient;
    private final Duration timeout;
    private final AtomicLong requestId = new AtomicLong(1);

    public WebClientSolanaRpcClient(WebClient.Builder builder, Duration timeout) {
        this.webClient = builder.build();
        this.timeout = timeout;
    }

    @Override
    public Mono<String> call(String endpointUrl, String method, Object params) {
        Map<String, Object> body = Map.of(
                "jsonrpc", "2.0",
                "id", requestId.getAndIncrement(),
                "method", method,
                "params", params != null ? params : new Object[]{}
        );
        return webClient.post()
                .uri(endpointUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .onErrorMap(WebClientResponseException.class, e -> new RpcException(method + " HTTP " + e.getStatusCode().value(), e))
                .onErrorMap(WebClientRequestException.class, e -> new RpcException(method + " request failed: " + e.getMessage(), e))
                .onErrorMap(TimeoutException.class, e -> new RpcException(method + " timed out after " + timeout.toMillis() + " ms", e));
    }
}
