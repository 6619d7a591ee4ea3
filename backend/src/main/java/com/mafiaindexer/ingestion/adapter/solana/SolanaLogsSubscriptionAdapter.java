package com.mafiaindexer.ingestion.adapter.solana;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mafiaindexer.domain.ProgramTransaction;
import com.mafiaindexer.ingestion.adapter.LiveSubscriptionException;
import com.mafiaindexer.ingestion.adapter.LogSubscriptionAdapter;
import com.mafiaindexer.ingestion.config.IndexerProperties;
import com.mafiaindexer.ingestion.config.IngestionRpcProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Live source: logsSubscribe with a mentions filter on the program id over the RPC WebSocket.
 * logsNotification carries slot, signature, err and logs; block time is not part of it.
 */
@Component
@Slf4j
public class SolanaLogsSubscriptionAdapter implements LogSubscriptionAdapter {

    private final WebSocketClient webSocketClient;
    private final ObjectMapper objectMapper;
    private final URI wsUri;
    private final String programId;
    private final String commitment;

    public SolanaLogsSubscriptionAdapter(WebSocketClient webSocketClient,
                                         ObjectMapper objectMapper,
                                         IndexerProperties indexerProperties,
                                         IngestionRpcProperties rpcProperties) {
        this.webSocketClient = webSocketClient;
        this.objectMapper = objectMapper;
        this.wsUri = URI.create(rpcProperties.resolveWsUrl());
        this.programId = indexerProperties.getProgramId();
        this.commitment = indexerProperties.getCommitment();
    }

    @Override
    public Flux<ProgramTransaction> subscribe() {
        return Flux.create(sink -> {
            Disposable connection = webSocketClient.execute(wsUri, session -> {
                        Mono<Void> send = session.send(Mono.just(session.textMessage(subscribeRequest())));
                        Mono<Void> receive = session.receive()
                                .map(WebSocketMessage::getPayloadAsText)
                                .doOnNext(text -> onMessage(text, sink))
                                .then();
                        return send.then(receive);
                    })
                    .subscribe(
                            ignored -> { },
                            e -> sink.error(e instanceof LiveSubscriptionException
                                    ? e : new LiveSubscriptionException("Log subscription to " + wsUri + " failed: " + e.getMessage(), e)),
                            () -> sink.error(new LiveSubscriptionException("Log subscription to " + wsUri + " closed by server")));
            sink.onDispose(connection);
        }, FluxSink.OverflowStrategy.BUFFER);
    }

    String subscribeRequest() {
        Map<String, Object> request = Map.of(
                "jsonrpc", "2.0",
                "id", 1,
                "method", "logsSubscribe",
                "params", List.of(
                        Map.of("mentions", List.of(programId)),
                        Map.of("commitment", commitment)));
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize logsSubscribe request", e);
        }
    }

    void onMessage(String text, FluxSink<ProgramTransaction> sink) {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.warn("Unparseable WebSocket message ignored: {}", e.getOriginalMessage());
            return;
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            sink.error(new LiveSubscriptionException("logsSubscribe rejected: " + error));
            return;
        }
        if (root.has("id") && root.has("result")) {
            log.info("Log subscription {} active for program {} on {}", root.path("result").asText(), programId, wsUri);
            return;
        }
        if (!"logsNotification".equals(root.path("method").asText())) {
            return;
        }
        ProgramTransaction tx = toTransaction(root.path("params").path("result"));
        if (tx != null) {
            sink.next(tx);
        }
    }

    static ProgramTransaction toTransaction(JsonNode result) {
        JsonNode value = result.path("value");
        String signature = value.path("signature").asText(null);
        if (signature == null || signature.isBlank()) {
            return null;
        }
        long slot = result.path("context").path("slot").asLong();
        List<String> logs = new ArrayList<>();
        value.path("logs").forEach(n -> logs.add(n.asText()));
        boolean failed = !value.path("err").isNull() && !value.path("err").isMissingNode();
        return new ProgramTransaction(signature, slot, null, logs, failed, null);
    }
}
