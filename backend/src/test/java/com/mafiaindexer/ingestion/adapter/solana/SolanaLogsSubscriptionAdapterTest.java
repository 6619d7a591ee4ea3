package com.mafiaindexer.ingestion.adapter.solana;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mafiaindexer.domain.ProgramTransaction;
import com.mafiaindexer.ingestion.adapter.LiveSubscriptionException;
import com.mafiaindexer.ingestion.config.IndexerProperties;
import com.mafiaindexer.ingestion.config.IngestionRpcProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.URI;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SolanaLogsSubscriptionAdapterTest {

    private static final String PROGRAM = "HifXYhFJapXPeBgKKZu8gmdc7cZvfERJ9aEkchHxyBLS";

    @Mock
    WebSocketClient webSocketClient;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private SolanaLogsSubscriptionAdapter adapter;

    @BeforeEach
    void setUp() {
        IndexerProperties indexer = new IndexerProperties();
        indexer.setProgramId(PROGRAM);
        IngestionRpcProperties rpc = new IngestionRpcProperties();
        rpc.setUrls(List.of("https://api.devnet.solana.com"));
        adapter = new SolanaLogsSubscriptionAdapter(webSocketClient, objectMapper, indexer, rpc);
    }

    @Test
    void subscribeRequest_filtersByProgramMention() throws Exception {
        JsonNode request = objectMapper.readTree(adapter.subscribeRequest());

        assertThat(request.path("method").asText()).isEqualTo("logsSubscribe");
        assertThat(request.path("params").get(0).path("mentions").get(0).asText()).isEqualTo(PROGRAM);
        assertThat(request.path("params").get(1).path("commitment").asText()).isEqualTo("confirmed");
    }

    @Test
    @DisplayName("logsNotification becomes a transaction; ack and unrelated messages are ignored")
    void onMessage_emitsNotificationsOnly() {
        String ack = "{\"jsonrpc\":\"2.0\",\"result\":23784,\"id\":1}";
        String notification = """
                {"jsonrpc":"2.0","method":"logsNotification","params":{"result":{
                  "context":{"slot":5208469},
                  "value":{"signature":"5h6xBEauJ3PK6SWCZ1PGjBvj8vDdWG3KpwATGy1ARAXFSDwt8GFXM7W5Ncn16wmqokgpiKRLuS83KUxyZyv2sUYv",
                           "err":null,
                           "logs":["Program %s invoke [1]","Program data: AAAA","Program %s success"]}
                },"subscription":23784}}
                """.formatted(PROGRAM, PROGRAM);
        String garbage = "not json";
        String other = "{\"jsonrpc\":\"2.0\",\"method\":\"slotNotification\",\"params\":{}}";

        Flux<ProgramTransaction> flux = Flux.create(sink -> {
            adapter.onMessage(ack, sink);
            adapter.onMessage(garbage, sink);
            adapter.onMessage(other, sink);
            adapter.onMessage(notification, sink);
            sink.complete();
        });

        StepVerifier.create(flux)
                .assertNext(tx -> {
                    assertThat(tx.slot()).isEqualTo(5_208_469L);
                    assertThat(tx.logs()).hasSize(3);
                    assertThat(tx.failed()).isFalse();
                    assertThat(tx.blockTime()).isNull();
                })
                .verifyComplete();
    }

    @Test
    void onMessage_subscriptionError_failsStream() {
        Flux<ProgramTransaction> flux = Flux.create(sink ->
                adapter.onMessage("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32602,\"message\":\"Invalid params\"}}", sink));

        StepVerifier.create(flux)
                .expectErrorMatches(e -> e instanceof LiveSubscriptionException && e.getMessage().contains("Invalid params"))
                .verify();
    }

    @Test
    void toTransaction_failedTxAndMissingSignature() throws Exception {
        JsonNode failed = objectMapper.readTree("""
                {"context":{"slot":10},"value":{"signature":"abc","err":{"InstructionError":[0,"Custom"]},"logs":[]}}
                """);
        JsonNode unsigned = objectMapper.readTree("{\"context\":{\"slot\":10},\"value\":{\"logs\":[]}}");

        assertThat(SolanaLogsSubscriptionAdapter.toTransaction(failed).failed()).isTrue();
        assertThat(SolanaLogsSubscriptionAdapter.toTransaction(unsigned)).isNull();
    }

    @Test
    @DisplayName("server closing the socket surfaces as a subscription error")
    void subscribe_serverClose_errors() {
        when(webSocketClient.execute(eq(URI.create("wss://api.devnet.solana.com")), any(WebSocketHandler.class)))
                .thenReturn(Mono.empty());

        StepVerifier.create(adapter.subscribe())
                .expectErrorMatches(e -> e instanceof LiveSubscriptionException && e.getMessage().contains("closed by server"))
                .verify();
    }

    @Test
    void subscribe_connectFailure_wrapsError() {
        when(webSocketClient.execute(any(URI.class), any(WebSocketHandler.class)))
                .thenReturn(Mono.error(new IllegalStateException("connection refused")));

        StepVerifier.create(adapter.subscribe())
                .expectErrorMatches(e -> e instanceof LiveSubscriptionException && e.getCause() instanceof IllegalStateException)
                .verify();
    }
}
