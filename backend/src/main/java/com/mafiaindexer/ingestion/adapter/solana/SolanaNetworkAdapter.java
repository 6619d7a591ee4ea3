package com.mafiaindexer.ingestion.adapter.solana;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mafiaindexer.domain.ProgramTransaction;
import com.mafiaindexer.ingestion.adapter.LedgerPollAdapter;
import com.mafiaindexer.ingestion.adapter.RpcEndpointRotator;
import com.mafiaindexer.ingestion.adapter.RpcException;
import com.mafiaindexer.ingestion.adapter.SignatureRef;
import com.mafiaindexer.ingestion.config.IndexerProperties;
import com.mafiaindexer.ingestion.config.IngestionRpcProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.Exceptions;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Poll adapter: getSlot for the head; getSignaturesForAddress(programId) paged backwards until the range start,
 * then getTransaction per signature for its log messages. Pages above the range end still have to be read
 * once per walk, so callers list a whole range before batching over it. Calls rotate endpoints and go through the local
 * rate limiter; each call is retried per the rotator's policy.
 */
@Component
@Slf4j
public class SolanaNetworkAdapter implements LedgerPollAdapter {

    private final SolanaRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final String programId;
    private final String commitment;
    private final int signaturesLimit;

    public SolanaNetworkAdapter(SolanaRpcClient rpcClient,
                                @Qualifier("solanaRpcEndpointRotator") RpcEndpointRotator rotator,
                                @Qualifier("solanaRpcRateLimiter") RateLimiter rateLimiter,
                                ObjectMapper objectMapper,
                                IndexerProperties indexerProperties,
                                IngestionRpcProperties rpcProperties) {
        this.rpcClient = rpcClient;
        this.rotator = rotator;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        this.programId = indexerProperties.getProgramId();
        this.commitment = indexerProperties.getCommitment();
        this.signaturesLimit = Math.min(Math.max(1, rpcProperties.getSignaturesLimit()), 1000);
    }

    @Override
    public long currentSlot() {
        JsonNode result = callWithRetry("getSlot", List.of(Map.of("commitment", commitment)));
        if (!result.canConvertToLong()) {
            throw new RpcException("getSlot returned non-numeric result: " + result);
        }
        return result.asLong();
    }

    @Override
    public List<SignatureRef> signaturesInRange(long start, long end) {
        if (end < start) {
            return List.of();
        }
        List<SignatureRef> inRange = new ArrayList<>();
        String before = null;
        boolean reachedStart = false;
        while (!reachedStart) {
            List<JsonNode> page = getSignaturesPage(before);
            if (page.isEmpty()) {
                break;
            }
            for (JsonNode sigInfo : page) {
                long slot = sigInfo.path("slot").asLong();
                if (slot < start) {
                    reachedStart = true;
                    break;
                }
                if (slot > end) {
                    continue;
                }
                String signature = sigInfo.path("signature").asText();
                if (!sigInfo.path("err").isNull() && !sigInfo.path("err").isMissingNode()) {
                    log.debug("Skipping failed tx {} at slot {}", signature, slot);
                    continue;
                }
                inRange.add(new SignatureRef(signature, slot, blockTime(sigInfo.path("blockTime"))));
            }
            if (page.size() < signaturesLimit) {
                break;
            }
            before = page.get(page.size() - 1).path("signature").asText();
        }
        // RPC order is newest first
        Collections.reverse(inRange);
        return inRange;
    }

    @Override
    public List<ProgramTransaction> fetchTransactions(List<SignatureRef> signatures) {
        List<ProgramTransaction> txs = new ArrayList<>(signatures.size());
        for (SignatureRef ref : signatures) {
            ProgramTransaction tx = getTransaction(ref.signature(), ref.slot(), ref.blockTime());
            if (tx != null) {
                txs.add(tx);
            }
        }
        return txs;
    }

    @Override
    public Optional<ProgramTransaction> transaction(String signature) {
        return Optional.ofNullable(getTransaction(signature, 0L, null));
    }

    private List<JsonNode> getSignaturesPage(String before) {
        Map<String, Object> config = new HashMap<>();
        config.put("limit", signaturesLimit);
        config.put("commitment", commitment);
        if (before != null) {
            config.put("before", before);
        }
        JsonNode result = callWithRetry("getSignaturesForAddress", List.of(programId, config));
        if (!result.isArray()) {
            return List.of();
        }
        List<JsonNode> list = new ArrayList<>(result.size());
        result.forEach(list::add);
        return list;
    }

    private ProgramTransaction getTransaction(String signature, long listedSlot, Instant listedBlockTime) {
        JsonNode result = callWithRetry("getTransaction", List.of(signature, Map.of(
                "encoding", "json",
                "commitment", commitment,
                "maxSupportedTransactionVersion", 0)));
        if (result.isNull() || result.isMissingNode()) {
            log.warn("getTransaction returned no result for {}", signature);
            return null;
        }
        JsonNode meta = result.path("meta");
        List<String> logs = new ArrayList<>();
        meta.path("logMessages").forEach(n -> logs.add(n.asText()));
        long slot = result.has("slot") ? result.path("slot").asLong() : listedSlot;
        Instant blockTime = result.has("blockTime") ? blockTime(result.path("blockTime")) : listedBlockTime;
        JsonNode accountKeys = result.path("transaction").path("message").path("accountKeys");
        String feePayer = accountKeys.isArray() && accountKeys.size() > 0 ? accountKeys.get(0).asText() : null;
        boolean failed = !meta.path("err").isNull() && !meta.path("err").isMissingNode();
        return new ProgramTransaction(signature, slot, blockTime, logs, failed, feePayer);
    }

    private static Instant blockTime(JsonNode node) {
        return node.canConvertToLong() && !node.isNull() ? Instant.ofEpochSecond(node.asLong()) : null;
    }

    /**
     * One JSON-RPC call with rotation and backoff. Returns the {@code result} node.
     */
    JsonNode callWithRetry(String method, Object params) {
        Exception lastException = null;
        for (int attempt = 0; attempt < rotator.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                try {
                    Thread.sleep(rotator.retryDelayMs(attempt - 1));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RpcException("Interrupted during " + method + " retry", e);
                }
            }
            String endpoint = rotator.getNextEndpoint();
            try {
                JsonNode result = call(endpoint, method, params);
                rotator.markHealthy(endpoint);
                return result;
            } catch (Exception e) {
                if (Exceptions.unwrap(e) instanceof InterruptedException || Thread.currentThread().isInterrupted()) {
                    Thread.currentThread().interrupt();
                    throw new RpcException("Interrupted during " + method, e);
                }
                lastException = e;
                rotator.markFailed(endpoint);
                log.debug("{} failed on {} (attempt {}): {}", method, endpoint, attempt + 1, e.getMessage());
            }
        }
        throw new RpcException(method + " failed after " + rotator.getMaxAttempts() + " attempts", lastException);
    }

    private JsonNode call(String endpoint, String method, Object params) throws JsonProcessingException {
        if (!rateLimiter.acquirePermission()) {
            throw new RpcException("Local limiter timeout before " + method + " on " + endpoint);
        }
        String json = rpcClient.call(endpoint, method, params).block();
        if (json == null) {
            throw new RpcException(method + " returned empty body");
        }
        JsonNode root = objectMapper.readTree(json);
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new RpcException(method + " error: " + error);
        }
        return root.path("result");
    }
}
