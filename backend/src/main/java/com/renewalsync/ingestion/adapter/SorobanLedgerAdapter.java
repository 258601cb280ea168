package com.renewalsync.ingestion.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.renewalsync.ingestion.config.IngestionAdapterConfig;
import com.renewalsync.ingestion.config.LedgerRpcProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Soroban JSON-RPC adapter: {@code getLatestLedger} and {@code getEvents} filtered to the configured contract.
 * Each call is retried on the next endpoint with exponential backoff; the local limiter bounds the request rate.
 */
@Component
@Slf4j
public class SorobanLedgerAdapter implements LedgerAdapter {

    static final String GET_LATEST_LEDGER = "getLatestLedger";
    static final String GET_EVENTS = "getEvents";

    private final LedgerRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    private final RateLimiter rateLimiter;
    private final LedgerRpcProperties rpcProperties;
    private final ObjectMapper objectMapper;
    private final String contractAddress;

    public SorobanLedgerAdapter(
            LedgerRpcClient rpcClient,
            RpcEndpointRotator rotator,
            @Qualifier(IngestionAdapterConfig.LEDGER_RPC_RATE_LIMITER) RateLimiter rateLimiter,
            LedgerRpcProperties rpcProperties,
            ObjectMapper objectMapper) {
        this.rpcClient = rpcClient;
        this.rotator = rotator;
        this.rateLimiter = rateLimiter;
        this.rpcProperties = rpcProperties;
        this.objectMapper = objectMapper;
        this.contractAddress = rpcProperties.requireContractAddress();
    }

    @Override
    public long getLatestLedger() {
        JsonNode result = callWithRetry(GET_LATEST_LEDGER, null);
        JsonNode sequence = result.path("sequence");
        if (!sequence.canConvertToLong()) {
            throw new RpcException(GET_LATEST_LEDGER + ": result.sequence missing or not a number");
        }
        return sequence.asLong();
    }

    @Override
    public List<ContractEvent> getEvents(long startLedger) {
        Map<String, Object> params = Map.of(
                "startLedger", startLedger,
                "filters", List.of(Map.of("contractIds", List.of(contractAddress))));
        JsonNode events = callWithRetry(GET_EVENTS, params).path("events");
        if (!events.isArray()) {
            return List.of();
        }
        List<ContractEvent> list = new ArrayList<>(events.size());
        for (JsonNode event : events) {
            list.add(toContractEvent(event));
        }
        return list;
    }

    private ContractEvent toContractEvent(JsonNode event) {
        List<String> topics = new ArrayList<>();
        event.path("topics").forEach(t -> topics.add(t.asText()));
        JsonNode value = event.get("value");
        return new ContractEvent(
                event.path("type").asText(""),
                event.path("ledger").asLong(),
                event.path("txHash").asText(""),
                event.path("contractId").asText(""),
                List.copyOf(topics),
                value != null ? value : objectMapper.createObjectNode());
    }

    private JsonNode callWithRetry(String method, Object params) {
        Exception lastException = null;
        for (int attempt = 0; attempt < rotator.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                try {
                    Thread.sleep(rotator.retryDelayMs(attempt - 1));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RpcException("Interrupted during retry", e);
                }
            }
            String endpoint = rotator.getNextEndpoint();
            try {
                return parseResult(method, callRpc(endpoint, method, params));
            } catch (Exception e) {
                lastException = e;
                log.warn("{} failed on {} (attempt {}/{}): {}",
                        method, endpoint, attempt + 1, rotator.getMaxAttempts(), e.getMessage());
            }
        }
        String msg = "RPC failed after " + rotator.getMaxAttempts() + " attempts";
        if (lastException != null && lastException.getMessage() != null && !lastException.getMessage().isBlank()) {
            msg += ": " + lastException.getMessage();
        }
        throw new RpcException(msg, lastException);
    }

    private JsonNode parseResult(String method, String json) {
        if (json == null || json.isBlank()) {
            throw new RpcException(method + ": empty response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RpcException("Failed to parse " + method + " response", e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            String message = error.path("message").asText(error.toString());
            throw new RpcException(method + " error: " + message);
        }
        JsonNode result = root.path("result");
        if (!result.isObject()) {
            throw new RpcException(method + ": response has no result object");
        }
        return result;
    }

    private String callRpc(String endpoint, String method, Object params) {
        long acquireStart = System.nanoTime();
        boolean permitted = rateLimiter.acquirePermission();
        long waitedMs = (System.nanoTime() - acquireStart) / 1_000_000L;
        if (!permitted) {
            throw new RpcException("Local limiter timeout before " + method + " on " + endpoint);
        }
        if (waitedMs >= Math.max(1L, rpcProperties.getLocalLimiterLogThresholdMs())) {
            log.info("Local ledger RPC limiter delayed {} ms before {} on {}", waitedMs, method, endpoint);
        }
        return rpcClient.call(endpoint, method, params).block();
    }
}
