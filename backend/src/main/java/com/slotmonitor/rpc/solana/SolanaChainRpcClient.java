package com.slotmonitor.rpc.solana;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.slotmonitor.rpc.ChainRpcClient;
import com.slotmonitor.rpc.RpcEndpointRotator;
import com.slotmonitor.rpc.RpcException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * {@link ChainRpcClient} over Solana JSON-RPC: getSlot and getBlocks at "confirmed" commitment.
 * Each call takes a permit from the shared rate limiter, rotates endpoints and retries with backoff.
 */
@Slf4j
public class SolanaChainRpcClient implements ChainRpcClient {

    static final String COMMITMENT = "confirmed";

    private final SolanaRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;

    public SolanaChainRpcClient(SolanaRpcClient rpcClient,
                                RpcEndpointRotator rotator,
                                RateLimiter rateLimiter,
                                ObjectMapper objectMapper) {
        this.rpcClient = rpcClient;
        this.rotator = rotator;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
    }

    @Override
    public long getLatestSlot() {
        JsonNode result = callWithRetry("getSlot", List.of(Map.of("commitment", COMMITMENT)));
        if (!result.canConvertToLong() || result.asLong() < 0) {
            throw new RpcException("getSlot invalid result: " + result);
        }
        return result.asLong();
    }

    @Override
    public List<Long> getBlocks(long startSlot, long endSlot) {
        if (startSlot < 0 || endSlot < startSlot) {
            throw new IllegalArgumentException("invalid slot range [" + startSlot + ", " + endSlot + "]");
        }
        JsonNode result = callWithRetry("getBlocks", List.of(startSlot, endSlot, Map.of("commitment", COMMITMENT)));
        if (!result.isArray()) {
            throw new RpcException("getBlocks invalid result: " + result);
        }
        TreeSet<Long> confirmed = new TreeSet<>();
        for (JsonNode slot : result) {
            if (!slot.canConvertToLong()) {
                throw new RpcException("getBlocks non-numeric slot: " + slot);
            }
            long value = slot.asLong();
            if (value >= startSlot && value <= endSlot) {
                confirmed.add(value);
            }
        }
        return new ArrayList<>(confirmed);
    }

    private JsonNode callWithRetry(String method, Object params) {
        RuntimeException lastException = null;
        for (int attempt = 0; attempt < rotator.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                pause(method, rotator.retryDelayMs(attempt - 1));
            }
            String endpoint = rotator.getNextEndpoint();
            try {
                return call(endpoint, method, params);
            } catch (RpcException e) {
                lastException = e;
                log.debug("{} attempt {} failed: {}", method, attempt + 1, e.getMessage());
            }
        }
        throw new RpcException(method + " failed after " + rotator.getMaxAttempts() + " attempt(s)", lastException);
    }

    private JsonNode call(String endpoint, String method, Object params) {
        if (!rateLimiter.acquirePermission()) {
            throw new RpcException("Local limiter timeout before " + method);
        }
        String json;
        try {
            json = rpcClient.call(endpoint, method, params).block();
        } catch (RpcException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RpcException(method + " failed: " + e.getMessage(), e);
        }
        if (json == null) {
            throw new RpcException(method + " returned an empty body");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (Exception e) {
            throw new RpcException("Failed to parse " + method + " response", e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new RpcException(method + " error: " + error);
        }
        JsonNode result = root.path("result");
        if (result.isMissingNode() || result.isNull()) {
            throw new RpcException(method + " returned no result");
        }
        return result;
    }

    private static void pause(String method, long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException("Interrupted while retrying " + method, e);
        }
    }
}
