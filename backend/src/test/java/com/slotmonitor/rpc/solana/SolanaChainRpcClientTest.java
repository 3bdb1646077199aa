package com.slotmonitor.rpc.solana;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.slotmonitor.common.RetryPolicy;
import com.slotmonitor.rpc.RpcEndpointRotator;
import com.slotmonitor.rpc.RpcException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SolanaChainRpcClientTest {

    private MockSolanaRpcClient mockRpc;
    private SolanaChainRpcClient client;

    @BeforeEach
    void setUp() {
        mockRpc = new MockSolanaRpcClient();
        RpcEndpointRotator rotator = new RpcEndpointRotator(
                List.of("https://rpc-a.test", "https://rpc-b.test"),
                new RetryPolicy(1L, 1L, 0, 3));
        client = new SolanaChainRpcClient(mockRpc, rotator, RateLimiter.ofDefaults("test"), new ObjectMapper());
    }

    @Test
    void getLatestSlot_returnsResultAtConfirmedCommitment() {
        mockRpc.enqueue("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":250000000}");

        assertThat(client.getLatestSlot()).isEqualTo(250_000_000L);
        assertThat(mockRpc.methods).containsExactly("getSlot");
        assertThat(mockRpc.params.get(0)).isEqualTo(List.of(Map.of("commitment", "confirmed")));
    }

    @Test
    void getLatestSlot_nonNumericResult_throws() {
        mockRpc.enqueue("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"soon\"}");

        assertThatThrownBy(() -> client.getLatestSlot()).isInstanceOf(RpcException.class);
    }

    @Test
    void getBlocks_sendsRangeAndReturnsSortedDistinctSlotsInRange() {
        mockRpc.enqueue("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":[105,101,103,103,99,200]}");

        List<Long> slots = client.getBlocks(100, 105);

        assertThat(slots).containsExactly(101L, 103L, 105L);
        assertThat(mockRpc.params.get(0)).isEqualTo(List.of(100L, 105L, Map.of("commitment", "confirmed")));
    }

    @Test
    void getBlocks_emptyResult_returnsEmptyList() {
        mockRpc.enqueue("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":[]}");

        assertThat(client.getBlocks(7, 7)).isEmpty();
    }

    @Test
    void getBlocks_invalidRange_rejectedWithoutCall() {
        assertThatThrownBy(() -> client.getBlocks(10, 9)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> client.getBlocks(-1, 9)).isInstanceOf(IllegalArgumentException.class);
        assertThat(mockRpc.methods).isEmpty();
    }

    @Test
    void jsonRpcError_retriedOnNextEndpointThenSucceeds() {
        mockRpc.enqueue("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32005,\"message\":\"Node is behind\"}}");
        mockRpc.enqueue("{\"jsonrpc\":\"2.0\",\"id\":2,\"result\":42}");

        assertThat(client.getLatestSlot()).isEqualTo(42L);
        assertThat(mockRpc.endpoints).containsExactly("https://rpc-a.test", "https://rpc-b.test");
    }

    @Test
    void allAttemptsFail_throwsRpcExceptionWithCause() {
        mockRpc.failWith(new RpcException("connection refused"));

        assertThatThrownBy(() -> client.getBlocks(1, 10))
                .isInstanceOf(RpcException.class)
                .hasMessageContaining("getBlocks failed after 3 attempt(s)")
                .hasRootCauseMessage("connection refused");
        assertThat(mockRpc.methods).hasSize(3);
    }

    @Test
    void malformedBody_isRpcException() {
        mockRpc.enqueue("not json");
        mockRpc.enqueue("{\"jsonrpc\":\"2.0\",\"id\":1}");
        mockRpc.enqueue("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{\"slots\":[]}}");

        assertThatThrownBy(() -> client.getBlocks(1, 10)).isInstanceOf(RpcException.class);
    }

    @Test
    void rateLimiterExhausted_failsWithoutCallingEndpoint() {
        RateLimiter tight = RateLimiter.of("tight", RateLimiterConfig.custom()
                .limitForPeriod(1)
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .timeoutDuration(Duration.ZERO)
                .build());
        SolanaChainRpcClient limited = new SolanaChainRpcClient(
                mockRpc,
                new RpcEndpointRotator(List.of("https://rpc-a.test"), RetryPolicy.noRetry()),
                tight,
                new ObjectMapper());
        mockRpc.enqueue("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":1}");

        assertThat(limited.getLatestSlot()).isEqualTo(1L);
        assertThatThrownBy(limited::getLatestSlot)
                .isInstanceOf(RpcException.class)
                .hasRootCauseMessage("Local limiter timeout before getSlot");
        assertThat(mockRpc.methods).hasSize(1);
    }

    private static class MockSolanaRpcClient implements SolanaRpcClient {
        private final Deque<String> responses = new ArrayDeque<>();
        private RuntimeException failure;
        final List<String> methods = new ArrayList<>();
        final List<String> endpoints = new ArrayList<>();
        final List<Object> params = new ArrayList<>();

        void enqueue(String json) {
            responses.add(json);
        }

        void failWith(RuntimeException e) {
            this.failure = e;
        }

        @Override
        public Mono<String> call(String endpointUrl, String method, Object params) {
            methods.add(method);
            endpoints.add(endpointUrl);
            this.params.add(params);
            if (failure != null) {
                return Mono.error(failure);
            }
            String next = responses.poll();
            return next != null ? Mono.just(next) : Mono.empty();
        }
    }
}
