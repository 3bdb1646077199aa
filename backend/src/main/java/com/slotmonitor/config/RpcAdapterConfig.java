package com.slotmonitor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.slotmonitor.common.RetryPolicy;
import com.slotmonitor.rpc.ChainRpcClient;
import com.slotmonitor.rpc.RpcEndpointRotator;
import com.slotmonitor.rpc.solana.SolanaChainRpcClient;
import com.slotmonitor.rpc.solana.SolanaRpcClient;
import com.slotmonitor.rpc.solana.WebClientSolanaRpcClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

/**
 * Wires the Solana RPC client: endpoints (with API key), retry policy, shared rate limiter and transport.
 */
@Configuration
@EnableConfigurationProperties({ RpcProperties.class, RpcRetryProperties.class })
@Slf4j
public class RpcAdapterConfig {

    @Bean
    public RpcEndpointRotator solanaRpcEndpointRotator(RpcProperties rpcProperties, RpcRetryProperties retryProperties) {
        List<String> endpoints = rpcProperties.resolvedEndpoints();
        if (endpoints.isEmpty()) {
            throw new IllegalStateException("slotmonitor.rpc.urls must contain at least one non-blank URL");
        }
        RetryPolicy retryPolicy = new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                Math.max(retryProperties.getBaseDelayMs(), retryProperties.getMaxDelayMs()),
                retryProperties.getJitterFactor(),
                retryProperties.getMaxAttempts());
        RpcEndpointRotator rotator = new RpcEndpointRotator(endpoints, retryPolicy);
        log.info("Solana RPC endpoints configured: {}, max attempts per call: {}",
                rotator.getEndpoints().size(), rotator.getMaxAttempts());
        return rotator;
    }

    @Bean(name = "solanaRpcRateLimiter")
    public RateLimiter solanaRpcRateLimiter(RpcProperties rpcProperties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, rpcProperties.getMaxRequestsPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, rpcProperties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("solana-rpc", config);
    }

    @Bean
    public SolanaRpcClient solanaRpcClient(WebClient.Builder webClientBuilder, RpcProperties rpcProperties) {
        return new WebClientSolanaRpcClient(webClientBuilder, Duration.ofMillis(rpcProperties.getRequestTimeoutMs()));
    }

    @Bean
    public ChainRpcClient chainRpcClient(SolanaRpcClient solanaRpcClient,
                                         RpcEndpointRotator solanaRpcEndpointRotator,
                                         RateLimiter solanaRpcRateLimiter,
                                         ObjectMapper objectMapper) {
        return new SolanaChainRpcClient(solanaRpcClient, solanaRpcEndpointRotator, solanaRpcRateLimiter, objectMapper);
    }
}
