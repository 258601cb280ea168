package com.renewalsync.ingestion.config;

import com.renewalsync.common.RetryPolicy;
import com.renewalsync.ingestion.adapter.LedgerRpcClient;
import com.renewalsync.ingestion.adapter.RpcEndpointRotator;
import com.renewalsync.ingestion.adapter.WebClientLedgerRpcClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

/**
 * Wires the ledger RPC client, endpoint rotator and local rate limiter from {@code renewalsync.ledger.*}.
 */
@Configuration
@EnableConfigurationProperties({ LedgerRpcProperties.class, LedgerRetryProperties.class, LedgerPollerProperties.class })
public class IngestionAdapterConfig {

    public static final String LEDGER_RPC_RATE_LIMITER = "ledgerRpcRateLimiter";

    @Bean
    public RpcEndpointRotator ledgerRpcEndpointRotator(LedgerRpcProperties rpcProperties, LedgerRetryProperties retryProperties) {
        List<String> urls = rpcProperties.getUrls() == null || rpcProperties.getUrls().isEmpty()
                ? List.of(LedgerRpcProperties.DEFAULT_URL)
                : rpcProperties.getUrls();
        RetryPolicy retryPolicy = new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                retryProperties.getJitterFactor(),
                retryProperties.getMaxAttempts());
        return new RpcEndpointRotator(urls, retryPolicy);
    }

    @Bean
    public LedgerRpcClient ledgerRpcClient(WebClient.Builder webClientBuilder) {
        return new WebClientLedgerRpcClient(webClientBuilder);
    }

    @Bean(name = LEDGER_RPC_RATE_LIMITER)
    public RateLimiter ledgerRpcRateLimiter(LedgerRpcProperties rpcProperties) {
        int rps = Math.max(1, rpcProperties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, rpcProperties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("ledger-rpc", config);
    }
}
