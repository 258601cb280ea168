package com.renewalsync.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Ledger RPC endpoints, watched contract and local request budget.
 */
@ConfigurationProperties(prefix = "renewalsync.ledger.rpc")
@NoArgsConstructor
@Getter
@Setter
public class LedgerRpcProperties {

    public static final String DEFAULT_URL = "https://soroban-testnet.stellar.org";

    /** JSON-RPC endpoints, used round-robin. */
    private List<String> urls = new ArrayList<>(List.of(DEFAULT_URL));

    /** Contract whose events are consumed. Required. */
    private String contractAddress;

    /** Local RPC budget (requests per second) for this service instance. */
    private int maxRequestsPerSecond = 20;

    /** How long the local limiter may wait for a permit before failing the call. */
    private long localLimiterTimeoutMs = 2_000;

    /** Log local limiter waits longer than this threshold. */
    private long localLimiterLogThresholdMs = 100;

    /**
     * @return the trimmed contract address
     * @throws IllegalStateException when no address is configured
     */
    public String requireContractAddress() {
        if (contractAddress == null || contractAddress.isBlank()) {
            throw new IllegalStateException("Contract address not configured");
        }
        return contractAddress.trim();
    }
}
