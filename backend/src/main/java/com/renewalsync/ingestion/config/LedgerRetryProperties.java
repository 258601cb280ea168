package com.renewalsync.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Per-call RPC retry policy (exponential backoff ± jitter). Documented in application.yml.
 */
@ConfigurationProperties(prefix = "renewalsync.ledger.retry")
@NoArgsConstructor
@Getter
@Setter
public class LedgerRetryProperties {

    /** Base delay in ms for first retry; doubles each attempt. */
    private long baseDelayMs = 500L;

    /** Jitter factor 0..1 (e.g. 0.2 = ±20%). */
    private double jitterFactor = 0.2;

    /** Total attempts per call, the first one included. */
    private int maxAttempts = 3;
}
