package com.renewalsync.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "renewalsync.ledger.poller")
@NoArgsConstructor
@Getter
@Setter
public class LedgerPollerProperties {

    /** Start the poller when the application is ready. */
    private boolean enabled = true;

    /** Delay between iterations while healthy. */
    private long pollIntervalMs = 5_000L;

    /** Ceiling for the backoff after consecutive failed iterations. */
    private long maxBackoffMs = 60_000L;

    /** How many ledgers behind the regressed head are rolled back. */
    private long reorgDepth = 10L;
}
