package com.renewalsync.renewal.lock;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "renewalsync.renewal.lock")
@NoArgsConstructor
@Getter
@Setter
public class RenewalLockProperties {

    /** TTL applied when the caller does not pass one. */
    private long defaultTtlMs = 30_000L;

    /**
     * Period of {@code RenewalLockSweepJob}. Read by the job's {@code @Scheduled} placeholder, which repeats
     * this default; the field is here so the key is bound and shows up in configuration metadata.
     */
    private long sweepIntervalMs = 300_000L;
}
