package com.renewalsync.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.Locale;

/**
 * Row in renewal_locks. At most one ACTIVE row per (subscriptionId, cycleId), enforced by a partial unique index.
 * Rows leave ACTIVE exactly once (RELEASED or EXPIRED) and are never reactivated.
 */
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class RenewalLock {

    @EqualsAndHashCode.Include
    private Long id;
    private String subscriptionId;
    private long cycleId;
    private String lockHolder;
    private Instant lockedAt;
    private Instant expiresAt;
    private LockStatus status;

    public enum LockStatus {
        ACTIVE,
        RELEASED,
        EXPIRED;

        public String dbValue() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static LockStatus fromDbValue(String value) {
            return valueOf(value.toUpperCase(Locale.ROOT));
        }
    }
}
