package com.renewalsync.renewal.lock;

import com.renewalsync.domain.RenewalLock;
import com.renewalsync.domain.RenewalLockRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Cross-process mutual exclusion per (subscription, billing cycle), backed by the partial unique index on
 * active renewal_locks rows. Whoever inserts the active row holds the lock; everyone else gets {@code false}.
 * <p>
 * There is no heartbeat: a holder whose work outlives its TTL loses exclusivity, because the next
 * {@link #acquireLock} for that key expires the stale row and takes over. Size TTLs to the renewal
 * submission's worst case.
 * <p>
 * Every method does one or two blocking store round trips.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RenewalLockService {

    private final RenewalLockRepository lockRepository;
    private final RenewalLockProperties properties;
    private final Clock clock;

    /**
     * {@link #acquireLock(String, long, String, long)} with the configured default TTL.
     */
    public boolean acquireLock(String subscriptionId, long cycleId, String lockHolder) {
        return acquireLock(subscriptionId, cycleId, lockHolder, properties.getDefaultTtlMs());
    }

    /**
     * Expires a stale active row for the key, then tries to insert a fresh active one.
     *
     * @return true when this caller now holds the lock, false when another holder does
     * @throws org.springframework.dao.DataAccessException on any store error other than the uniqueness conflict
     */
    public boolean acquireLock(String subscriptionId, long cycleId, String lockHolder, long ttlMs) {
        if (subscriptionId == null || subscriptionId.isBlank()) {
            throw new IllegalArgumentException("subscriptionId is required");
        }
        if (lockHolder == null || lockHolder.isBlank()) {
            throw new IllegalArgumentException("lockHolder is required");
        }
        if (ttlMs <= 0) {
            throw new IllegalArgumentException("ttlMs must be positive");
        }
        Instant now = clock.instant();
        int expired = lockRepository.expireStale(subscriptionId, cycleId, now);
        if (expired > 0) {
            log.info("Expired stale renewal lock for subscription {} cycle {}", subscriptionId, cycleId);
        }

        RenewalLock lock = new RenewalLock();
        lock.setSubscriptionId(subscriptionId);
        lock.setCycleId(cycleId);
        lock.setLockHolder(lockHolder);
        lock.setLockedAt(now);
        lock.setExpiresAt(now.plusMillis(ttlMs));
        lock.setStatus(RenewalLock.LockStatus.ACTIVE);
        try {
            lockRepository.insertActive(lock);
        } catch (DuplicateKeyException e) {
            log.warn("Renewal lock for subscription {} cycle {} already held; {} not granted",
                    subscriptionId, cycleId, lockHolder);
            return false;
        }
        log.info("Renewal lock acquired: subscription {} cycle {} holder {} ttl {} ms",
                subscriptionId, cycleId, lockHolder, ttlMs);
        return true;
    }

    /**
     * Marks the active lock for the key released. No-op when there is none.
     */
    public void releaseLock(String subscriptionId, long cycleId) {
        int released = lockRepository.releaseActive(subscriptionId, cycleId);
        if (released > 0) {
            log.info("Renewal lock released: subscription {} cycle {}", subscriptionId, cycleId);
        } else {
            log.debug("No active renewal lock to release for subscription {} cycle {}", subscriptionId, cycleId);
        }
    }

    /**
     * @return number of active locks past their expiry that were marked expired
     */
    public int releaseExpiredLocks() {
        int expired = lockRepository.expireAllStale(clock.instant());
        if (expired > 0) {
            log.info("Expired {} stale renewal locks", expired);
        }
        return expired;
    }

    /**
     * True when the subscription has an active lock that has not yet expired, for any cycle.
     */
    public boolean isLocked(String subscriptionId) {
        return lockRepository.existsActiveUnexpired(subscriptionId, clock.instant());
    }
}
