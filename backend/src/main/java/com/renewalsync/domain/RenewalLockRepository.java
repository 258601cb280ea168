package com.renewalsync.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * Persistence for renewal_locks. The partial unique index on (subscription_id, cycle_id) WHERE status = 'active'
 * makes {@link #insertActive} the atomic lock step: a second active row fails with a duplicate key error.
 */
@Repository
@RequiredArgsConstructor
public class RenewalLockRepository {

    private static final String ACTIVE = RenewalLock.LockStatus.ACTIVE.dbValue();
    private static final String RELEASED = RenewalLock.LockStatus.RELEASED.dbValue();
    private static final String EXPIRED = RenewalLock.LockStatus.EXPIRED.dbValue();

    private final JdbcTemplate jdbc;

    /**
     * Inserts an ACTIVE row.
     *
     * @throws org.springframework.dao.DuplicateKeyException when an ACTIVE row already exists for the key
     */
    public void insertActive(RenewalLock lock) {
        jdbc.update("""
                INSERT INTO renewal_locks (subscription_id, cycle_id, lock_holder, locked_at, expires_at, status)
                VALUES (?, ?, ?, ?, ?, ?)
                """,
                lock.getSubscriptionId(), lock.getCycleId(), lock.getLockHolder(),
                Timestamp.from(lock.getLockedAt()), Timestamp.from(lock.getExpiresAt()), ACTIVE);
    }

    /** ACTIVE rows for the key whose expires_at is before {@code now} become EXPIRED. */
    public int expireStale(String subscriptionId, long cycleId, Instant now) {
        return jdbc.update("""
                UPDATE renewal_locks SET status = ?
                WHERE subscription_id = ? AND cycle_id = ? AND status = ? AND expires_at < ?
                """, EXPIRED, subscriptionId, cycleId, ACTIVE, Timestamp.from(now));
    }

    public int expireAllStale(Instant now) {
        return jdbc.update(
                "UPDATE renewal_locks SET status = ? WHERE status = ? AND expires_at < ?",
                EXPIRED, ACTIVE, Timestamp.from(now));
    }

    public int releaseActive(String subscriptionId, long cycleId) {
        return jdbc.update("""
                UPDATE renewal_locks SET status = ?
                WHERE subscription_id = ? AND cycle_id = ? AND status = ?
                """, RELEASED, subscriptionId, cycleId, ACTIVE);
    }

    public boolean existsActiveUnexpired(String subscriptionId, Instant now) {
        Boolean exists = jdbc.queryForObject("""
                SELECT EXISTS (
                    SELECT 1 FROM renewal_locks
                    WHERE subscription_id = ? AND status = ? AND expires_at >= ?
                )
                """, Boolean.class, subscriptionId, ACTIVE, Timestamp.from(now));
        return Boolean.TRUE.equals(exists);
    }

    public List<RenewalLock> findBySubscriptionIdAndCycleId(String subscriptionId, long cycleId) {
        return jdbc.query("""
                SELECT id, subscription_id, cycle_id, lock_holder, locked_at, expires_at, status
                FROM renewal_locks WHERE subscription_id = ? AND cycle_id = ? ORDER BY id
                """,
                (rs, i) -> {
                    RenewalLock lock = new RenewalLock();
                    lock.setId(rs.getLong("id"));
                    lock.setSubscriptionId(rs.getString("subscription_id"));
                    lock.setCycleId(rs.getLong("cycle_id"));
                    lock.setLockHolder(rs.getString("lock_holder"));
                    lock.setLockedAt(rs.getTimestamp("locked_at").toInstant());
                    lock.setExpiresAt(rs.getTimestamp("expires_at").toInstant());
                    lock.setStatus(RenewalLock.LockStatus.fromDbValue(rs.getString("status")));
                    return lock;
                },
                subscriptionId, cycleId);
    }
}
