package com.renewalsync.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Narrow write surface over the billing-owned subscriptions table, keyed by blockchain_sub_id.
 * Every mutation sets absolute values so re-applying it is harmless.
 */
@Repository
@RequiredArgsConstructor
public class SubscriptionRepository {

    private final JdbcTemplate jdbc;

    public Optional<Subscription> findByBlockchainSubId(long blockchainSubId) {
        List<Subscription> rows = jdbc.query("""
                SELECT id, blockchain_sub_id, status, failure_count, last_renewal_cycle_id, next_billing_date
                FROM subscriptions WHERE blockchain_sub_id = ?
                """,
                (rs, i) -> {
                    Subscription s = new Subscription();
                    s.setId(rs.getLong("id"));
                    s.setBlockchainSubId(rs.getLong("blockchain_sub_id"));
                    s.setStatus(SubscriptionStatus.fromDbValue(rs.getString("status")));
                    s.setFailureCount(rs.getInt("failure_count"));
                    long cycleId = rs.getLong("last_renewal_cycle_id");
                    s.setLastRenewalCycleId(rs.wasNull() ? null : cycleId);
                    Timestamp next = rs.getTimestamp("next_billing_date");
                    s.setNextBillingDate(next != null ? next.toInstant() : null);
                    return s;
                },
                blockchainSubId);
        return rows.stream().findFirst();
    }

    public Optional<Instant> findNextBillingDate(long blockchainSubId) {
        List<Timestamp> rows = jdbc.query(
                "SELECT next_billing_date FROM subscriptions WHERE blockchain_sub_id = ?",
                (rs, i) -> rs.getTimestamp("next_billing_date"),
                blockchainSubId);
        return rows.stream().filter(t -> t != null).findFirst().map(Timestamp::toInstant);
    }

    /**
     * status=active, failure_count=0 and, when given, last_renewal_cycle_id.
     */
    public int markRenewed(long blockchainSubId, Long cycleId) {
        if (cycleId == null) {
            return jdbc.update("""
                    UPDATE subscriptions SET status = ?, failure_count = 0, updated_at = now()
                    WHERE blockchain_sub_id = ?
                    """, SubscriptionStatus.ACTIVE.dbValue(), blockchainSubId);
        }
        return jdbc.update("""
                UPDATE subscriptions SET status = ?, failure_count = 0, last_renewal_cycle_id = ?, updated_at = now()
                WHERE blockchain_sub_id = ?
                """, SubscriptionStatus.ACTIVE.dbValue(), cycleId, blockchainSubId);
    }

    public int markRetrying(long blockchainSubId, int failureCount) {
        return jdbc.update("""
                UPDATE subscriptions SET status = ?, failure_count = ?, updated_at = now()
                WHERE blockchain_sub_id = ?
                """, SubscriptionStatus.RETRYING.dbValue(), failureCount, blockchainSubId);
    }

    public int updateStatus(long blockchainSubId, SubscriptionStatus status) {
        return jdbc.update(
                "UPDATE subscriptions SET status = ?, updated_at = now() WHERE blockchain_sub_id = ?",
                status.dbValue(), blockchainSubId);
    }

    /** Undo of a renewal: status=pending and no recorded cycle. */
    public int revertRenewal(long blockchainSubId) {
        return jdbc.update("""
                UPDATE subscriptions SET status = ?, last_renewal_cycle_id = NULL, updated_at = now()
                WHERE blockchain_sub_id = ?
                """, SubscriptionStatus.PENDING.dbValue(), blockchainSubId);
    }
}
