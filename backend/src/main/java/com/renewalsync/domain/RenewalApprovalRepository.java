package com.renewalsync.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for renewal_approvals, unique per (blockchain_sub_id, approval_id).
 */
@Repository
@RequiredArgsConstructor
public class RenewalApprovalRepository {

    private final JdbcTemplate jdbc;

    /** Inserts unless the approval already exists. Returns 1 when a row was created. */
    public int insertIfAbsent(RenewalApproval approval) {
        return jdbc.update("""
                INSERT INTO renewal_approvals (blockchain_sub_id, approval_id, max_spend, expires_at, used)
                VALUES (?, ?, ?, ?, ?)
                ON CONFLICT (blockchain_sub_id, approval_id) DO NOTHING
                """,
                approval.getBlockchainSubId(), approval.getApprovalId(), approval.getMaxSpend(),
                approval.getExpiresAt(), approval.isUsed());
    }

    public int markRejected(long blockchainSubId, long approvalId, Integer reason) {
        return jdbc.update("""
                UPDATE renewal_approvals SET rejected = TRUE, rejection_reason = ?
                WHERE blockchain_sub_id = ? AND approval_id = ?
                """, reason, blockchainSubId, approvalId);
    }

    public int clearRejection(long blockchainSubId, long approvalId) {
        return jdbc.update("""
                UPDATE renewal_approvals SET rejected = FALSE, rejection_reason = NULL
                WHERE blockchain_sub_id = ? AND approval_id = ?
                """, blockchainSubId, approvalId);
    }

    public int delete(long blockchainSubId, long approvalId) {
        return jdbc.update(
                "DELETE FROM renewal_approvals WHERE blockchain_sub_id = ? AND approval_id = ?",
                blockchainSubId, approvalId);
    }

    public Optional<RenewalApproval> find(long blockchainSubId, long approvalId) {
        List<RenewalApproval> rows = jdbc.query("""
                SELECT id, blockchain_sub_id, approval_id, max_spend, expires_at, used, rejected, rejection_reason
                FROM renewal_approvals WHERE blockchain_sub_id = ? AND approval_id = ?
                """,
                (rs, i) -> {
                    RenewalApproval a = new RenewalApproval();
                    a.setId(rs.getLong("id"));
                    a.setBlockchainSubId(rs.getLong("blockchain_sub_id"));
                    a.setApprovalId(rs.getLong("approval_id"));
                    a.setMaxSpend(rs.getLong("max_spend"));
                    a.setExpiresAt(rs.getLong("expires_at"));
                    a.setUsed(rs.getBoolean("used"));
                    a.setRejected(rs.getBoolean("rejected"));
                    int reason = rs.getInt("rejection_reason");
                    a.setRejectionReason(rs.wasNull() ? null : reason);
                    return a;
                },
                blockchainSubId, approvalId);
        return rows.stream().findFirst();
    }
}
