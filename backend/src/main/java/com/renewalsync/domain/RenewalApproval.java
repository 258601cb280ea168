package com.renewalsync.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Spend approval announced by the contract (ApprovalCreated), unique per (blockchainSubId, approvalId).
 */
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class RenewalApproval {

    @EqualsAndHashCode.Include
    private Long id;
    private long blockchainSubId;
    private long approvalId;
    private long maxSpend;
    /** Ledger timestamp (seconds) after which the approval is void. */
    private long expiresAt;
    private boolean used;
    private boolean rejected;
    private Integer rejectionReason;
}
