package com.renewalsync.ingestion.event;

import com.renewalsync.domain.ContractEventRecord;
import com.renewalsync.domain.ContractEventType;
import com.renewalsync.domain.RenewalApproval;
import com.renewalsync.domain.RenewalApprovalRepository;
import com.renewalsync.ingestion.adapter.ContractEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Mirrors on-chain renewal approvals into renewal_approvals.
 */
@Component
@RequiredArgsConstructor
public class ApprovalEventHandler {

    private final RenewalApprovalRepository approvalRepository;

    /** Inserts the approval; a replay finds the existing row and changes nothing. */
    public ContractEventRecord onApprovalCreated(ContractEvent event) {
        EventPayload payload = EventPayload.of(event);
        RenewalApproval approval = new RenewalApproval();
        approval.setBlockchainSubId(payload.subId());
        approval.setApprovalId(payload.requireLong("approval_id"));
        approval.setMaxSpend(payload.requireLong("max_spend"));
        approval.setExpiresAt(payload.requireLong("expires_at"));
        approval.setUsed(false);
        approvalRepository.insertIfAbsent(approval);
        return ContractEventRecord.of(approval.getBlockchainSubId(), ContractEventType.APPROVAL_CREATED,
                event.ledger(), event.txHash(), event.value());
    }

    public ContractEventRecord onApprovalRejected(ContractEvent event) {
        EventPayload payload = EventPayload.of(event);
        long subId = payload.subId();
        long approvalId = payload.requireLong("approval_id");
        Integer reason = payload.optionalInt("reason").orElse(null);
        approvalRepository.markRejected(subId, approvalId, reason);
        return ContractEventRecord.of(subId, ContractEventType.APPROVAL_REJECTED, event.ledger(), event.txHash(), event.value());
    }
}
