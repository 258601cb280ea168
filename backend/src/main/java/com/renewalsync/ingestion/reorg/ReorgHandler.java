package com.renewalsync.ingestion.reorg;

import com.fasterxml.jackson.databind.JsonNode;
import com.renewalsync.domain.ContractEventRecord;
import com.renewalsync.domain.ContractEventRepository;
import com.renewalsync.domain.ContractEventType;
import com.renewalsync.domain.EventCursorRepository;
import com.renewalsync.domain.RenewalApprovalRepository;
import com.renewalsync.domain.SubscriptionRepository;
import com.renewalsync.domain.SubscriptionStatus;
import com.renewalsync.ingestion.config.LedgerPollerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Rolls back applied ledger events after the chain head regressed below the stored cursor.
 * <p>
 * Everything at or above {@code newLedger - reorgDepth} is compensated newest first, the audit rows are
 * deleted and the cursor is lowered to one below that safe point so the poller re-reads the window.
 * Runs in one transaction; a second call over the same range finds no rows and changes nothing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReorgHandler {

    /** Audit kinds that imply a subscription status, used to restore state behind a reverted transition. */
    private static final List<String> STATUS_BEARING_TYPES = List.of(
            ContractEventType.STATE_TRANSITION.getAuditName(),
            ContractEventType.RENEWAL_SUCCESS.getAuditName(),
            ContractEventType.RENEWAL_FAILED.getAuditName());

    private final ContractEventRepository contractEventRepository;
    private final EventCursorRepository cursorRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final RenewalApprovalRepository approvalRepository;
    private final LedgerPollerProperties pollerProperties;

    /**
     * @param newLedger head reported by the ledger
     * @param oldLedger cursor value that was ahead of it
     * @return number of audit rows rolled back
     */
    @Transactional
    public int handleReorg(long newLedger, long oldLedger) {
        long safePoint = Math.max(0L, newLedger - Math.max(0L, pollerProperties.getReorgDepth()));
        log.warn("Reorg detected: head {} is behind cursor {}; rolling back from ledger {}", newLedger, oldLedger, safePoint);

        List<ContractEventRecord> rows = contractEventRepository.findByLedgerGreaterThanEqual(safePoint);
        for (ContractEventRecord row : rows) {
            compensate(row);
        }
        int deleted = contractEventRepository.deleteByLedgerGreaterThanEqual(safePoint);
        long rewindTo = Math.max(0L, safePoint - 1);
        boolean rewound = cursorRepository.rewindTo(rewindTo);

        log.info("Reorg handled: {} events reverted, {} audit rows deleted, cursor {}",
                rows.size(), deleted, rewound ? "reset to " + rewindTo : "already at or below " + rewindTo);
        return deleted;
    }

    private void compensate(ContractEventRecord row) {
        ContractEventType type = row.type();
        switch (type) {
            case RENEWAL_SUCCESS -> subscriptionRepository.revertRenewal(row.getSubId());
            case STATE_TRANSITION -> subscriptionRepository.updateStatus(row.getSubId(), statusBefore(row));
            case APPROVAL_CREATED -> approvalId(row).ifPresentOrElse(
                    approvalId -> approvalRepository.delete(row.getSubId(), approvalId),
                    () -> log.warn("Cannot revert approval_created without approval_id (sub_id={}, ledger={})",
                            row.getSubId(), row.getLedger()));
            case APPROVAL_REJECTED -> approvalId(row).ifPresentOrElse(
                    approvalId -> approvalRepository.clearRejection(row.getSubId(), approvalId),
                    () -> log.warn("Cannot revert approval_rejected without approval_id (sub_id={}, ledger={})",
                            row.getSubId(), row.getLedger()));
            case DUPLICATE_RENEWAL_REJECTED -> {
                // rejection changed nothing
            }
            case RENEWAL_FAILED, RENEWAL_LOCK_ACQUIRED, RENEWAL_LOCK_RELEASED, RENEWAL_LOCK_EXPIRED, UNKNOWN ->
                    log.warn("No compensation for reverted {} event (sub_id={}, ledger={}, tx={})",
                            row.getEventType(), row.getSubId(), row.getLedger(), row.getTxHash());
        }
    }

    /** Status implied by the nearest earlier status-bearing row; active when there is none. */
    private SubscriptionStatus statusBefore(ContractEventRecord row) {
        return contractEventRepository.findLatestBefore(row.getSubId(), row.getLedger(), STATUS_BEARING_TYPES)
                .map(ReorgHandler::impliedStatus)
                .orElse(SubscriptionStatus.ACTIVE);
    }

    private static SubscriptionStatus impliedStatus(ContractEventRecord previous) {
        return switch (previous.type()) {
            case RENEWAL_FAILED -> SubscriptionStatus.RETRYING;
            case STATE_TRANSITION -> SubscriptionStatus.fromContractState(textOrNull(previous.getEventData(), "new_state"));
            default -> SubscriptionStatus.ACTIVE;
        };
    }

    private static Optional<Long> approvalId(ContractEventRecord row) {
        JsonNode node = row.getEventData() == null ? null : row.getEventData().get("approval_id");
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        if (node.canConvertToLong()) {
            return Optional.of(node.asLong());
        }
        try {
            return Optional.of(Long.parseLong(node.asText().trim()));
        } catch (NumberFormatException e) {
            log.warn("Stored approval_id '{}' is not an integer (sub_id={})", node.asText(), row.getSubId());
            return Optional.empty();
        }
    }

    private static String textOrNull(JsonNode data, String field) {
        JsonNode node = data == null ? null : data.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }
}
