package com.renewalsync.ingestion.event;

import com.renewalsync.domain.ContractEventRecord;
import com.renewalsync.domain.ContractEventType;
import com.renewalsync.ingestion.adapter.ContractEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Routes a ledger event to the handler for its kind and returns the audit record to persist.
 * Unknown kinds and malformed payloads are logged and dropped; store errors propagate to the caller.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContractEventDispatcher {

    private final SubscriptionEventHandler subscriptionEventHandler;
    private final ApprovalEventHandler approvalEventHandler;
    private final InformationalEventHandler informationalEventHandler;

    /**
     * @param event event as reported by the ledger
     * @return the audit record, or empty when the event was dropped
     */
    public Optional<ContractEventRecord> dispatch(ContractEvent event) {
        ContractEventType type = ContractEventType.fromWireName(event.type());
        try {
            ContractEventRecord record = switch (type) {
                case RENEWAL_SUCCESS -> subscriptionEventHandler.onRenewalSuccess(event);
                case RENEWAL_FAILED -> subscriptionEventHandler.onRenewalFailed(event);
                case STATE_TRANSITION -> subscriptionEventHandler.onStateTransition(event);
                case APPROVAL_CREATED -> approvalEventHandler.onApprovalCreated(event);
                case APPROVAL_REJECTED -> approvalEventHandler.onApprovalRejected(event);
                case DUPLICATE_RENEWAL_REJECTED -> informationalEventHandler.onDuplicateRenewalRejected(event);
                case RENEWAL_LOCK_ACQUIRED -> informationalEventHandler.onLockAcquired(event);
                case RENEWAL_LOCK_RELEASED -> informationalEventHandler.onLockReleased(event);
                case RENEWAL_LOCK_EXPIRED -> informationalEventHandler.onLockExpired(event);
                case UNKNOWN -> null;
            };
            if (record == null) {
                log.warn("Dropping unknown contract event type '{}' at ledger {} (tx {})",
                        event.type(), event.ledger(), event.txHash());
            }
            return Optional.ofNullable(record);
        } catch (MalformedEventException e) {
            log.warn("Dropping malformed contract event: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
