package com.renewalsync.ingestion.event;

import com.renewalsync.common.CycleIdCodec;
import com.renewalsync.domain.ContractEventRecord;
import com.renewalsync.domain.ContractEventType;
import com.renewalsync.domain.SubscriptionRepository;
import com.renewalsync.domain.SubscriptionStatus;
import com.renewalsync.ingestion.adapter.ContractEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Applies renewal outcome and state events to the subscription row. Every write sets absolute values,
 * so applying the same event again leaves the same state.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SubscriptionEventHandler {

    private final SubscriptionRepository subscriptionRepository;

    /**
     * status=active, failure_count=0, and last_renewal_cycle_id from next_billing_date when that date is known.
     */
    public ContractEventRecord onRenewalSuccess(ContractEvent event) {
        long subId = EventPayload.of(event).subId();
        Long cycleId = subscriptionRepository.findNextBillingDate(subId)
                .map(CycleIdCodec::generateCycleId)
                .orElse(null);
        int updated = subscriptionRepository.markRenewed(subId, cycleId);
        logMissing(updated, subId, event);
        return ContractEventRecord.of(subId, ContractEventType.RENEWAL_SUCCESS, event.ledger(), event.txHash(), event.value());
    }

    public ContractEventRecord onRenewalFailed(ContractEvent event) {
        EventPayload payload = EventPayload.of(event);
        long subId = payload.subId();
        int failureCount = payload.requireInt("failure_count");
        int updated = subscriptionRepository.markRetrying(subId, failureCount);
        logMissing(updated, subId, event);
        return ContractEventRecord.of(subId, ContractEventType.RENEWAL_FAILED, event.ledger(), event.txHash(), event.value());
    }

    public ContractEventRecord onStateTransition(ContractEvent event) {
        EventPayload payload = EventPayload.of(event);
        long subId = payload.subId();
        SubscriptionStatus status = SubscriptionStatus.fromContractState(payload.requireText("new_state"));
        int updated = subscriptionRepository.updateStatus(subId, status);
        logMissing(updated, subId, event);
        return ContractEventRecord.of(subId, ContractEventType.STATE_TRANSITION, event.ledger(), event.txHash(), event.value());
    }

    private static void logMissing(int updated, long subId, ContractEvent event) {
        if (updated == 0) {
            log.debug("{} for sub_id={} matched no subscription row (ledger {})", event.type(), subId, event.ledger());
        }
    }
}
