package com.renewalsync.ingestion.event;

import com.renewalsync.domain.ContractEventRecord;
import com.renewalsync.domain.ContractEventType;
import com.renewalsync.ingestion.adapter.ContractEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Events that change no off-chain state: the contract's duplicate-renewal guard and its own lock lifecycle.
 * They are logged and kept in the audit trail only.
 */
@Component
@Slf4j
public class InformationalEventHandler {

    public ContractEventRecord onDuplicateRenewalRejected(ContractEvent event) {
        EventPayload payload = EventPayload.of(event);
        long subId = payload.subId();
        log.warn("Duplicate renewal rejected by contract: sub_id={}, cycle_id={}, ledger={}",
                subId, payload.raw("cycle_id"), event.ledger());
        return record(subId, ContractEventType.DUPLICATE_RENEWAL_REJECTED, event);
    }

    public ContractEventRecord onLockAcquired(ContractEvent event) {
        EventPayload payload = EventPayload.of(event);
        long subId = payload.subId();
        log.info("Renewal lock acquired on-chain: sub_id={}, locked_at={}, lock_timeout={}",
                subId, payload.raw("locked_at"), payload.raw("lock_timeout"));
        return record(subId, ContractEventType.RENEWAL_LOCK_ACQUIRED, event);
    }

    public ContractEventRecord onLockReleased(ContractEvent event) {
        EventPayload payload = EventPayload.of(event);
        long subId = payload.subId();
        log.info("Renewal lock released on-chain: sub_id={}, released_at={}", subId, payload.raw("released_at"));
        return record(subId, ContractEventType.RENEWAL_LOCK_RELEASED, event);
    }

    public ContractEventRecord onLockExpired(ContractEvent event) {
        EventPayload payload = EventPayload.of(event);
        long subId = payload.subId();
        log.warn("Renewal lock expired on-chain: sub_id={}, original_locked_at={}, expired_at={}",
                subId, payload.raw("original_locked_at"), payload.raw("expired_at"));
        return record(subId, ContractEventType.RENEWAL_LOCK_EXPIRED, event);
    }

    private static ContractEventRecord record(long subId, ContractEventType type, ContractEvent event) {
        return ContractEventRecord.of(subId, type, event.ledger(), event.txHash(), event.value());
    }
}
