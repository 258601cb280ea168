package com.renewalsync.domain;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of contract event kinds the service understands. {@link #UNKNOWN} stands for anything the
 * contract emits that this build does not know yet; such events are logged and dropped.
 * <p>
 * {@code wireName} is the event type reported by the ledger RPC, {@code auditName} the value stored in
 * {@code contract_events.event_type}.
 */
public enum ContractEventType {

    RENEWAL_SUCCESS("RenewalSuccess", "renewal_success"),
    RENEWAL_FAILED("RenewalFailed", "renewal_failed"),
    STATE_TRANSITION("StateTransition", "state_transition"),
    APPROVAL_CREATED("ApprovalCreated", "approval_created"),
    APPROVAL_REJECTED("ApprovalRejected", "approval_rejected"),
    DUPLICATE_RENEWAL_REJECTED("DuplicateRenewalRejected", "duplicate_renewal_rejected"),
    RENEWAL_LOCK_ACQUIRED("RenewalLockAcquired", "renewal_lock_acquired"),
    RENEWAL_LOCK_RELEASED("RenewalLockReleased", "renewal_lock_released"),
    RENEWAL_LOCK_EXPIRED("RenewalLockExpired", "renewal_lock_expired"),
    UNKNOWN("", "unknown");

    private static final Map<String, ContractEventType> BY_WIRE_NAME = Arrays.stream(values())
            .filter(t -> t != UNKNOWN)
            .collect(Collectors.toUnmodifiableMap(ContractEventType::getWireName, Function.identity()));

    private static final Map<String, ContractEventType> BY_AUDIT_NAME = Arrays.stream(values())
            .filter(t -> t != UNKNOWN)
            .collect(Collectors.toUnmodifiableMap(ContractEventType::getAuditName, Function.identity()));

    private final String wireName;
    private final String auditName;

    ContractEventType(String wireName, String auditName) {
        this.wireName = wireName;
        this.auditName = auditName;
    }

    public String getWireName() {
        return wireName;
    }

    public String getAuditName() {
        return auditName;
    }

    public static ContractEventType fromWireName(String name) {
        return name == null ? UNKNOWN : BY_WIRE_NAME.getOrDefault(name, UNKNOWN);
    }

    public static ContractEventType fromAuditName(String name) {
        return name == null ? UNKNOWN : BY_AUDIT_NAME.getOrDefault(name, UNKNOWN);
    }
}
