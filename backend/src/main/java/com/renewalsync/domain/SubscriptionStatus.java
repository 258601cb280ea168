package com.renewalsync.domain;

import java.util.Locale;

/**
 * Values of {@code subscriptions.status} written by ledger event handlers and reorg compensation.
 */
public enum SubscriptionStatus {

    ACTIVE,
    RETRYING,
    CANCELLED,
    PENDING;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SubscriptionStatus fromDbValue(String value) {
        if (value == null) {
            return null;
        }
        return valueOf(value.toUpperCase(Locale.ROOT));
    }

    /**
     * Maps the contract's state names (Active, Retrying, Failed) to the off-chain status.
     * Anything else falls back to {@link #ACTIVE}.
     */
    public static SubscriptionStatus fromContractState(String contractState) {
        if (contractState == null) {
            return ACTIVE;
        }
        return switch (contractState) {
            case "Retrying" -> RETRYING;
            case "Failed" -> CANCELLED;
            default -> ACTIVE;
        };
    }
}
