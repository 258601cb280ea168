package com.renewalsync.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Billing-owned subscription row; only the columns ledger handlers read or write are mapped.
 */
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Subscription {

    @EqualsAndHashCode.Include
    private Long id;
    private Long blockchainSubId;
    private SubscriptionStatus status;
    private int failureCount;
    private Long lastRenewalCycleId;
    private Instant nextBillingDate;
}
