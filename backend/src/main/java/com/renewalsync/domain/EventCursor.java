package com.renewalsync.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Singleton row (id = 1) holding the last ledger whose events were fully persisted.
 */
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class EventCursor {

    public static final int SINGLETON_ID = 1;

    @EqualsAndHashCode.Include
    private int id = SINGLETON_ID;
    private long lastLedger;
    private Instant updatedAt;
}
