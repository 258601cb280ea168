package com.renewalsync.domain;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Audit row in contract_events, one per applied ledger event. Never edited; only a reorg rollback deletes it.
 * Unique on (txHash, eventType, subId) so replays are skipped.
 */
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ContractEventRecord {

    @EqualsAndHashCode.Include
    private Long id;
    private long subId;
    /** Audit name, see {@link ContractEventType#getAuditName()}. */
    private String eventType;
    private long ledger;
    private String txHash;
    private JsonNode eventData;
    private Instant processedAt;

    public static ContractEventRecord of(long subId, ContractEventType type, long ledger, String txHash, JsonNode eventData) {
        ContractEventRecord record = new ContractEventRecord();
        record.setSubId(subId);
        record.setEventType(type.getAuditName());
        record.setLedger(ledger);
        record.setTxHash(txHash);
        record.setEventData(eventData);
        return record;
    }

    public ContractEventType type() {
        return ContractEventType.fromAuditName(eventType);
    }
}
