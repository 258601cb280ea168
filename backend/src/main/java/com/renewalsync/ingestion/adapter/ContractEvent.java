package com.renewalsync.ingestion.adapter;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One entry of a {@code getEvents} result, as reported by the ledger RPC.
 *
 * @param type       contract event kind, e.g. "RenewalSuccess"
 * @param ledger     ledger sequence the event was emitted in
 * @param txHash     hash of the emitting transaction
 * @param contractId emitting contract
 * @param topics     raw topic strings
 * @param value      event payload (sub_id, failure_count, ...)
 */
public record ContractEvent(
        String type,
        long ledger,
        String txHash,
        String contractId,
        List<String> topics,
        JsonNode value
) {
}
