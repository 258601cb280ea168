package com.renewalsync.ingestion.adapter;

import java.util.List;

/**
 * Read-only view of the ledger used by the poller and reorg detection.
 */
public interface LedgerAdapter {

    /**
     * Current head sequence of the ledger.
     *
     * @throws RpcException when every endpoint attempt failed
     */
    long getLatestLedger();

    /**
     * Contract events from {@code startLedger} (inclusive) onward, in ledger order as returned by the node.
     * Empty when the result carries no events.
     *
     * @throws RpcException when every endpoint attempt failed
     */
    List<ContractEvent> getEvents(long startLedger);
}
