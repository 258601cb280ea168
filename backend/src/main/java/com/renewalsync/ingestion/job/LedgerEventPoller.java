package com.renewalsync.ingestion.job;

import com.renewalsync.common.RetryPolicy;
import com.renewalsync.config.AsyncConfig;
import com.renewalsync.domain.ContractEventRecord;
import com.renewalsync.domain.ContractEventRepository;
import com.renewalsync.domain.EventCursorRepository;
import com.renewalsync.ingestion.adapter.ContractEvent;
import com.renewalsync.ingestion.adapter.LedgerAdapter;
import com.renewalsync.ingestion.config.LedgerPollerProperties;
import com.renewalsync.ingestion.config.LedgerRpcProperties;
import com.renewalsync.ingestion.event.ContractEventDispatcher;
import com.renewalsync.ingestion.reorg.ReorgHandler;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reconciles the store with the contract's event log in a single cooperative loop.
 * <p>
 * Each iteration reads the ledger head. A head behind the cursor is handed to {@link ReorgHandler} and the
 * iteration ends there. Otherwise events after the cursor are fetched, dispatched in order, their audit rows
 * saved, and only then is the cursor advanced to the highest fetched ledger. A crash between the two steps
 * re-reads the batch, which the idempotent handlers and the audit unique key absorb.
 * <p>
 * A failed iteration is logged and retried after an exponential backoff capped at
 * {@code renewalsync.ledger.poller.max-backoff-ms}; the loop itself never dies from one.
 */
@Component
@Slf4j
public class LedgerEventPoller {

    private static final double BACKOFF_JITTER = 0.2;

    private final LedgerAdapter ledgerAdapter;
    private final ContractEventDispatcher dispatcher;
    private final ContractEventRepository contractEventRepository;
    private final EventCursorRepository cursorRepository;
    private final ReorgHandler reorgHandler;
    private final LedgerPollerProperties pollerProperties;
    private final Executor executor;
    private final RetryPolicy backoff;

    private final AtomicReference<PollerState> state = new AtomicReference<>(PollerState.stopped());
    /** Bumped on every start/stop so a loop from an earlier run exits even if the poller was restarted. */
    private final AtomicLong generation = new AtomicLong();
    private final Object sleepMonitor = new Object();
    /** False until the current run has read the stored cursor; the read happens inside the loop. */
    private volatile boolean cursorLoaded;

    public LedgerEventPoller(
            LedgerAdapter ledgerAdapter,
            ContractEventDispatcher dispatcher,
            ContractEventRepository contractEventRepository,
            EventCursorRepository cursorRepository,
            ReorgHandler reorgHandler,
            LedgerPollerProperties pollerProperties,
            LedgerRpcProperties rpcProperties,
            @Qualifier(AsyncConfig.LEDGER_POLLER_EXECUTOR) Executor executor) {
        rpcProperties.requireContractAddress();
        this.ledgerAdapter = ledgerAdapter;
        this.dispatcher = dispatcher;
        this.contractEventRepository = contractEventRepository;
        this.cursorRepository = cursorRepository;
        this.reorgHandler = reorgHandler;
        this.pollerProperties = pollerProperties;
        this.executor = executor;
        this.backoff = new RetryPolicy(
                pollerProperties.getPollIntervalMs(), BACKOFF_JITTER, Integer.MAX_VALUE, pollerProperties.getMaxBackoffMs());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (pollerProperties.isEnabled()) {
            start();
        } else {
            log.info("Ledger event poller disabled (renewalsync.ledger.poller.enabled=false)");
        }
    }

    /**
     * Starts the loop. No-op when already running. The stored cursor is read by the first iteration, so a
     * store outage at startup is retried with the usual backoff.
     */
    public synchronized void start() {
        if (state.get() instanceof PollerState.Running) {
            return;
        }
        long runGeneration = generation.incrementAndGet();
        cursorLoaded = false;
        state.set(new PollerState.Running(0L));
        log.info("Ledger event poller started");
        executor.execute(() -> runLoop(runGeneration));
    }

    /**
     * Asks the loop to exit. The current iteration, if any, completes; the pending sleep is cut short.
     */
    @PreDestroy
    public synchronized void stop() {
        if (state.get() instanceof PollerState.Stopped) {
            return;
        }
        state.set(PollerState.stopped());
        generation.incrementAndGet();
        synchronized (sleepMonitor) {
            sleepMonitor.notifyAll();
        }
        log.info("Ledger event poller stopped");
    }

    public PollerState status() {
        return state.get();
    }

    private void runLoop(long runGeneration) {
        int consecutiveFailures = 0;
        while (isCurrent(runGeneration)) {
            long delayMs;
            try {
                pollOnce();
                consecutiveFailures = 0;
                delayMs = pollerProperties.getPollIntervalMs();
            } catch (Exception e) {
                consecutiveFailures++;
                delayMs = backoff.delayMs(consecutiveFailures - 1);
                log.error("Ledger poll iteration failed ({} consecutive); next attempt in {} ms",
                        consecutiveFailures, delayMs, e);
            }
            if (!isCurrent(runGeneration) || !sleep(delayMs, runGeneration)) {
                break;
            }
        }
        log.debug("Ledger poll loop exited (generation {})", runGeneration);
    }

    /**
     * One reconciliation step. Throws on RPC or store failure; the caller decides how to back off.
     */
    void pollOnce() {
        long lastProcessed = lastProcessedLedger();
        long head = ledgerAdapter.getLatestLedger();
        if (head < lastProcessed) {
            reorgHandler.handleReorg(head, lastProcessed);
            updateLastProcessed(cursorRepository.findLastLedger());
            return;
        }
        if (head == lastProcessed) {
            return;
        }

        List<ContractEvent> events = ledgerAdapter.getEvents(lastProcessed + 1);
        if (events.isEmpty()) {
            return;
        }

        List<ContractEventRecord> records = new ArrayList<>(events.size());
        long maxLedger = lastProcessed;
        for (ContractEvent event : events) {
            dispatcher.dispatch(event).ifPresent(records::add);
            maxLedger = Math.max(maxLedger, event.ledger());
        }
        if (!records.isEmpty()) {
            int inserted = contractEventRepository.insertAll(records);
            log.info("Saved contract events: {} processed, {} new, up to ledger {}", records.size(), inserted, maxLedger);
        }

        if (cursorRepository.advance(maxLedger)) {
            updateLastProcessed(maxLedger);
        } else {
            long stored = cursorRepository.findLastLedger();
            log.info("Cursor already at {} (ahead of {}); adopting stored value", stored, maxLedger);
            updateLastProcessed(stored);
        }
    }

    private long lastProcessedLedger() {
        PollerState current = state.get();
        if (current instanceof PollerState.Running running && cursorLoaded) {
            return running.lastProcessedLedger();
        }
        long stored = cursorRepository.findLastLedger();
        if (current instanceof PollerState.Running) {
            updateLastProcessed(stored);
            cursorLoaded = true;
            log.info("Ledger event poller resuming from ledger {}", stored);
        }
        return stored;
    }

    private void updateLastProcessed(long ledger) {
        state.updateAndGet(s -> s instanceof PollerState.Running ? new PollerState.Running(ledger) : s);
    }

    private boolean isCurrent(long runGeneration) {
        return generation.get() == runGeneration && state.get() instanceof PollerState.Running;
    }

    /** @return false when the loop should exit instead of continuing */
    private boolean sleep(long delayMs, long runGeneration) {
        long deadline = System.currentTimeMillis() + Math.max(0L, delayMs);
        synchronized (sleepMonitor) {
            long remaining = deadline - System.currentTimeMillis();
            while (remaining > 0 && isCurrent(runGeneration)) {
                try {
                    sleepMonitor.wait(remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Ledger poll loop interrupted; exiting");
                    return false;
                }
                remaining = deadline - System.currentTimeMillis();
            }
        }
        return isCurrent(runGeneration);
    }
}
