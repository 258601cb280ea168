package com.renewalsync.ingestion.job;

/**
 * Lifecycle of {@link LedgerEventPoller}. Owned by the poller; callers only observe it through
 * {@link LedgerEventPoller#status()}.
 */
public sealed interface PollerState permits PollerState.Stopped, PollerState.Running {

    static PollerState stopped() {
        return Stopped.INSTANCE;
    }

    /** Not polling. */
    final class Stopped implements PollerState {

        static final Stopped INSTANCE = new Stopped();

        private Stopped() {
        }

        @Override
        public String toString() {
            return "Stopped";
        }
    }

    /**
     * Polling; {@code lastProcessedLedger} is the cursor the next iteration reads from. It reads 0 until the
     * first iteration has loaded the stored cursor.
     */
    record Running(long lastProcessedLedger) implements PollerState {
    }
}
