package com.renewalsync.ingestion.job;

import com.renewalsync.renewal.lock.RenewalLockService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic backstop for holders that died without releasing: expires every active lock past its TTL.
 * Acquisition already self-heals per key, so this only keeps the table tidy and {@code isLocked} accurate.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RenewalLockSweepJob {

    private final RenewalLockService renewalLockService;

    @Scheduled(
            fixedDelayString = "${renewalsync.renewal.lock.sweep-interval-ms:300000}",
            initialDelayString = "${renewalsync.renewal.lock.sweep-interval-ms:300000}")
    public void runScheduled() {
        try {
            renewalLockService.releaseExpiredLocks();
        } catch (Exception e) {
            log.error("Expired renewal lock sweep failed", e);
        }
    }
}
