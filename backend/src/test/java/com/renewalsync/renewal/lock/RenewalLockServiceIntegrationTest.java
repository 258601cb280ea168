package com.renewalsync.renewal.lock;

import com.renewalsync.domain.RenewalLock;
import com.renewalsync.domain.RenewalLockRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "renewalsync.ledger.rpc.contract-address=CTESTCONTRACT",
        "renewalsync.ledger.poller.enabled=false"
})
@Testcontainers(disabledWithoutDocker = true)
class RenewalLockServiceIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"));

    @DynamicPropertySource
    static void datasourceProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    RenewalLockService lockService;
    @Autowired
    RenewalLockRepository lockRepository;
    @Autowired
    JdbcTemplate jdbc;

    @BeforeEach
    void clean() {
        jdbc.update("TRUNCATE renewal_locks");
    }

    @Test
    @DisplayName("second holder is refused until the first releases; a released lock is never reused")
    void acquireReleaseAcquire() {
        assertThat(lockService.acquireLock("sub-a", 1L, "w1", 30_000L)).isTrue();
        assertThat(lockService.acquireLock("sub-a", 1L, "w2", 30_000L)).isFalse();
        assertThat(lockService.isLocked("sub-a")).isTrue();

        lockService.releaseLock("sub-a", 1L);
        assertThat(lockService.isLocked("sub-a")).isFalse();
        assertThat(lockService.acquireLock("sub-a", 1L, "w3", 30_000L)).isTrue();

        List<RenewalLock> rows = lockRepository.findBySubscriptionIdAndCycleId("sub-a", 1L);
        assertThat(rows).extracting(RenewalLock::getLockHolder).containsExactly("w1", "w3");
        assertThat(rows).extracting(RenewalLock::getStatus)
                .containsExactly(RenewalLock.LockStatus.RELEASED, RenewalLock.LockStatus.ACTIVE);
    }

    @Test
    void differentCycles_lockIndependently() {
        assertThat(lockService.acquireLock("sub-a", 20260315L, "w1", 30_000L)).isTrue();
        assertThat(lockService.acquireLock("sub-a", 20260415L, "w2", 30_000L)).isTrue();
        assertThat(lockService.acquireLock("sub-b", 20260315L, "w3", 30_000L)).isTrue();
    }

    @Test
    void releaseLock_withoutLock_isNoOp() {
        lockService.releaseLock("sub-missing", 1L);
        assertThat(lockRepository.findBySubscriptionIdAndCycleId("sub-missing", 1L)).isEmpty();
    }

    @Test
    @DisplayName("an active row past its expiry does not block a new acquisition for the same key")
    void staleActiveRow_selfHeals() {
        insertLock("sub-a", 1L, "crashed", Instant.now().minusSeconds(60), "active");

        assertThat(lockService.isLocked("sub-a")).isFalse();
        assertThat(lockService.acquireLock("sub-a", 1L, "w2", 30_000L)).isTrue();

        assertThat(lockRepository.findBySubscriptionIdAndCycleId("sub-a", 1L))
                .extracting(RenewalLock::getStatus)
                .containsExactly(RenewalLock.LockStatus.EXPIRED, RenewalLock.LockStatus.ACTIVE);
    }

    @Test
    @DisplayName("sweep expires exactly the active rows past expiry")
    void releaseExpiredLocks_countsOnlyStaleActiveRows() {
        Instant past = Instant.now().minusSeconds(120);
        Instant future = Instant.now().plusSeconds(120);
        insertLock("s1", 1L, "w", past, "active");
        insertLock("s2", 1L, "w", past, "active");
        insertLock("s3", 1L, "w", future, "active");
        insertLock("s4", 1L, "w", past, "released");
        insertLock("s5", 1L, "w", past, "expired");

        assertThat(lockService.releaseExpiredLocks()).isEqualTo(2);
        assertThat(lockService.releaseExpiredLocks()).isZero();

        assertThat(statusOf("s1")).isEqualTo("expired");
        assertThat(statusOf("s2")).isEqualTo("expired");
        assertThat(statusOf("s3")).isEqualTo("active");
        assertThat(statusOf("s4")).isEqualTo("released");
        assertThat(statusOf("s5")).isEqualTo("expired");
    }

    @Test
    @DisplayName("concurrent acquirers for one key: exactly one wins")
    void concurrentAcquire_singleWinner() throws Exception {
        int workers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < workers; i++) {
                String holder = "w" + i;
                Callable<Boolean> attempt = () -> {
                    go.await();
                    return lockService.acquireLock("sub-race", 20260315L, holder, 30_000L);
                };
                results.add(pool.submit(attempt));
            }
            go.countDown();
            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(30, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    private void insertLock(String subscriptionId, long cycleId, String holder, Instant expiresAt, String status) {
        jdbc.update("""
                INSERT INTO renewal_locks (subscription_id, cycle_id, lock_holder, locked_at, expires_at, status)
                VALUES (?, ?, ?, ?, ?, ?)
                """, subscriptionId, cycleId, holder, Timestamp.from(expiresAt.minusSeconds(30)),
                Timestamp.from(expiresAt), status);
    }

    private String statusOf(String subscriptionId) {
        return jdbc.queryForObject("SELECT status FROM renewal_locks WHERE subscription_id = ?", String.class, subscriptionId);
    }
}
