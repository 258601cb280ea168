package com.renewalsync.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {
        AsyncConfig.class,
        SchedulerConfig.class,
        ClockConfig.class
})
class ExecutorAndSchedulerConfigTest {

    @Autowired
    @Qualifier(AsyncConfig.LEDGER_POLLER_EXECUTOR)
    Executor ledgerPollerExecutor;

    @Autowired
    @Qualifier(SchedulerConfig.SCHEDULER_POOL)
    ThreadPoolTaskScheduler schedulerPool;

    @Autowired
    Clock clock;

    @Test
    @DisplayName("poller runs on its own single-thread executor")
    void ledgerPollerExecutor_isSingleThreaded() {
        assertThat(ledgerPollerExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor e = (ThreadPoolTaskExecutor) ledgerPollerExecutor;
        assertThat(e.getCorePoolSize()).isEqualTo(1);
        assertThat(e.getMaxPoolSize()).isEqualTo(1);
        assertThat(e.getThreadNamePrefix()).isEqualTo("ledger-poller-");
    }

    @Test
    void schedulerPoolCreated() {
        assertThat(schedulerPool.getThreadNamePrefix()).isEqualTo("scheduler-");
        assertThat(schedulerPool.getPoolSize()).isLessThanOrEqualTo(1);
    }

    @Test
    void clock_isUtc() {
        assertThat(clock.getZone()).isEqualTo(ZoneOffset.UTC);
    }
}
