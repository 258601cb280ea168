package com.renewalsync.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools. The ledger poller runs its loop on a dedicated single thread so a slow RPC never
 * competes with scheduled jobs.
 */
@Configuration
public class AsyncConfig {

    public static final String LEDGER_POLLER_EXECUTOR = "ledger-poller-executor";

    @Bean(name = LEDGER_POLLER_EXECUTOR)
    public Executor ledgerPollerExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setThreadNamePrefix("ledger-poller-");
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationSeconds(30);
        e.initialize();
        return e;
    }
}
