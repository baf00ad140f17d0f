package com.flagship.credit_ledger.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Scheduler shared by the outbox publisher, metrics refresh, catalog refresh
 * and reconciliation sweeps.
 *
 * The deposit sweep can block its thread on chain lookups and on credit
 * retries for minutes; the pool must leave threads for the other jobs, in
 * particular the release of timed-out reservations.
 */
@Configuration
@Slf4j
public class SchedulingConfig {

    static final int MIN_POOL_SIZE = 2;

    @Bean
    public ThreadPoolTaskScheduler taskScheduler(@Value("${scheduling.pool-size:4}") int poolSize) {
        if (poolSize < MIN_POOL_SIZE) {
            throw new IllegalArgumentException("scheduling.pool-size must be at least " + MIN_POOL_SIZE);
        }
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("ledger-scheduler-");
        scheduler.setErrorHandler(e -> log.error("Scheduled task failed: {}", e.getMessage(), e));
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        return scheduler;
    }
}
