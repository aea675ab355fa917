package com.warmlead.crm.sync.config;

import com.warmlead.crm.sync.service.BackoffSleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Threads, time and delays used by the sync engine.
 * 
 * Deadline races run the guarded operation on syncTaskExecutor while the caller waits
 * with a timeout. Guards nest (a sync-level race around batch-level races), so the pool
 * is unbounded: a fixed pool could deadlock with every thread waiting on a nested task.
 */
@Configuration
public class SyncExecutionConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService syncTaskExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("crm-sync-"));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BackoffSleeper backoffSleeper() {
        return Thread::sleep;
    }
}
