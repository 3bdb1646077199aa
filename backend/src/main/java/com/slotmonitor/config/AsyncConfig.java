package com.slotmonitor.config;

import com.slotmonitor.sync.SyncEngine;
import com.slotmonitor.sync.config.SyncProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Named thread pools for the sync engine: one thread for the slot tracker, one per fill worker.
 * Loops run until the engine cancels them, so the pools are sized exactly and are not shut down early on context
 * close; the engine stops first and interrupts its loops.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = SyncEngine.TRACKER_EXECUTOR)
    public ThreadPoolTaskExecutor slotTrackerExecutor() {
        return loopExecutor(1, "slot-tracker-");
    }

    @Bean(name = SyncEngine.WORKER_EXECUTOR)
    public ThreadPoolTaskExecutor fillWorkerExecutor(SyncProperties syncProperties) {
        return loopExecutor(syncProperties.getWorkers(), "fill-worker-");
    }

    private static ThreadPoolTaskExecutor loopExecutor(int threads, String threadNamePrefix) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(threads);
        e.setMaxPoolSize(threads);
        e.setThreadNamePrefix(threadNamePrefix);
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationSeconds(5);
        e.initialize();
        return e;
    }
}
