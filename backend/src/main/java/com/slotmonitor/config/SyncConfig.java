package com.slotmonitor.config;

import com.slotmonitor.cache.BlockCache;
import com.slotmonitor.sync.IntervalQueue;
import com.slotmonitor.sync.SlotWatermark;
import com.slotmonitor.sync.config.SyncProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Shared state of the sync engine. One instance of each, handed to the tracker, the workers and the HTTP layer.
 */
@Configuration
@EnableConfigurationProperties(SyncProperties.class)
public class SyncConfig {

    /** Sized to the monitoring depth: one entry per slot that can still be in the window. */
    @Bean
    public BlockCache blockCache(SyncProperties syncProperties) {
        return new BlockCache(syncProperties.getMonitoringDepth());
    }

    @Bean
    public IntervalQueue intervalQueue() {
        return new IntervalQueue();
    }

    @Bean
    public SlotWatermark slotWatermark() {
        return new SlotWatermark();
    }
}
