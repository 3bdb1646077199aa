package com.slotmonitor.sync.config;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Sync engine tuning. monitoringDepth is both the retention horizon (in slots) and the block cache capacity.
 */
@ConfigurationProperties(prefix = "slotmonitor.sync")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class SyncProperties {

    /** Tracker tick period; workers sleep a full tick when the queue is empty. */
    @Min(1)
    private long monitorIntervalMs = 1_000;

    @Min(1)
    private long monitoringDepth = 10_000;

    @Min(1)
    private int workers = 5;

    /** Upper bound a gap is widened to when re-queued. */
    @Min(1)
    private long intervalSize = 100;

    /** Gaps smaller than this are not worth another round trip. */
    @Min(1)
    private long minIntervalSize = 5;

    /** Workers pause monitorIntervalMs / pollDivider between intervals. */
    @Min(1)
    private long pollDivider = 10;

    public long workerPauseMs() {
        return Math.max(1, monitorIntervalMs / pollDivider);
    }
}
