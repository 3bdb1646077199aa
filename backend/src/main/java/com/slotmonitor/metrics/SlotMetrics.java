package com.slotmonitor.metrics;

import java.time.Duration;

/**
 * Fire-and-forget metrics sink for the sync engine and the confirmation endpoint.
 */
public interface SlotMetrics {

    void recordLatestSlot(long slot);

    void recordGetBlocksElapsed(Duration elapsed);

    void recordIsSlotConfirmedElapsed(Duration elapsed);

    void recordCacheHit(boolean hit);
}
