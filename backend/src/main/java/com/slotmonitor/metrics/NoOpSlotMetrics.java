package com.slotmonitor.metrics;

import java.time.Duration;

public class NoOpSlotMetrics implements SlotMetrics {

    @Override
    public void recordLatestSlot(long slot) {
    }

    @Override
    public void recordGetBlocksElapsed(Duration elapsed) {
    }

    @Override
    public void recordIsSlotConfirmedElapsed(Duration elapsed) {
    }

    @Override
    public void recordCacheHit(boolean hit) {
    }
}
