package com.slotmonitor.sync;

import java.util.concurrent.atomic.AtomicLong;

/**
 * High-water mark: the most recent chain head seen by {@link SlotTracker}.
 * Only the tracker advances it; workers read it to decide whether a gap is still inside the monitoring window.
 */
public class SlotWatermark {

    private final AtomicLong lastTrackedSlot = new AtomicLong(0);

    public long lastTrackedSlot() {
        return lastTrackedSlot.get();
    }

    /**
     * Stores the head as reported. A head lower than the current value is stored as well (no clamp).
     */
    void advanceTo(long head) {
        lastTrackedSlot.set(head);
    }

    /**
     * Oldest interval end still worth re-checking is strictly greater than this value.
     */
    public long retentionFloor(long monitoringDepth) {
        return lastTrackedSlot.get() - monitoringDepth;
    }
}
