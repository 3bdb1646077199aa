package com.slotmonitor.sync;

/**
 * Decides whether a gap is re-queued. Together these two checks are the only thing bounding queue growth.
 */
public class RetentionPolicy {

    public enum Decision {
        KEEP,
        TOO_SMALL,
        TOO_OLD
    }

    private final long minIntervalSize;
    private final long monitoringDepth;

    public RetentionPolicy(long minIntervalSize, long monitoringDepth) {
        this.minIntervalSize = minIntervalSize;
        this.monitoringDepth = monitoringDepth;
    }

    public Decision evaluate(SlotInterval candidate, SlotWatermark watermark) {
        if (candidate.size() < minIntervalSize) {
            return Decision.TOO_SMALL;
        }
        if (candidate.end() <= watermark.retentionFloor(monitoringDepth)) {
            return Decision.TOO_OLD;
        }
        return Decision.KEEP;
    }
}
