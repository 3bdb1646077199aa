package com.slotmonitor.sync;

/**
 * Inclusive range of slot numbers [start, end]; the unit of work passed between the tracker and the fill workers.
 * A range with end &lt; start is empty and has size 0.
 */
public record SlotInterval(long start, long end) {

    public long size() {
        return end >= start ? end - start + 1 : 0;
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}
