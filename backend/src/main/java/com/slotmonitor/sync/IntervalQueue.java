package com.slotmonitor.sync;

import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Unbounded multi-producer, multi-consumer FIFO of pending intervals.
 * Growth is bounded upstream by the fill workers' drop rules, not here. Consumers poll; nothing blocks.
 */
public class IntervalQueue {

    private final Queue<SlotInterval> intervals = new ConcurrentLinkedQueue<>();

    public void push(SlotInterval interval) {
        if (interval == null) {
            throw new IllegalArgumentException("interval is required");
        }
        intervals.offer(interval);
    }

    /**
     * Head of the queue, or empty when there is nothing to do right now.
     */
    public Optional<SlotInterval> pop() {
        return Optional.ofNullable(intervals.poll());
    }

    /** O(n) on the backing queue; meant for status reporting, not hot paths. */
    public int size() {
        return intervals.size();
    }

    public boolean isEmpty() {
        return intervals.isEmpty();
    }
}
