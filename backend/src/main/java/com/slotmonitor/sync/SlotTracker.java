package com.slotmonitor.sync;

import com.slotmonitor.metrics.SlotMetrics;
import com.slotmonitor.rpc.ChainRpcClient;
import com.slotmonitor.rpc.RpcException;
import com.slotmonitor.sync.config.SyncProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Polls the chain head every tick and queues the newly exposed range, clipped to the monitoring depth.
 * The only producer of fresh intervals; workers only refine what it queued.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SlotTracker implements Runnable {

    private final ChainRpcClient chainRpcClient;
    private final IntervalQueue intervalQueue;
    private final SlotWatermark slotWatermark;
    private final SlotMetrics slotMetrics;
    private final SyncProperties syncProperties;

    /**
     * One tick. An RPC failure skips the tick and leaves the watermark untouched.
     *
     * @return the interval queued on this tick, if any
     */
    public Optional<SlotInterval> tick() {
        long head;
        try {
            head = chainRpcClient.getLatestSlot();
        } catch (RpcException e) {
            log.error("Failed to fetch latest slot, skipping tick: {}", e.getMessage());
            return Optional.empty();
        }
        slotMetrics.recordLatestSlot(head);

        long begin = Math.max(slotWatermark.lastTrackedSlot() + 1, head - syncProperties.getMonitoringDepth());
        SlotInterval queued = null;
        if (begin <= head) {
            queued = new SlotInterval(begin, head);
            intervalQueue.push(queued);
            log.info("Queued interval {} (size {})", queued, queued.size());
        }
        slotWatermark.advanceTo(head);
        log.debug("Latest slot {}", head);
        return Optional.ofNullable(queued);
    }

    /**
     * Ticks at a fixed rate until the thread is interrupted. A slow tick delays the next one instead of bunching.
     */
    @Override
    public void run() {
        long periodNanos = TimeUnit.MILLISECONDS.toNanos(syncProperties.getMonitorIntervalMs());
        log.info("Slot tracker started, updating every {}ms", syncProperties.getMonitorIntervalMs());
        long nextTick = System.nanoTime();
        while (!Thread.currentThread().isInterrupted()) {
            tick();
            nextTick += periodNanos;
            long now = System.nanoTime();
            if (nextTick < now) {
                nextTick = now;
            }
            try {
                TimeUnit.NANOSECONDS.sleep(nextTick - now);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Slot tracker interrupted");
    }
}
