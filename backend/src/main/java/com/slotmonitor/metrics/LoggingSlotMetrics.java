package com.slotmonitor.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Writes metrics as structured log lines under the metrics.* loggers. Operations slower than
 * {@link #SLOW_OPERATION_THRESHOLD_MS} are reported at WARN.
 */
@Component
public class LoggingSlotMetrics implements SlotMetrics {

    static final long SLOW_OPERATION_THRESHOLD_MS = 1000;

    private static final Logger chainLog = LoggerFactory.getLogger("metrics.chain");
    private static final Logger rpcLog = LoggerFactory.getLogger("metrics.rpc");
    private static final Logger cacheLog = LoggerFactory.getLogger("metrics.cache");
    private static final Logger performanceLog = LoggerFactory.getLogger("metrics.performance");

    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();

    @Override
    public void recordLatestSlot(long slot) {
        chainLog.info("metric=latest_slot slot={}", slot);
    }

    @Override
    public void recordGetBlocksElapsed(Duration elapsed) {
        rpcLog.debug("metric=operation_duration operation=get_blocks elapsedMs={}", elapsed.toMillis());
        logPerformance("get_blocks", elapsed);
    }

    @Override
    public void recordIsSlotConfirmedElapsed(Duration elapsed) {
        rpcLog.debug("metric=operation_duration operation=is_slot_confirmed elapsedMs={}", elapsed.toMillis());
        logPerformance("is_slot_confirmed", elapsed);
    }

    @Override
    public void recordCacheHit(boolean hit) {
        long hits = hit ? cacheHits.incrementAndGet() : cacheHits.get();
        long misses = hit ? cacheMisses.get() : cacheMisses.incrementAndGet();
        cacheLog.debug("metric=cache_performance result={} hits={} misses={}", hit ? "hit" : "miss", hits, misses);
    }

    long cacheHits() {
        return cacheHits.get();
    }

    long cacheMisses() {
        return cacheMisses.get();
    }

    private void logPerformance(String operation, Duration elapsed) {
        long elapsedMs = elapsed.toMillis();
        if (elapsedMs > SLOW_OPERATION_THRESHOLD_MS) {
            performanceLog.warn("Slow operation detected: operation={} elapsedMs={} thresholdMs={}",
                    operation, elapsedMs, SLOW_OPERATION_THRESHOLD_MS);
        } else {
            performanceLog.trace("operation={} elapsedMicros={}", operation, elapsed.toNanos() / 1_000);
        }
    }
}
