package com.slotmonitor.sync;

import com.slotmonitor.cache.BlockCache;
import com.slotmonitor.metrics.SlotMetrics;
import com.slotmonitor.rpc.ChainRpcClient;
import com.slotmonitor.rpc.RpcException;
import com.slotmonitor.sync.config.SyncProperties;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * One fill worker: pops an interval, fetches its confirmed slots in a single getBlocks call, caches them and
 * re-queues the gaps that are still worth another look.
 */
@Slf4j
public class FillWorker implements Runnable {

    public enum Outcome {
        /** Queue was empty. */
        IDLE,
        PROCESSED,
        /** RPC failed; the interval went back to the queue unchanged. */
        FAILED
    }

    private final int workerId;
    private final IntervalQueue intervalQueue;
    private final BlockCache blockCache;
    private final ChainRpcClient chainRpcClient;
    private final SlotWatermark slotWatermark;
    private final SlotMetrics slotMetrics;
    private final SyncProperties syncProperties;
    private final RetentionPolicy retentionPolicy;

    public FillWorker(int workerId,
                      IntervalQueue intervalQueue,
                      BlockCache blockCache,
                      ChainRpcClient chainRpcClient,
                      SlotWatermark slotWatermark,
                      SlotMetrics slotMetrics,
                      SyncProperties syncProperties) {
        this.workerId = workerId;
        this.intervalQueue = intervalQueue;
        this.blockCache = blockCache;
        this.chainRpcClient = chainRpcClient;
        this.slotWatermark = slotWatermark;
        this.slotMetrics = slotMetrics;
        this.syncProperties = syncProperties;
        this.retentionPolicy = new RetentionPolicy(syncProperties.getMinIntervalSize(), syncProperties.getMonitoringDepth());
    }

    public Outcome processNext() {
        Optional<SlotInterval> next = intervalQueue.pop();
        if (next.isEmpty()) {
            return Outcome.IDLE;
        }
        return process(next.get());
    }

    Outcome process(SlotInterval interval) {
        log.debug("Worker {} got interval {} (size {})", workerId, interval, interval.size());
        List<Long> confirmed;
        long started = System.nanoTime();
        try {
            confirmed = chainRpcClient.getBlocks(interval.start(), interval.end());
        } catch (RpcException e) {
            log.error("Worker {} failed to process interval {}: {}", workerId, interval, e.getMessage());
            intervalQueue.push(interval);
            return Outcome.FAILED;
        } finally {
            slotMetrics.recordGetBlocksElapsed(Duration.ofNanos(System.nanoTime() - started));
        }

        int inserted = 0;
        for (long slot : confirmed) {
            if (blockCache.insert(slot)) {
                inserted++;
            }
        }

        List<SlotInterval> candidates = IntervalSplitter.split(interval, confirmed, syncProperties.getIntervalSize());
        int requeued = 0;
        for (SlotInterval candidate : candidates) {
            switch (retentionPolicy.evaluate(candidate, slotWatermark)) {
                case KEEP -> {
                    intervalQueue.push(candidate);
                    requeued++;
                    log.debug("Worker {} re-queued sub-interval {} (size {})", workerId, candidate, candidate.size());
                }
                case TOO_SMALL -> log.debug("Worker {} dropped sub-interval {}: size {} below minimum",
                        workerId, candidate, candidate.size());
                case TOO_OLD -> log.debug("Worker {} dropped sub-interval {}: behind monitoring window", workerId, candidate);
            }
        }
        log.info("Worker {} processed interval {}: confirmed={}, cached={}, candidates={}, requeued={}, cacheSize={}",
                workerId, interval, confirmed.size(), inserted, candidates.size(), requeued, blockCache.len());
        return Outcome.PROCESSED;
    }

    /**
     * Loops until interrupted: a short pause after each interval, a full tick when there was nothing to do.
     */
    @Override
    public void run() {
        log.info("Fill worker {} started", workerId);
        while (!Thread.currentThread().isInterrupted()) {
            Outcome outcome = processNext();
            long pauseMs = outcome == Outcome.IDLE ? syncProperties.getMonitorIntervalMs() : syncProperties.workerPauseMs();
            try {
                TimeUnit.MILLISECONDS.sleep(pauseMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Fill worker {} interrupted", workerId);
    }

    public int getWorkerId() {
        return workerId;
    }
}
