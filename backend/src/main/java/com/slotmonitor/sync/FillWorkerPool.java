package com.slotmonitor.sync;

import com.slotmonitor.cache.BlockCache;
import com.slotmonitor.metrics.SlotMetrics;
import com.slotmonitor.rpc.ChainRpcClient;
import com.slotmonitor.sync.config.SyncProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Fixed set of {@link FillWorker}s draining the shared interval queue. No coordination between workers beyond the
 * queue itself; overlapping work is possible after re-queues and harmless because cache writes are idempotent.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FillWorkerPool {

    private final IntervalQueue intervalQueue;
    private final BlockCache blockCache;
    private final ChainRpcClient chainRpcClient;
    private final SlotWatermark slotWatermark;
    private final SlotMetrics slotMetrics;
    private final SyncProperties syncProperties;

    private final List<LoopHandle> running = new ArrayList<>();

    public List<FillWorker> createWorkers() {
        List<FillWorker> workers = new ArrayList<>(syncProperties.getWorkers());
        for (int workerId = 0; workerId < syncProperties.getWorkers(); workerId++) {
            workers.add(new FillWorker(workerId, intervalQueue, blockCache, chainRpcClient, slotWatermark, slotMetrics, syncProperties));
        }
        return workers;
    }

    /**
     * Starts every worker on the executor. The returned future completes once all workers have ended; a worker that
     * dies on its own is logged immediately while the others keep running.
     */
    public synchronized CompletableFuture<Void> start(ExecutorService executor) {
        if (!running.isEmpty()) {
            throw new IllegalStateException("Fill worker pool already started");
        }
        List<FillWorker> workers = createWorkers();
        log.info("Starting fill worker pool with {} workers", workers.size());
        List<CompletableFuture<Void>> completions = new ArrayList<>();
        for (FillWorker worker : workers) {
            LoopHandle handle = LoopHandle.start("fill-worker-" + worker.getWorkerId(), worker, executor);
            running.add(handle);
            completions.add(handle.completion().whenComplete((ignored, error) -> {
                if (error != null) {
                    log.error("Worker {} ended unexpectedly", handle.name(), error);
                } else {
                    log.info("Worker {} stopped", handle.name());
                }
            }));
        }
        return CompletableFuture.allOf(completions.toArray(new CompletableFuture[0]));
    }

    public synchronized void stop() {
        running.forEach(LoopHandle::cancel);
        running.clear();
    }
}
