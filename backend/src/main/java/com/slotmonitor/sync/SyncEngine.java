package com.slotmonitor.sync;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Runs the slot tracker and the fill worker pool side by side over the shared cache and queue.
 * Both sides loop forever; if either one ends while the engine is running, that is logged at ERROR and handed to the
 * {@link EngineTerminationHandler}. Stopping cancels both sides at once without draining the queue.
 */
@Component
@ConditionalOnProperty(prefix = "slotmonitor.sync", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class SyncEngine implements SmartLifecycle {

    public static final String TRACKER_EXECUTOR = "slot-tracker-executor";
    public static final String WORKER_EXECUTOR = "fill-worker-executor";

    static final String TRACKER = "slot-tracker";
    static final String WORKER_POOL = "fill-worker-pool";

    private final SlotTracker slotTracker;
    private final FillWorkerPool fillWorkerPool;
    private final ThreadPoolTaskExecutor trackerExecutor;
    private final ThreadPoolTaskExecutor workerExecutor;
    private final EngineTerminationHandler terminationHandler;

    private volatile boolean running;
    private LoopHandle trackerHandle;

    public SyncEngine(SlotTracker slotTracker,
                      FillWorkerPool fillWorkerPool,
                      @Qualifier(TRACKER_EXECUTOR) ThreadPoolTaskExecutor trackerExecutor,
                      @Qualifier(WORKER_EXECUTOR) ThreadPoolTaskExecutor workerExecutor,
                      EngineTerminationHandler terminationHandler) {
        this.slotTracker = slotTracker;
        this.fillWorkerPool = fillWorkerPool;
        this.trackerExecutor = trackerExecutor;
        this.workerExecutor = workerExecutor;
        this.terminationHandler = terminationHandler;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        log.info("Starting block synchronizer");
        running = true;
        trackerHandle = LoopHandle.start(TRACKER, slotTracker, trackerExecutor.getThreadPoolExecutor());
        CompletableFuture<Void> pool = fillWorkerPool.start(workerExecutor.getThreadPoolExecutor());

        trackerHandle.completion().whenComplete((ignored, error) -> onSideEnded(TRACKER, error));
        pool.whenComplete((ignored, error) -> onSideEnded(WORKER_POOL, error));
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        log.info("Stopping block synchronizer");
        if (trackerHandle != null) {
            trackerHandle.cancel();
            trackerHandle = null;
        }
        fillWorkerPool.stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void onSideEnded(String component, Throwable error) {
        if (!running) {
            log.debug("{} stopped after shutdown", component);
            return;
        }
        if (error != null) {
            log.error("{} task ended unexpectedly", component, error);
        } else {
            log.error("{} task ended unexpectedly", component);
        }
        terminationHandler.onUnexpectedTermination(component, error);
    }
}
