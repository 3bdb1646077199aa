package com.slotmonitor.sync;

import com.slotmonitor.cache.BlockCache;
import com.slotmonitor.metrics.NoOpSlotMetrics;
import com.slotmonitor.rpc.ChainRpcClient;
import com.slotmonitor.rpc.RpcException;
import com.slotmonitor.sync.config.SyncProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FillWorkerPoolTest {

    private IntervalQueue queue;
    private BlockCache cache;
    private SlotWatermark watermark;
    private SyncProperties properties;
    private FakeChain chain;

    @BeforeEach
    void setUp() {
        queue = new IntervalQueue();
        cache = new BlockCache(2_000);
        watermark = new SlotWatermark();
        properties = new SyncProperties();
        properties.setMonitoringDepth(500);
        properties.setWorkers(5);
        properties.setMonitorIntervalMs(20);
        chain = new FakeChain(10_000);
    }

    private FillWorkerPool pool() {
        return new FillWorkerPool(queue, cache, chain, watermark, new NoOpSlotMetrics(), properties);
    }

    /**
     * Drives tracker ticks and worker steps in lock step and returns the deepest queue observed.
     */
    private int simulate(int ticks, int workerStepsPerTick) {
        SlotTracker tracker = new SlotTracker(chain, queue, watermark, new NoOpSlotMetrics(), properties);
        List<FillWorker> workers = pool().createWorkers();
        int maxDepth = 0;
        for (int tick = 0; tick < ticks; tick++) {
            chain.advance(10);
            tracker.tick();
            for (int step = 0; step < workerStepsPerTick; step++) {
                workers.get(step % workers.size()).processNext();
            }
            maxDepth = Math.max(maxDepth, queue.size());
        }
        return maxDepth;
    }

    @Test
    @DisplayName("createWorkers builds the configured number of workers with distinct ids")
    void createWorkers() {
        List<FillWorker> workers = pool().createWorkers();

        assertThat(workers).hasSize(5);
        assertThat(workers).extracting(FillWorker::getWorkerId).containsExactly(0, 1, 2, 3, 4);
    }

    @Test
    @DisplayName("slots that never confirm age out: queue depth stays bounded by the monitoring window")
    void neverConfirmingSlots_queueBounded() {
        int maxDepth = simulate(1_000, 5);

        assertThat(maxDepth).isPositive();
        assertThat(maxDepth).isLessThanOrEqualTo(100);
        assertThat(cache.len()).isPositive();
    }

    @Test
    @DisplayName("intermittent RPC failures do not make the queue grow without bound")
    void intermittentFailures_queueBounded() {
        chain.failureRate = 0.3;

        int maxDepth = simulate(1_000, 5);

        assertThat(maxDepth).isLessThanOrEqualTo(150);
    }

    @Test
    @DisplayName("total RPC outage: every failed interval is kept, so depth grows by exactly one per tick")
    void totalOutage_growsLinearlyWithoutAmplification() {
        SlotTracker tracker = new SlotTracker(chain, queue, watermark, new NoOpSlotMetrics(), properties);
        List<FillWorker> workers = pool().createWorkers();
        chain.blocksDown = true;

        for (int tick = 1; tick <= 200; tick++) {
            chain.advance(10);
            tracker.tick();
            workers.forEach(FillWorker::processNext);
            assertThat(queue.size()).isEqualTo(tick);
        }
        assertThat(cache.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("started pool drains queued work on its own threads and stops on request")
    void start_drainsQueueAndStops() throws Exception {
        chain.skipEvery = 0;
        watermark.advanceTo(100);
        queue.push(new SlotInterval(1, 50));
        ExecutorService executor = Executors.newFixedThreadPool(5);
        FillWorkerPool pool = pool();
        try {
            CompletableFuture<Void> done = pool.start(executor);

            long deadline = System.currentTimeMillis() + 5_000;
            while (cache.len() < 50 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertThat(cache.len()).isEqualTo(50);
            assertThat(done).isNotDone();

            pool.stop();
            done.get(5, TimeUnit.SECONDS);
            assertThat(done).isCompleted();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("a pool cannot be started twice")
    void start_twice_rejected() {
        ExecutorService executor = Executors.newFixedThreadPool(5);
        FillWorkerPool pool = pool();
        try {
            pool.start(executor);
            assertThatThrownBy(() -> pool.start(executor)).isInstanceOf(IllegalStateException.class);
        } finally {
            pool.stop();
            executor.shutdownNow();
        }
    }

    /**
     * Chain where every {@code skipEvery}-th slot never gets a block; optional injected failures.
     */
    private static final class FakeChain implements ChainRpcClient {

        private final Random random = new Random(42);
        private volatile long head;
        int skipEvery = 3;
        double failureRate;
        boolean blocksDown;

        FakeChain(long head) {
            this.head = head;
        }

        void advance(long slots) {
            head += slots;
        }

        @Override
        public long getLatestSlot() {
            return head;
        }

        @Override
        public synchronized List<Long> getBlocks(long startSlot, long endSlot) {
            if (blocksDown || random.nextDouble() < failureRate) {
                throw new RpcException("injected failure");
            }
            List<Long> confirmed = new ArrayList<>();
            for (long slot = startSlot; slot <= Math.min(endSlot, head); slot++) {
                if (skipEvery == 0 || slot % skipEvery != 0) {
                    confirmed.add(slot);
                }
            }
            return confirmed;
        }
    }
}
