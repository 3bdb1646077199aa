package com.slotmonitor.confirmation;

import com.slotmonitor.cache.BlockCache;
import com.slotmonitor.metrics.SlotMetrics;
import com.slotmonitor.rpc.ChainRpcClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Answers "is this slot confirmed?" from the block cache, falling back to a single-slot getBlocks call on a miss.
 * A confirmed miss is written back to the cache. Never touches the interval queue.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SlotConfirmationService {

    private final BlockCache blockCache;
    private final ChainRpcClient chainRpcClient;
    private final SlotMetrics slotMetrics;

    /**
     * @throws com.slotmonitor.rpc.RpcException if the cache missed and the RPC check failed
     */
    public boolean isSlotConfirmed(long slot) {
        if (slot < 0) {
            throw new IllegalArgumentException("slot must be non-negative");
        }
        if (blockCache.contains(slot)) {
            slotMetrics.recordCacheHit(true);
            return true;
        }
        slotMetrics.recordCacheHit(false);

        long started = System.nanoTime();
        List<Long> confirmed;
        try {
            confirmed = chainRpcClient.getBlocks(slot, slot);
        } finally {
            slotMetrics.recordGetBlocksElapsed(Duration.ofNanos(System.nanoTime() - started));
        }
        if (!confirmed.contains(slot)) {
            log.debug("Slot {} not confirmed", slot);
            return false;
        }
        if (!blockCache.insert(slot)) {
            log.debug("Slot {} confirmed but not cached", slot);
        }
        return true;
    }
}
