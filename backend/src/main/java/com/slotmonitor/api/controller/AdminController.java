package com.slotmonitor.api.controller;

import com.slotmonitor.api.dto.SyncStatusResponse;
import com.slotmonitor.cache.BlockCache;
import com.slotmonitor.sync.IntervalQueue;
import com.slotmonitor.sync.SlotWatermark;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator endpoints: sync status (watermark, queue depth, cache fill) and cache reset.
 */
@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
public class AdminController {

    private final BlockCache blockCache;
    private final IntervalQueue intervalQueue;
    private final SlotWatermark slotWatermark;

    @GetMapping("/sync/status")
    public SyncStatusResponse status() {
        return new SyncStatusResponse(
                slotWatermark.lastTrackedSlot(),
                intervalQueue.size(),
                blockCache.len(),
                blockCache.capacity());
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Void> clearCache() {
        blockCache.clear();
        return ResponseEntity.noContent().build();
    }
}
