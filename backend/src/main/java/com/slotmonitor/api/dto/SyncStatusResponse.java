package com.slotmonitor.api.dto;

/**
 * Snapshot of the sync engine's shared state for GET /admin/sync/status.
 */
public record SyncStatusResponse(long lastTrackedSlot, int queueDepth, long cacheSize, long cacheCapacity) {
}
