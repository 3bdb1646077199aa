package com.slotmonitor.cache;

import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded set of confirmed slot numbers with least-recently-used eviction.
 * Both {@link #insert(long)} and {@link #contains(long)} count as a touch, so slots that are queried often survive
 * longer. Eviction happens inside the insert that overflows, under the same lock, so {@link #len()} never exceeds
 * {@link #capacity()}.
 */
@Slf4j
public class BlockCache {

    private final long capacity;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<Long, Boolean> slots;

    public BlockCache(long capacity) {
        if (capacity <= 0 || capacity > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("capacity must be within [1, " + Integer.MAX_VALUE + "]");
        }
        this.capacity = capacity;
        this.slots = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Long, Boolean> eldest) {
                return size() > BlockCache.this.capacity;
            }
        };
        log.info("Created block cache with capacity {}", capacity);
    }

    public boolean contains(long slot) {
        boolean exists;
        lock.lock();
        try {
            exists = slots.get(slot) != null;
        } finally {
            lock.unlock();
        }
        log.trace("Checked slot {} in cache: {}", slot, exists);
        return exists;
    }

    /**
     * Adds the slot, evicting the least recently touched one when full. Returns false only if the slot could not be
     * stored; callers treat that as "not cached yet" and rely on a later re-check.
     */
    public boolean insert(long slot) {
        lock.lock();
        try {
            slots.put(slot, Boolean.TRUE);
        } catch (RuntimeException e) {
            log.warn("Failed to insert slot {} into cache: {}", slot, e.getMessage());
            return false;
        } finally {
            lock.unlock();
        }
        log.trace("Inserted slot {} into cache", slot);
        return true;
    }

    public long len() {
        lock.lock();
        try {
            return slots.size();
        } finally {
            lock.unlock();
        }
    }

    public long capacity() {
        return capacity;
    }

    public boolean isEmpty() {
        return len() == 0;
    }

    public void clear() {
        lock.lock();
        try {
            slots.clear();
        } finally {
            lock.unlock();
        }
        log.info("Cleared block cache");
    }
}
