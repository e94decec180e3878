package com.iksanov.partitionedcache.node.core;

import com.iksanov.partitionedcache.common.util.ByteArrayKey;

import java.util.concurrent.atomic.AtomicInteger;

public class CacheEntry {
    final ByteArrayKey key;
    final byte[] value;
    final long expireAt;
    final AtomicInteger accessCount;
    volatile long lastAccessTime;

    CacheEntry(ByteArrayKey key, byte[] value, long expireAt) {
        this.key = key;
        this.value = value;
        this.expireAt = expireAt;
        this.accessCount = new AtomicInteger(0);
        this.lastAccessTime = System.currentTimeMillis();
    }

    boolean isExpired() {
        return expireAt > 0 && System.currentTimeMillis() >= expireAt;
    }

    void recordAccess() {
        accessCount.incrementAndGet();
        lastAccessTime = System.currentTimeMillis();
    }

    // higher is a better eviction victim: idle for long, rarely read
    int evictionScore() {
        long idleSeconds = (System.currentTimeMillis() - lastAccessTime) / 1000;
        return (int) (idleSeconds * 2) - accessCount.get();
    }
}
