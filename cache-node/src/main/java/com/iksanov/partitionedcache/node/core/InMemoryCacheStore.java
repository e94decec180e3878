package com.iksanov.partitionedcache.node.core;

import com.iksanov.partitionedcache.common.exception.CacheException;
import com.iksanov.partitionedcache.common.util.ByteArrayKey;
import com.iksanov.partitionedcache.node.metrics.CacheMetrics;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe store with approximate LRU eviction and optional TTL.
 * Eviction samples a handful of entries and drops the stalest one, similar to Redis.
 */
public class InMemoryCacheStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCacheStore.class);
    private static final int SAMPLE_SIZE = 8;
    private static final int EVICTION_BATCH = 5;
    private static final int LAZY_CLEANUP_INTERVAL = 100;
    private final ConcurrentMap<ByteArrayKey, CacheEntry> store = new ConcurrentHashMap<>();
    private final String name;
    private final int maxSize;
    private final long defaultTtlMillis;
    private final ReentrantLock evictionLock = new ReentrantLock();
    private final CacheMetrics metrics;
    private final AtomicInteger putCounter = new AtomicInteger();

    public InMemoryCacheStore(String name, int maxSize, long defaultTtlMillis) {
        this(name, maxSize, defaultTtlMillis, new CacheMetrics());
    }

    public InMemoryCacheStore(String name, int maxSize, long defaultTtlMillis, CacheMetrics metrics) {
        if (maxSize <= 0) throw new CacheException("maxSize must be > 0");
        if (defaultTtlMillis < 0) throw new CacheException("defaultTtlMillis must be >= 0");
        this.name = name;
        this.maxSize = maxSize;
        this.defaultTtlMillis = defaultTtlMillis;
        this.metrics = metrics;
        log.info("Cache store '{}' initialized: maxSize={}, defaultTTL={}ms, eviction=ApproximateLRU", name, maxSize, defaultTtlMillis);
    }

    @Override
    public byte[] get(byte[] key) {
        ByteArrayKey k = toKey(key);
        Timer.Sample sample = metrics.startGetTimer();
        try {
            CacheEntry entry = liveEntry(k);
            if (entry == null) {
                metrics.recordMiss();
                return null;
            }
            entry.recordAccess();
            metrics.recordHit();
            return entry.value;
        } finally {
            metrics.stopGetTimer(sample);
        }
    }

    @Override
    public void put(byte[] key, byte[] value) {
        ByteArrayKey k = toKey(key);
        Objects.requireNonNull(value, "value");
        Timer.Sample sample = metrics.startPutTimer();
        try {
            long expireAt = defaultTtlMillis > 0 ? System.currentTimeMillis() + defaultTtlMillis : -1;
            CacheEntry previous = store.put(k, new CacheEntry(k, value, expireAt));
            if (previous == null) {
                metrics.adjustSize(1);
                evictIfNeeded();
            }
            if (putCounter.incrementAndGet() % LAZY_CLEANUP_INTERVAL == 0) lazyCleanupExpired();
        } finally {
            metrics.stopPutTimer(sample);
        }
    }

    @Override
    public boolean containsKey(byte[] key) {
        return liveEntry(toKey(key)) != null;
    }

    @Override
    public boolean remove(byte[] key) {
        CacheEntry removed = store.remove(toKey(key));
        if (removed == null) return false;
        metrics.adjustSize(-1);
        return !removed.isExpired();
    }

    @Override
    public List<byte[]> removeAll() {
        List<byte[]> removed = new ArrayList<>();
        for (Map.Entry<ByteArrayKey, CacheEntry> e : store.entrySet()) {
            CacheEntry entry = e.getValue();
            if (store.remove(e.getKey(), entry)) {
                metrics.adjustSize(-1);
                if (!entry.isExpired()) removed.add(e.getKey().bytes());
            }
        }
        log.debug("Cache '{}': removeAll removed {} entries", name, removed.size());
        return removed;
    }

    @Override
    public void clear() {
        int before = store.size();
        store.clear();
        metrics.adjustSize(-before);
        log.info("Cache '{}' cleared ({} entries)", name, before);
    }

    /**
     * Live entry count. Expired entries found on the way are removed, so they are never counted.
     */
    @Override
    public int size() {
        if (defaultTtlMillis == 0) return store.size();
        int live = 0;
        for (Map.Entry<ByteArrayKey, CacheEntry> e : store.entrySet()) {
            CacheEntry entry = e.getValue();
            if (!entry.isExpired()) {
                live++;
            } else if (store.remove(e.getKey(), entry)) {
                metrics.adjustSize(-1);
            }
        }
        return live;
    }

    public String getName() {
        return name;
    }

    private CacheEntry liveEntry(ByteArrayKey key) {
        CacheEntry entry = store.get(key);
        if (entry == null) return null;
        if (entry.isExpired()) {
            if (store.remove(key, entry)) metrics.adjustSize(-1);
            return null;
        }
        return entry;
    }

    private void evictIfNeeded() {
        if (store.size() > maxSize && evictionLock.tryLock()) {
            try {
                if (store.size() > maxSize) evictEntries(Math.max(1, store.size() - maxSize + EVICTION_BATCH));
            } finally {
                evictionLock.unlock();
            }
        }

        // hard limit: writers wait for eviction once the soft limit is overrun by 20%
        if (store.size() > (maxSize * 12 / 10)) {
            evictionLock.lock();
            try {
                if (store.size() > maxSize) {
                    log.warn("Hard limit triggered for '{}': currentSize={}, maxSize={}, evicting aggressively", name, store.size(), maxSize);
                    int evicted = evictEntries(Math.max(EVICTION_BATCH * 2, store.size() - maxSize + EVICTION_BATCH));
                    log.info("Aggressive eviction completed: removed {} entries, size now {}/{}", evicted, store.size(), maxSize);
                }
            } finally {
                evictionLock.unlock();
            }
        }
    }

    private int evictEntries(int toEvict) {
        int evicted = 0;
        for (int i = 0; i < toEvict && store.size() > maxSize; i++) {
            CacheEntry victim = findEvictionCandidate();
            if (victim != null && store.remove(victim.key, victim)) {
                metrics.recordEviction();
                metrics.adjustSize(-1);
                evicted++;
            }
        }
        return evicted;
    }

    private CacheEntry findEvictionCandidate() {
        Iterator<CacheEntry> iterator = store.values().iterator();
        List<CacheEntry> sample = new ArrayList<>(SAMPLE_SIZE);
        int checked = 0;
        while (iterator.hasNext() && checked < SAMPLE_SIZE * 2) {
            CacheEntry entry = iterator.next();
            checked++;
            if (entry.isExpired()) return entry;
            if (sample.size() < SAMPLE_SIZE) sample.add(entry);
        }
        if (sample.isEmpty()) return null;

        CacheEntry victim = sample.get(0);
        int maxScore = victim.evictionScore();
        for (int i = 1; i < sample.size(); i++) {
            CacheEntry candidate = sample.get(i);
            int score = candidate.evictionScore();
            if (score > maxScore) {
                maxScore = score;
                victim = candidate;
            }
        }
        return victim;
    }

    private void lazyCleanupExpired() {
        int cleaned = 0;
        int maxChecks = Math.min(20, store.size() / 10);
        Iterator<Map.Entry<ByteArrayKey, CacheEntry>> iterator = store.entrySet().iterator();
        for (int i = 0; i < maxChecks && iterator.hasNext(); i++) {
            Map.Entry<ByteArrayKey, CacheEntry> entry = iterator.next();
            CacheEntry cacheEntry = entry.getValue();
            if (cacheEntry != null && cacheEntry.isExpired() && store.remove(entry.getKey(), cacheEntry)) {
                metrics.adjustSize(-1);
                cleaned++;
            }
        }
        if (cleaned > 0) log.debug("Lazy cleanup removed {} expired entries from '{}'", cleaned, name);
    }

    private static ByteArrayKey toKey(byte[] key) {
        if (key == null) throw new CacheException("Key must not be null");
        return new ByteArrayKey(key);
    }
}
