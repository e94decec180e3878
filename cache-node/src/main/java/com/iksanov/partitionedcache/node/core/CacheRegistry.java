package com.iksanov.partitionedcache.node.core;

import com.iksanov.partitionedcache.common.util.CacheIds;
import com.iksanov.partitionedcache.node.metrics.CacheMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Stores of this node by cache id, plus the entry listeners shared by all of them.
 * With auto-create on, the first request for an unknown id creates its store.
 */
public class CacheRegistry {

    private static final Logger log = LoggerFactory.getLogger(CacheRegistry.class);
    private final ConcurrentMap<Integer, CacheStore> caches = new ConcurrentHashMap<>();
    private final List<CacheEntryListener> listeners = new CopyOnWriteArrayList<>();
    private final boolean autoCreate;
    private final int maxEntriesPerCache;
    private final long ttlMillis;
    private final CacheMetrics metrics;

    public CacheRegistry(boolean autoCreate, int maxEntriesPerCache, long ttlMillis, CacheMetrics metrics) {
        this.autoCreate = autoCreate;
        this.maxEntriesPerCache = maxEntriesPerCache;
        this.ttlMillis = ttlMillis;
        this.metrics = metrics;
    }

    public CacheStore createCache(String name) {
        int cacheId = CacheIds.cacheId(name);
        return caches.computeIfAbsent(cacheId, id -> {
            log.info("Created cache '{}' (id={})", name, id);
            return new InMemoryCacheStore(name, maxEntriesPerCache, ttlMillis, metrics);
        });
    }

    /**
     * @return the store, or {@code null} if the cache does not exist and auto-create is off
     */
    public CacheStore get(int cacheId) {
        CacheStore store = caches.get(cacheId);
        if (store != null || !autoCreate) return store;
        return caches.computeIfAbsent(cacheId, id -> {
            log.info("Auto-created cache with id={}", id);
            return new InMemoryCacheStore("cache-" + id, maxEntriesPerCache, ttlMillis, metrics);
        });
    }

    public void addListener(CacheEntryListener listener) {
        listeners.add(listener);
    }

    public void removeListener(CacheEntryListener listener) {
        listeners.remove(listener);
    }

    public void notifyPut(int cacheId, byte[] key, byte[] value) {
        for (CacheEntryListener listener : listeners) {
            try {
                listener.onPut(cacheId, key, value);
            } catch (RuntimeException e) {
                throw new StoreFailureException("Entry listener failed on put: " + e.getMessage(), e);
            }
        }
    }

    public void notifyRemove(int cacheId, byte[] key) {
        for (CacheEntryListener listener : listeners) {
            try {
                listener.onRemove(cacheId, key);
            } catch (RuntimeException e) {
                throw new StoreFailureException("Entry listener failed on remove: " + e.getMessage(), e);
            }
        }
    }

    public int cacheCount() {
        return caches.size();
    }

    public void clearAll() {
        caches.values().forEach(CacheStore::clear);
    }
}
