package com.iksanov.partitionedcache.client.near;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.iksanov.partitionedcache.common.util.ByteArrayKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process tier holding encoded values by encoded key. A disabled near cache
 * stores nothing and answers every lookup with a miss.
 * <p>
 * The tier is best-effort. Writes made by other clients are never seen here. Fills are stamped:
 * a value read or written before an invalidation of this tier is dropped instead of stored, so a
 * concurrent remove or clear always wins over an in-flight get or put. Two concurrent puts of the
 * same key from this client may still leave either value behind.
 */
public class NearCache {

    private static final Logger log = LoggerFactory.getLogger(NearCache.class);
    private static final NearCache DISABLED = new NearCache();

    private final Cache<ByteArrayKey, byte[]> cache;
    private final AtomicLong invalidations = new AtomicLong();

    private NearCache() {
        this.cache = null;
    }

    public NearCache(String cacheName, long maximumSize) {
        if (maximumSize <= 0) throw new IllegalArgumentException("maximumSize must be > 0");
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .build();
        log.info("Near cache for '{}' enabled: maximumSize={}", cacheName, maximumSize);
    }

    public static NearCache disabled() {
        return DISABLED;
    }

    public boolean isEnabled() {
        return cache != null;
    }

    public byte[] get(byte[] key) {
        if (cache == null) return null;
        return cache.getIfPresent(new ByteArrayKey(key));
    }

    public void put(byte[] key, byte[] value) {
        if (cache == null) return;
        cache.put(new ByteArrayKey(key), value.clone());
    }

    /**
     * @return the current invalidation stamp; take it before sending the request whose result is filled
     */
    public long stamp() {
        return invalidations.get();
    }

    /**
     * Stores {@code value} unless the tier was invalidated after {@code stamp} was taken.
     */
    public void fill(byte[] key, byte[] value, long stamp) {
        if (cache == null || invalidations.get() != stamp) return;
        ByteArrayKey k = new ByteArrayKey(key);
        cache.put(k, value.clone());
        // an invalidation may have landed between the check and the put
        if (invalidations.get() != stamp) cache.invalidate(k);
    }

    public void invalidate(byte[] key) {
        if (cache == null) return;
        invalidations.incrementAndGet();
        cache.invalidate(new ByteArrayKey(key));
    }

    public void invalidateAll() {
        if (cache == null) return;
        invalidations.incrementAndGet();
        cache.invalidateAll();
    }

    public long size() {
        if (cache == null) return 0;
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
