package com.iksanov.partitionedcache.client;

import com.iksanov.partitionedcache.client.binary.BinaryReader;
import com.iksanov.partitionedcache.client.binary.BinaryWriter;
import com.iksanov.partitionedcache.client.binary.BinaryReadable;
import com.iksanov.partitionedcache.client.binary.Writable;
import com.iksanov.partitionedcache.client.binary.WritableKey;
import com.iksanov.partitionedcache.client.dispatch.SyncDispatcher;
import com.iksanov.partitionedcache.client.metrics.ClientMetrics;
import com.iksanov.partitionedcache.client.near.NearCache;
import com.iksanov.partitionedcache.client.router.SharedRouter;
import com.iksanov.partitionedcache.common.cluster.NodeInfo;
import com.iksanov.partitionedcache.common.cluster.PartitionTable;
import com.iksanov.partitionedcache.common.codec.ResponsePayloads;
import com.iksanov.partitionedcache.common.exception.InvalidCacheRequestException;
import com.iksanov.partitionedcache.common.protocol.*;
import com.iksanov.partitionedcache.common.util.CacheIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Operations on one named cache, expressed over encoded keys and values.
 * <p>
 * Key-routed operations go to the primary owner of the key's partition. {@link #getSize(int)},
 * {@link #removeAll()} and {@link #clear()} go to every node of the cache. The handle is
 * immutable and may be shared between threads.
 */
public final class CacheClientImpl implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CacheClientImpl.class);
    private final String name;
    private final int cacheId;
    private final boolean binary;
    private final SharedRouter router;
    private final SyncDispatcher dispatcher;
    private final NearCache nearCache;
    private final ClientMetrics metrics;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Takes ownership of one reference of {@code router}; {@link #close()} releases it.
     */
    public CacheClientImpl(String name, boolean binary, SharedRouter router, SyncDispatcher dispatcher,
                           NearCache nearCache, ClientMetrics metrics) {
        this.name = name;
        this.cacheId = CacheIds.cacheId(name);
        this.binary = binary;
        this.router = router;
        this.dispatcher = dispatcher;
        this.nearCache = nearCache;
        this.metrics = metrics;
    }

    public String getName() {
        return name;
    }

    public int getCacheId() {
        return cacheId;
    }

    public boolean isBinary() {
        return binary;
    }

    /**
     * @return a handle over the same cache that reads values as
     *         {@link com.iksanov.partitionedcache.client.binary.BinaryObject}s; it holds its own
     *         router reference and must be closed separately
     */
    public CacheClientImpl withKeepBinary() {
        return new CacheClientImpl(name, true, router.retain(), dispatcher, nearCache, metrics);
    }

    public void put(WritableKey key, Writable value) {
        requireKey(key);
        if (value == null) throw new InvalidCacheRequestException("Value cannot be null");
        byte[] keyBytes = BinaryWriter.encode(key);
        byte[] valueBytes = BinaryWriter.encode(value);
        long stamp = nearCache.stamp();
        try {
            dispatcher.dispatch(affinityBytes(key, keyBytes), new PutRequest(cacheId, flags(), keyBytes, valueBytes), ResponsePayloads.EMPTY);
        } catch (RuntimeException e) {
            nearCache.invalidate(keyBytes);
            throw e;
        }
        nearCache.fill(keyBytes, valueBytes, stamp);
    }

    /**
     * Reads the value of {@code key} into {@code out}.
     *
     * @return {@code false} on a miss, in which case {@code out} is not touched
     */
    public boolean get(WritableKey key, BinaryReadable out) {
        requireKey(key);
        byte[] keyBytes = BinaryWriter.encode(key);
        long stamp = nearCache.stamp();
        byte[] value = dispatcher.dispatch(affinityBytes(key, keyBytes), keyRequest(ClientOperation.CACHE_GET, keyBytes), ResponsePayloads.VALUE);
        if (value == null) {
            nearCache.invalidate(keyBytes);
            return false;
        }
        readInto(value, out);
        nearCache.fill(keyBytes, value, stamp);
        return true;
    }

    public boolean containsKey(WritableKey key) {
        requireKey(key);
        byte[] keyBytes = BinaryWriter.encode(key);
        return dispatcher.dispatch(affinityBytes(key, keyBytes), keyRequest(ClientOperation.CACHE_CONTAINS_KEY, keyBytes), ResponsePayloads.BOOL);
    }

    /**
     * @param peekModes mask built with {@link CachePeekMode#toMask(CachePeekMode...)}; 0 counts all tiers
     * @return sum of the entry counts reported by every node of the cache
     */
    public long getSize(int peekModes) {
        long total = 0;
        for (Long count : dispatcher.broadcast(new SizeRequest(cacheId, flags(), peekModes), ResponsePayloads.COUNT)) {
            total += count;
        }
        return total;
    }

    /**
     * @return {@code false} if there was no mapping for the key
     */
    public boolean remove(WritableKey key) {
        requireKey(key);
        byte[] keyBytes = BinaryWriter.encode(key);
        try {
            return dispatcher.dispatch(affinityBytes(key, keyBytes), keyRequest(ClientOperation.CACHE_REMOVE_KEY, keyBytes), ResponsePayloads.BOOL);
        } finally {
            nearCache.invalidate(keyBytes);
        }
    }

    /**
     * Removes every entry. Entry listeners on the nodes are notified.
     */
    public void removeAll() {
        try {
            dispatcher.broadcast(new CacheWideRequest(ClientOperation.CACHE_REMOVE_ALL, cacheId, flags()), ResponsePayloads.EMPTY);
        } finally {
            nearCache.invalidateAll();
        }
    }

    /**
     * Drops the entry from memory without notifying entry listeners.
     */
    public void clear(WritableKey key) {
        requireKey(key);
        byte[] keyBytes = BinaryWriter.encode(key);
        try {
            dispatcher.dispatch(affinityBytes(key, keyBytes), keyRequest(ClientOperation.CACHE_CLEAR_KEY, keyBytes), ResponsePayloads.EMPTY);
        } finally {
            nearCache.invalidate(keyBytes);
        }
    }

    /**
     * Drops every entry from memory without notifying entry listeners.
     */
    public void clear() {
        try {
            dispatcher.broadcast(new CacheWideRequest(ClientOperation.CACHE_CLEAR, cacheId, flags()), ResponsePayloads.EMPTY);
        } finally {
            nearCache.invalidateAll();
        }
    }

    /**
     * Looks the key up in the in-process near cache only. Never touches the network.
     *
     * @return {@code false} if the near cache holds nothing for the key
     */
    public boolean localPeek(WritableKey key, BinaryReadable out) {
        requireKey(key);
        byte[] value = nearCache.get(BinaryWriter.encode(key));
        if (value == null) {
            metrics.recordNearCacheMiss();
            return false;
        }
        metrics.recordNearCacheHit();
        readInto(value, out);
        return true;
    }

    /**
     * Fetches the partition table from a node and installs it for this cache.
     * Requests in flight keep the table they were routed with.
     */
    public void refreshAffinityMapping() {
        PartitionTable table = dispatcher.dispatchAny(
                new CacheWideRequest(ClientOperation.CACHE_PARTITIONS, cacheId, flags()), ResponsePayloads.PARTITIONS);
        router.router().installPartitionTable(cacheId, table);
        log.debug("Affinity mapping for cache '{}' refreshed: {}", name, table);
    }

    /**
     * @return the partition table key-routed calls of this cache are currently routed with
     */
    public PartitionTable affinityMapping() {
        return router.router().partitionTable(cacheId);
    }

    /**
     * @return the node a key-routed call for {@code key} would be sent to right now
     */
    public NodeInfo primaryNode(WritableKey key) {
        requireKey(key);
        byte[] keyBytes = BinaryWriter.encode(key);
        return router.router().resolveNode(cacheId, affinityBytes(key, keyBytes)).node();
    }

    /**
     * Releases this handle's router reference. No network I/O.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            router.release();
        }
    }

    private KeyRequest keyRequest(ClientOperation operation, byte[] keyBytes) {
        return new KeyRequest(operation, cacheId, flags(), keyBytes);
    }

    private byte flags() {
        return CacheRequest.flags(binary);
    }

    private void readInto(byte[] value, BinaryReadable out) {
        BinaryReader reader = new BinaryReader(value, binary);
        out.read(reader);
        reader.requireFullyRead();
    }

    private static byte[] affinityBytes(WritableKey key, byte[] keyBytes) {
        Writable affinity = key.affinityKey();
        return affinity == null ? keyBytes : BinaryWriter.encode(affinity);
    }

    private static void requireKey(WritableKey key) {
        if (key == null) throw new InvalidCacheRequestException("Key cannot be null");
    }
}
