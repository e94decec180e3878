package com.iksanov.partitionedcache.client;

import com.iksanov.partitionedcache.client.binary.BinaryObject;
import com.iksanov.partitionedcache.client.binary.ReadableValue;
import com.iksanov.partitionedcache.client.binary.WritableImpl;
import com.iksanov.partitionedcache.client.binary.WritableKey;
import com.iksanov.partitionedcache.client.binary.WritableKeyImpl;
import com.iksanov.partitionedcache.common.exception.InvalidCacheRequestException;
import com.iksanov.partitionedcache.common.protocol.CachePeekMode;

/**
 * Typed view of a named cache.
 * <p>
 * Keys and values may be any type the value codec supports. A key that is itself a
 * {@link WritableKey} (for example an {@link com.iksanov.partitionedcache.client.binary.AffinityKey})
 * is used as is, so its affinity decides the partition. Values read back must be instances of
 * the handle's value type; a stored value of another type raises
 * {@link com.iksanov.partitionedcache.common.exception.SerializationException}.
 */
public class CacheClient<K, V> implements AutoCloseable {

    private final CacheClientImpl impl;
    private final Class<V> valueType;

    CacheClient(CacheClientImpl impl, Class<V> valueType) {
        this.impl = impl;
        this.valueType = valueType;
    }

    public String getName() {
        return impl.getName();
    }

    public Class<V> getValueType() {
        return valueType;
    }

    public void put(K key, V value) {
        if (value == null) throw new InvalidCacheRequestException("Value cannot be null");
        impl.put(toKey(key), new WritableImpl<>(value));
    }

    /**
     * @return the value, or {@code null} if there is none
     */
    public V get(K key) {
        ReadableValue<V> out = new ReadableValue<>(valueType);
        return impl.get(toKey(key), out) ? out.get() : null;
    }

    public boolean containsKey(K key) {
        return impl.containsKey(toKey(key));
    }

    public long getSize(CachePeekMode... peekModes) {
        return impl.getSize(CachePeekMode.toMask(peekModes));
    }

    public boolean remove(K key) {
        return impl.remove(toKey(key));
    }

    public void removeAll() {
        impl.removeAll();
    }

    public void clear(K key) {
        impl.clear(toKey(key));
    }

    public void clear() {
        impl.clear();
    }

    /**
     * @return the near-cached value, or {@code null}
     */
    public V localPeek(K key) {
        ReadableValue<V> out = new ReadableValue<>(valueType);
        return impl.localPeek(toKey(key), out) ? out.get() : null;
    }

    public void refreshAffinityMapping() {
        impl.refreshAffinityMapping();
    }

    /**
     * @return a view that returns values as {@link com.iksanov.partitionedcache.client.binary.BinaryObject}s;
     *         close it separately
     */
    public CacheClient<K, BinaryObject> withKeepBinary() {
        return new CacheClient<>(impl.withKeepBinary(), BinaryObject.class);
    }

    public CacheClientImpl unwrap() {
        return impl;
    }

    @Override
    public void close() {
        impl.close();
    }

    private WritableKey toKey(K key) {
        if (key == null) throw new InvalidCacheRequestException("Key cannot be null");
        if (key instanceof WritableKey writableKey) return writableKey;
        return new WritableKeyImpl<>(key);
    }
}
