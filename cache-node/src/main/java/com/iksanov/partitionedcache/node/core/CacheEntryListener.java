package com.iksanov.partitionedcache.node.core;

/**
 * Observer of entry updates made through put, remove and removeAll.
 * Clear operations bypass listeners.
 */
public interface CacheEntryListener {

    void onPut(int cacheId, byte[] key, byte[] value);

    void onRemove(int cacheId, byte[] key);
}
