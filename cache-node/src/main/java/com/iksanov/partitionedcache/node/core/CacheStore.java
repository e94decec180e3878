package com.iksanov.partitionedcache.node.core;

import java.util.List;

/**
 * Entries of one cache held by this node. Keys and values are opaque encoded bytes.
 */
public interface CacheStore {

    /**
     * @return the value, or {@code null} if there is none or it has expired
     */
    byte[] get(byte[] key);

    void put(byte[] key, byte[] value);

    boolean containsKey(byte[] key);

    /**
     * @return {@code true} if a live mapping was removed
     */
    boolean remove(byte[] key);

    /**
     * Removes every entry one by one.
     *
     * @return the keys that were removed
     */
    List<byte[]> removeAll();

    /**
     * Drops every entry at once.
     */
    void clear();

    int size();
}
