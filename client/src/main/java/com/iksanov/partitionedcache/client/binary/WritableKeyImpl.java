package com.iksanov.partitionedcache.client.binary;

/**
 * Key routed by its own encoded bytes.
 */
public class WritableKeyImpl<K> extends WritableImpl<K> implements WritableKey {

    public WritableKeyImpl(K key) {
        super(key);
    }
}
