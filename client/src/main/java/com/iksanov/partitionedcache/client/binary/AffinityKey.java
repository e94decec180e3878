package com.iksanov.partitionedcache.client.binary;

import java.util.Objects;

/**
 * Key whose partition is decided by a separate affinity value, so related keys
 * (for example all orders of one customer) land on the same node.
 */
public final class AffinityKey<K, A> implements WritableKey {

    private final K key;
    private final A affinity;

    public AffinityKey(K key, A affinity) {
        this.key = Objects.requireNonNull(key, "key");
        this.affinity = Objects.requireNonNull(affinity, "affinity");
    }

    public K key() {
        return key;
    }

    public A affinity() {
        return affinity;
    }

    @Override
    public void write(BinaryWriter writer) {
        writer.writeObject(key);
    }

    @Override
    public Writable affinityKey() {
        return new WritableImpl<>(affinity);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AffinityKey<?, ?> that)) return false;
        return key.equals(that.key) && affinity.equals(that.affinity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, affinity);
    }

    @Override
    public String toString() {
        return "AffinityKey[key=" + key + ", affinity=" + affinity + "]";
    }
}
