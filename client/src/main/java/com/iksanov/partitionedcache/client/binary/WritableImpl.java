package com.iksanov.partitionedcache.client.binary;

/**
 * Wraps any value the codec supports.
 */
public class WritableImpl<V> implements Writable {

    private final V value;

    public WritableImpl(V value) {
        this.value = value;
    }

    public V value() {
        return value;
    }

    @Override
    public void write(BinaryWriter writer) {
        writer.writeObject(value);
    }
}
