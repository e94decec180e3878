package com.iksanov.partitionedcache.client.binary;

import com.iksanov.partitionedcache.common.exception.SerializationException;

import java.util.Objects;

/**
 * Holder a read decodes into. {@link #isPresent()} tells a miss apart from a stored
 * value that happens to be zero, empty or false.
 * <p>
 * The decoded value must be an instance of the holder's type; anything else is a
 * {@link SerializationException}, never a {@link ClassCastException} at the caller.
 */
public class ReadableValue<V> implements BinaryReadable {

    private final Class<V> type;
    private V value;
    private boolean present;

    public ReadableValue(Class<V> type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    @Override
    public void read(BinaryReader reader) {
        Object decoded = reader.readObject();
        if (decoded != null && !type.isInstance(decoded)) {
            throw new SerializationException("Stored value is " + decoded.getClass().getName() + ", expected " + type.getName());
        }
        value = type.cast(decoded);
        present = true;
    }

    public boolean isPresent() {
        return present;
    }

    public V get() {
        return value;
    }

    public Class<V> type() {
        return type;
    }
}
