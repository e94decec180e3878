package com.iksanov.partitionedcache.client.binary;

import java.util.Arrays;

/**
 * A value kept in its encoded form, type tag included.
 * Returned by readers in binary mode and written verbatim by {@link BinaryWriter}.
 */
public final class BinaryObject {

    private final byte[] bytes;

    public BinaryObject(byte[] bytes) {
        if (bytes == null || bytes.length == 0) throw new IllegalArgumentException("binary object cannot be empty");
        this.bytes = bytes.clone();
    }

    public byte typeTag() {
        return bytes[0];
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    int length() {
        return bytes.length;
    }

    byte[] unsafeBytes() {
        return bytes;
    }

    /**
     * Decodes the wrapped bytes into a plain Java value.
     */
    public Object deserialize() {
        BinaryReader reader = new BinaryReader(bytes, false);
        Object value = reader.readObject();
        reader.requireFullyRead();
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BinaryObject that)) return false;
        return Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "BinaryObject[type=" + typeTag() + ", length=" + bytes.length + "]";
    }
}
