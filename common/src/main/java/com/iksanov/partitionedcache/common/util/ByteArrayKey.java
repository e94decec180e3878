package com.iksanov.partitionedcache.common.util;

import java.util.Arrays;

/**
 * Map key over encoded bytes, compared by content. The array is copied on construction.
 */
public final class ByteArrayKey {

    private final byte[] bytes;
    private final int hash;

    public ByteArrayKey(byte[] bytes) {
        if (bytes == null) throw new IllegalArgumentException("bytes is null");
        this.bytes = bytes.clone();
        this.hash = Arrays.hashCode(this.bytes);
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    public int length() {
        return bytes.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ByteArrayKey that)) return false;
        return hash == that.hash && Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "ByteArrayKey[length=" + bytes.length + "]";
    }
}
