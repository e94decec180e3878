package com.iksanov.partitionedcache.common.util;

import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;

public final class HashUtils {

    private HashUtils() {}

    public static int hash(String key) {
        if (key == null) throw new IllegalArgumentException("key is null");

        return Hashing.murmur3_32_fixed()
                .hashString(key, StandardCharsets.UTF_8)
                .asInt() & 0x7FFFFFFF;
    }

    public static int hash(byte[] bytes) {
        if (bytes == null) throw new IllegalArgumentException("bytes is null");

        return Hashing.murmur3_32_fixed()
                .hashBytes(bytes)
                .asInt() & 0x7FFFFFFF;
    }

    /**
     * Maps encoded affinity bytes onto one of {@code partitions} partitions.
     */
    public static int partition(byte[] affinityKey, int partitions) {
        if (partitions <= 0) throw new IllegalArgumentException("partitions must be > 0");
        return hash(affinityKey) % partitions;
    }
}
