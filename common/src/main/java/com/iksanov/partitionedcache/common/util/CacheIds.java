package com.iksanov.partitionedcache.common.util;

/**
 * Derives the numeric cache selector sent on the wire from a cache name, so requests
 * never carry the name itself. Client and node must agree on this function.
 */
public final class CacheIds {

    private CacheIds() {}

    public static int cacheId(String cacheName) {
        if (cacheName == null || cacheName.isBlank()) throw new IllegalArgumentException("cache name cannot be null or blank");
        return cacheName.hashCode();
    }
}
