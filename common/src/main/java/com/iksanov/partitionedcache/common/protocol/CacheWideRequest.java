package com.iksanov.partitionedcache.common.protocol;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * REMOVE_ALL, CLEAR and CACHE_PARTITIONS: no key, no payload.
 */
public record CacheWideRequest(ClientOperation operation, int cacheId, byte flags) implements CacheRequest {

    private static final Set<ClientOperation> ALLOWED = EnumSet.of(
            ClientOperation.CACHE_REMOVE_ALL,
            ClientOperation.CACHE_CLEAR,
            ClientOperation.CACHE_PARTITIONS);

    public CacheWideRequest {
        Objects.requireNonNull(operation, "operation");
        if (!ALLOWED.contains(operation)) throw new IllegalArgumentException("Not a cache-wide operation: " + operation);
    }
}
