package com.iksanov.partitionedcache.common.protocol;

import java.util.Arrays;
import java.util.Objects;

/**
 * GET, CONTAINS_KEY, REMOVE_KEY and CLEAR_KEY: a key and nothing else.
 */
public record KeyRequest(ClientOperation operation, int cacheId, byte flags, int partition, byte[] key)
        implements KeyRoutedRequest {

    public KeyRequest {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(key, "key");
        if (!operation.isKeyRouted() || operation == ClientOperation.CACHE_PUT) {
            throw new IllegalArgumentException("Not a single-key operation: " + operation);
        }
    }

    public KeyRequest(ClientOperation operation, int cacheId, byte flags, byte[] key) {
        this(operation, cacheId, flags, UNROUTED, key);
    }

    @Override
    public KeyRequest withPartition(int partition) {
        return new KeyRequest(operation, cacheId, flags, partition, key);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof KeyRequest that)) return false;
        return cacheId == that.cacheId && flags == that.flags && partition == that.partition
                && operation == that.operation && Arrays.equals(key, that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operation, cacheId, flags, partition, Arrays.hashCode(key));
    }

    @Override
    public String toString() {
        return "KeyRequest[op=%s, cacheId=%d, partition=%d, keyLength=%d]".formatted(operation, cacheId, partition, key.length);
    }
}
