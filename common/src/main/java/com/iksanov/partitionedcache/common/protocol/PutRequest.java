package com.iksanov.partitionedcache.common.protocol;

import java.util.Arrays;
import java.util.Objects;

public record PutRequest(int cacheId, byte flags, int partition, byte[] key, byte[] value) implements KeyRoutedRequest {

    public PutRequest {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }

    public PutRequest(int cacheId, byte flags, byte[] key, byte[] value) {
        this(cacheId, flags, UNROUTED, key, value);
    }

    @Override
    public ClientOperation operation() {
        return ClientOperation.CACHE_PUT;
    }

    @Override
    public PutRequest withPartition(int partition) {
        return new PutRequest(cacheId, flags, partition, key, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PutRequest that)) return false;
        return cacheId == that.cacheId && flags == that.flags && partition == that.partition
                && Arrays.equals(key, that.key) && Arrays.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cacheId, flags, partition, Arrays.hashCode(key), Arrays.hashCode(value));
    }

    @Override
    public String toString() {
        return "PutRequest[cacheId=%d, partition=%d, keyLength=%d, valueLength=%d]".formatted(cacheId, partition, key.length, value.length);
    }
}
