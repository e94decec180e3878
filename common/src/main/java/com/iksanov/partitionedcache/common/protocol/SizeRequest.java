package com.iksanov.partitionedcache.common.protocol;

/**
 * Asks one node for the number of entries it holds in the tiers selected by {@code peekModes}.
 */
public record SizeRequest(int cacheId, byte flags, int peekModes) implements CacheRequest {

    @Override
    public ClientOperation operation() {
        return ClientOperation.CACHE_GET_SIZE;
    }
}
