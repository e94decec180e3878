package com.iksanov.partitionedcache.common.protocol;

/**
 * Body of a request sent to a cache node. Each variant carries only the fields its
 * operation needs; the correlation id is added by the transport in a {@link RequestFrame}.
 */
public sealed interface CacheRequest permits KeyRoutedRequest, SizeRequest, CacheWideRequest {

    /** Flag bit: values are kept in binary form by the caller. */
    byte FLAG_KEEP_BINARY = 0x01;

    ClientOperation operation();

    int cacheId();

    byte flags();

    default boolean keepBinary() {
        return (flags() & FLAG_KEEP_BINARY) != 0;
    }

    static byte flags(boolean keepBinary) {
        return keepBinary ? FLAG_KEEP_BINARY : 0;
    }
}
