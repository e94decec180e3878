package com.iksanov.partitionedcache.common.protocol;

import java.util.Objects;

/**
 * A request on the wire: the body plus the correlation id the response will echo.
 */
public record RequestFrame(long requestId, CacheRequest request) {
    public RequestFrame {
        Objects.requireNonNull(request, "request");
    }
}
