package com.iksanov.partitionedcache.common.protocol;

/**
 * Request addressed to the primary owner of a single key.
 * <p>
 * The partition is the one the client routed the request to; nodes reject requests
 * for partitions they do not own. It is {@link #UNROUTED} until the dispatcher
 * resolves a route and stamps it with {@link #withPartition(int)}.
 */
public sealed interface KeyRoutedRequest extends CacheRequest permits KeyRequest, PutRequest {

    int UNROUTED = -1;

    int partition();

    byte[] key();

    KeyRoutedRequest withPartition(int partition);
}
