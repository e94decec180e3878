package com.iksanov.partitionedcache.common.exception;

/**
 * No known node can serve the key: the partition table is empty, or the chosen node
 * reported that it is not the primary owner anymore. Callers may retry after refreshing
 * the affinity mapping.
 */
public class RoutingUnavailableException extends CacheException {
    public RoutingUnavailableException(String message) {
        super(message);
    }
    public RoutingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
