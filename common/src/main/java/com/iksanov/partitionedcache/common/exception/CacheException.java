package com.iksanov.partitionedcache.common.exception;

/**
 * Base class of every error raised by the partitioned cache, on the client and on the node.
 */
public class CacheException extends RuntimeException {
    public CacheException(String message) {
        super(message);
    }
    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
