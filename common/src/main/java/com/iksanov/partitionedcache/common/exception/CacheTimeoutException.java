package com.iksanov.partitionedcache.common.exception;

/**
 * The node did not answer within the configured request timeout.
 * The pending request is abandoned; other in-flight requests are unaffected.
 */
public class CacheTimeoutException extends CacheConnectionException {
    public CacheTimeoutException(String message) {
        super(message);
    }
    public CacheTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
