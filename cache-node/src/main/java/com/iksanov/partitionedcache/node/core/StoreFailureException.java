package com.iksanov.partitionedcache.node.core;

import com.iksanov.partitionedcache.common.exception.CacheException;

/**
 * An entry listener rejected an update. The in-memory change has already been applied.
 */
public class StoreFailureException extends CacheException {
    public StoreFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
