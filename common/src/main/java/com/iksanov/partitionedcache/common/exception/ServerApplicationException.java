package com.iksanov.partitionedcache.common.exception;

import com.iksanov.partitionedcache.common.protocol.ResponseStatus;

/**
 * The node executed the request but reported a failure (type mismatch, store failure, ...).
 * The server message is kept verbatim.
 */
public class ServerApplicationException extends CacheException {

    private final ResponseStatus status;

    public ServerApplicationException(ResponseStatus status, String message) {
        super(message);
        this.status = status;
    }

    public ResponseStatus getStatus() {
        return status;
    }
}
