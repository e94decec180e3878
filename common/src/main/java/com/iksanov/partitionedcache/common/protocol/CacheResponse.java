package com.iksanov.partitionedcache.common.protocol;

import java.util.Arrays;
import java.util.Objects;

/**
 * Response to a {@link RequestFrame}.
 * <p>
 * On {@link ResponseStatus#SUCCESS} the payload holds the operation's result in the
 * shape defined by {@link com.iksanov.partitionedcache.common.codec.ResponsePayloads};
 * otherwise the payload is empty and {@code errorMessage} carries the node's explanation.
 */
public record CacheResponse(long requestId, ResponseStatus status, byte[] payload, String errorMessage) {

    private static final byte[] NO_PAYLOAD = new byte[0];

    public CacheResponse {
        Objects.requireNonNull(status, "status");
        if (payload == null) payload = NO_PAYLOAD;
    }

    public static CacheResponse ok(long requestId, byte[] payload) {
        return new CacheResponse(requestId, ResponseStatus.SUCCESS, payload, null);
    }

    public static CacheResponse error(long requestId, ResponseStatus status, String message) {
        if (status == ResponseStatus.SUCCESS) throw new IllegalArgumentException("error response requires a failure status");
        return new CacheResponse(requestId, status, NO_PAYLOAD, message);
    }

    public boolean isSuccess() {
        return status == ResponseStatus.SUCCESS;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CacheResponse that)) return false;
        return requestId == that.requestId && status == that.status
                && Arrays.equals(payload, that.payload) && Objects.equals(errorMessage, that.errorMessage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(requestId, status, Arrays.hashCode(payload), errorMessage);
    }

    @Override
    public String toString() {
        return "CacheResponse[requestId=%d, status=%s, payloadLength=%d, error=%s]".formatted(requestId, status, payload.length, errorMessage);
    }
}
