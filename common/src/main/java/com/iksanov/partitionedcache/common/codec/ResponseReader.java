package com.iksanov.partitionedcache.common.codec;

/**
 * Decodes the payload of a successful response into the operation's result.
 * Implementations must reject payloads that do not match their shape exactly.
 */
@FunctionalInterface
public interface ResponseReader<T> {
    T read(byte[] payload);
}
