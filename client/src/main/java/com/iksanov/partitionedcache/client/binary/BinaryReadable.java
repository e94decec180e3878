package com.iksanov.partitionedcache.client.binary;

/**
 * Target of a value read. Implementations throw
 * {@link com.iksanov.partitionedcache.common.exception.SerializationException} when the bytes
 * do not hold a complete value.
 */
@FunctionalInterface
public interface BinaryReadable {

    void read(BinaryReader reader);
}
