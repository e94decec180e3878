package com.iksanov.partitionedcache.client.binary;

/**
 * Something that can encode itself for the wire. Encoding must be deterministic:
 * the same value always produces the same bytes.
 */
@FunctionalInterface
public interface Writable {

    void write(BinaryWriter writer);
}
