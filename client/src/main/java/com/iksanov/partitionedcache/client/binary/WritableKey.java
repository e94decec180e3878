package com.iksanov.partitionedcache.client.binary;

/**
 * A cache key.
 * <p>
 * {@link #affinityKey()} may return another value whose bytes decide the partition instead of
 * the key's own bytes. The key is still transmitted as written by {@link #write(BinaryWriter)}.
 */
public interface WritableKey extends Writable {

    /**
     * @return the value to route by, or {@code null} to route by the key itself
     */
    default Writable affinityKey() {
        return null;
    }
}
