package com.iksanov.partitionedcache.common.protocol;

import java.util.HashMap;
import java.util.Map;

/**
 * Operations of the cache protocol with their wire opcodes.
 * <p>
 * Key-routed operations must be sent to the primary owner of the key's partition;
 * the others address the cache as a whole and are either broadcast to every node
 * (size, clear, remove-all) or sent to any live node (partition table fetch).
 */
public enum ClientOperation {
    CACHE_GET(1000, true),
    CACHE_PUT(1001, true),
    CACHE_CONTAINS_KEY(1011, true),
    CACHE_CLEAR(1013, false),
    CACHE_CLEAR_KEY(1014, true),
    CACHE_REMOVE_KEY(1016, true),
    CACHE_REMOVE_ALL(1019, false),
    CACHE_GET_SIZE(1020, false),
    CACHE_PARTITIONS(1101, false);

    private static final Map<Short, ClientOperation> BY_CODE = new HashMap<>();

    static {
        for (ClientOperation op : values()) BY_CODE.put(op.code, op);
    }

    private final short code;
    private final boolean keyRouted;

    ClientOperation(int code, boolean keyRouted) {
        this.code = (short) code;
        this.keyRouted = keyRouted;
    }

    public short code() {
        return code;
    }

    public boolean isKeyRouted() {
        return keyRouted;
    }

    /**
     * @return the operation for the opcode, or {@code null} if the opcode is unknown
     */
    public static ClientOperation fromCode(short code) {
        return BY_CODE.get(code);
    }
}
