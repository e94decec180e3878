package com.iksanov.partitionedcache.common.protocol;

/**
 * Memory tiers to include when counting cache entries. Modes are OR-ed into a bit mask;
 * an empty mask ({@link #ALL}) means every tier.
 */
public enum CachePeekMode {
    ALL(0),
    NEAR(0x01),
    PRIMARY(0x02),
    BACKUP(0x04),
    ONHEAP(0x08),
    OFFHEAP(0x10);

    private final int flag;

    CachePeekMode(int flag) {
        this.flag = flag;
    }

    public int flag() {
        return flag;
    }

    public static int toMask(CachePeekMode... modes) {
        int mask = 0;
        if (modes == null) return mask;
        for (CachePeekMode mode : modes) mask |= mode.flag;
        return mask;
    }

    public static boolean includes(int mask, CachePeekMode mode) {
        return mask == 0 || (mask & mode.flag) != 0;
    }
}
