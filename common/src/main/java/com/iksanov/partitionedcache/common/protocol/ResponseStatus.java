package com.iksanov.partitionedcache.common.protocol;

import java.util.HashMap;
import java.util.Map;

public enum ResponseStatus {
    SUCCESS(0),
    FAILED(1),
    CACHE_DOES_NOT_EXIST(1000),
    NOT_PRIMARY(1001),
    STORE_FAILURE(1002);

    private static final Map<Short, ResponseStatus> BY_CODE = new HashMap<>();

    static {
        for (ResponseStatus status : values()) BY_CODE.put(status.code, status);
    }

    private final short code;

    ResponseStatus(int code) {
        this.code = (short) code;
    }

    public short code() {
        return code;
    }

    public static ResponseStatus fromCode(short code) {
        return BY_CODE.get(code);
    }
}
