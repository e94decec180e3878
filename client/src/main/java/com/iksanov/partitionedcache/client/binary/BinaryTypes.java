package com.iksanov.partitionedcache.client.binary;

/**
 * Type tags of the value codec. Every encoded value starts with one of these bytes.
 */
public final class BinaryTypes {

    public static final byte BYTE = 1;
    public static final byte SHORT = 2;
    public static final byte INT = 3;
    public static final byte LONG = 4;
    public static final byte FLOAT = 5;
    public static final byte DOUBLE = 6;
    public static final byte CHAR = 7;
    public static final byte BOOL = 8;
    public static final byte STRING = 9;
    public static final byte UUID = 10;
    public static final byte BYTE_ARR = 12;
    public static final byte NULL = 101;

    private BinaryTypes() {}
}
