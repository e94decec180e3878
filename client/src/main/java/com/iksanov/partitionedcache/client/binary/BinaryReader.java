package com.iksanov.partitionedcache.client.binary;

import com.iksanov.partitionedcache.common.exception.SerializationException;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Reader of type-tagged values.
 * <p>
 * In binary mode every non-null value comes back as a {@link BinaryObject} holding its tagged
 * bytes; otherwise values are decoded into their Java types.
 */
public final class BinaryReader {

    private static final int MAX_LENGTH = 64 * 1024 * 1024;

    private final ByteBuf buf;
    private final boolean binaryMode;

    public BinaryReader(byte[] bytes, boolean binaryMode) {
        if (bytes == null) throw new IllegalArgumentException("bytes is null");
        this.buf = Unpooled.wrappedBuffer(bytes);
        this.binaryMode = binaryMode;
    }

    public boolean isBinaryMode() {
        return binaryMode;
    }

    public Object readObject() {
        int start = buf.readerIndex();
        byte tag = readByte();
        if (tag == BinaryTypes.NULL) return null;
        if (binaryMode) {
            skipBody(tag);
            byte[] raw = new byte[buf.readerIndex() - start];
            buf.getBytes(start, raw);
            return new BinaryObject(raw);
        }
        return switch (tag) {
            case BinaryTypes.BYTE -> readByte();
            case BinaryTypes.SHORT -> {
                require(Short.BYTES, "short");
                yield buf.readShort();
            }
            case BinaryTypes.INT -> {
                require(Integer.BYTES, "int");
                yield buf.readInt();
            }
            case BinaryTypes.LONG -> {
                require(Long.BYTES, "long");
                yield buf.readLong();
            }
            case BinaryTypes.FLOAT -> {
                require(Float.BYTES, "float");
                yield buf.readFloat();
            }
            case BinaryTypes.DOUBLE -> {
                require(Double.BYTES, "double");
                yield buf.readDouble();
            }
            case BinaryTypes.CHAR -> {
                require(Character.BYTES, "char");
                yield buf.readChar();
            }
            case BinaryTypes.BOOL -> readBool();
            case BinaryTypes.STRING -> new String(readLengthPrefixed("string"), StandardCharsets.UTF_8);
            case BinaryTypes.UUID -> {
                require(16, "uuid");
                yield new UUID(buf.readLong(), buf.readLong());
            }
            case BinaryTypes.BYTE_ARR -> readLengthPrefixed("byte array");
            default -> throw new SerializationException("Unknown type tag: " + tag);
        };
    }

    public boolean isFullyRead() {
        return !buf.isReadable();
    }

    public void requireFullyRead() {
        if (buf.isReadable()) throw new SerializationException("Trailing bytes after value: " + buf.readableBytes());
    }

    private void skipBody(byte tag) {
        switch (tag) {
            case BinaryTypes.BYTE, BinaryTypes.BOOL -> skip(1, "byte");
            case BinaryTypes.SHORT, BinaryTypes.CHAR -> skip(2, "short");
            case BinaryTypes.INT, BinaryTypes.FLOAT -> skip(4, "int");
            case BinaryTypes.LONG, BinaryTypes.DOUBLE -> skip(8, "long");
            case BinaryTypes.UUID -> skip(16, "uuid");
            case BinaryTypes.STRING, BinaryTypes.BYTE_ARR -> skip(readLength("binary"), "binary body");
            default -> throw new SerializationException("Unknown type tag: " + tag);
        }
    }

    private byte readByte() {
        require(1, "byte");
        return buf.readByte();
    }

    private boolean readBool() {
        byte b = readByte();
        if (b != 0 && b != 1) throw new SerializationException("Invalid boolean byte: " + b);
        return b == 1;
    }

    private byte[] readLengthPrefixed(String what) {
        int len = readLength(what);
        require(len, what);
        byte[] bytes = new byte[len];
        buf.readBytes(bytes);
        return bytes;
    }

    private int readLength(String what) {
        require(Integer.BYTES, what + " length");
        int len = buf.readInt();
        if (len < 0 || len > MAX_LENGTH) throw new SerializationException("Invalid " + what + " length: " + len);
        return len;
    }

    private void skip(int n, String what) {
        require(n, what);
        buf.skipBytes(n);
    }

    private void require(int n, String what) {
        if (buf.readableBytes() < n) {
            throw new SerializationException("Unexpected end of value when reading " + what + " (need " + n + ", have " + buf.readableBytes() + ")");
        }
    }
}
