package com.iksanov.partitionedcache.client.binary;

import com.iksanov.partitionedcache.common.exception.SerializationException;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Append-only writer of type-tagged values.
 */
public final class BinaryWriter {

    private final ByteBuf buf;

    public BinaryWriter() {
        this.buf = Unpooled.buffer(32);
    }

    /**
     * Encodes a single {@link Writable} into a fresh byte array.
     */
    public static byte[] encode(Writable writable) {
        BinaryWriter writer = new BinaryWriter();
        writable.write(writer);
        if (writer.size() == 0) throw new SerializationException("Writable " + writable.getClass().getSimpleName() + " wrote no bytes");
        return writer.toByteArray();
    }

    public BinaryWriter writeObject(Object value) {
        if (value == null) {
            buf.writeByte(BinaryTypes.NULL);
        } else if (value instanceof BinaryObject binary) {
            buf.writeBytes(binary.unsafeBytes());
        } else if (value instanceof Byte b) {
            buf.writeByte(BinaryTypes.BYTE).writeByte(b);
        } else if (value instanceof Short s) {
            buf.writeByte(BinaryTypes.SHORT).writeShort(s);
        } else if (value instanceof Integer i) {
            buf.writeByte(BinaryTypes.INT).writeInt(i);
        } else if (value instanceof Long l) {
            buf.writeByte(BinaryTypes.LONG).writeLong(l);
        } else if (value instanceof Float f) {
            buf.writeByte(BinaryTypes.FLOAT).writeFloat(f);
        } else if (value instanceof Double d) {
            buf.writeByte(BinaryTypes.DOUBLE).writeDouble(d);
        } else if (value instanceof Character c) {
            buf.writeByte(BinaryTypes.CHAR).writeChar(c);
        } else if (value instanceof Boolean b) {
            buf.writeByte(BinaryTypes.BOOL).writeByte(b ? 1 : 0);
        } else if (value instanceof String s) {
            byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
            buf.writeByte(BinaryTypes.STRING).writeInt(bytes.length).writeBytes(bytes);
        } else if (value instanceof UUID uuid) {
            buf.writeByte(BinaryTypes.UUID)
                    .writeLong(uuid.getMostSignificantBits())
                    .writeLong(uuid.getLeastSignificantBits());
        } else if (value instanceof byte[] bytes) {
            buf.writeByte(BinaryTypes.BYTE_ARR).writeInt(bytes.length).writeBytes(bytes);
        } else {
            throw new SerializationException("Unsupported value type: " + value.getClass().getName());
        }
        return this;
    }

    public int size() {
        return buf.readableBytes();
    }

    public byte[] toByteArray() {
        return ByteBufUtil.getBytes(buf);
    }
}
