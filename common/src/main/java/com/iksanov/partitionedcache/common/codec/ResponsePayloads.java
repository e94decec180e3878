package com.iksanov.partitionedcache.common.codec;

import com.iksanov.partitionedcache.common.cluster.NodeInfo;
import com.iksanov.partitionedcache.common.cluster.PartitionTable;
import com.iksanov.partitionedcache.common.exception.SerializationException;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Payload shapes of successful responses, shared by the node (encoding) and the client (decoding).
 * <ul>
 *   <li>EMPTY - no bytes</li>
 *   <li>BOOL - exactly one byte, 0 or 1</li>
 *   <li>COUNT - exactly one 64-bit integer</li>
 *   <li>VALUE - int length (-1 when there is no value) followed by exactly that many bytes</li>
 *   <li>PARTITIONS - partition count, then per node: id, host, port and owned partitions</li>
 * </ul>
 */
public final class ResponsePayloads {

    private static final byte[] EMPTY_PAYLOAD = new byte[0];
    private static final int NO_VALUE = -1;
    private static final int MAX_STRING_LENGTH = 1024;

    public static final ResponseReader<Void> EMPTY = ResponsePayloads::readEmpty;
    public static final ResponseReader<Boolean> BOOL = ResponsePayloads::readBool;
    public static final ResponseReader<Long> COUNT = ResponsePayloads::readCount;
    public static final ResponseReader<byte[]> VALUE = ResponsePayloads::readValue;
    public static final ResponseReader<PartitionTable> PARTITIONS = ResponsePayloads::readPartitions;

    private ResponsePayloads() {}

    public static byte[] empty() {
        return EMPTY_PAYLOAD;
    }

    public static byte[] bool(boolean value) {
        return new byte[]{(byte) (value ? 1 : 0)};
    }

    public static byte[] count(long count) {
        ByteBuf buf = Unpooled.buffer(Long.BYTES);
        buf.writeLong(count);
        return ByteBufUtil.getBytes(buf);
    }

    public static byte[] value(byte[] value) {
        ByteBuf buf = Unpooled.buffer(Integer.BYTES + (value == null ? 0 : value.length));
        if (value == null) {
            buf.writeInt(NO_VALUE);
        } else {
            buf.writeInt(value.length);
            buf.writeBytes(value);
        }
        return ByteBufUtil.getBytes(buf);
    }

    public static byte[] partitions(PartitionTable table) {
        ByteBuf buf = Unpooled.buffer();
        buf.writeInt(table.partitionCount());
        Map<NodeInfo, List<Integer>> byNode = table.partitionsByNode();
        buf.writeInt(byNode.size());
        byNode.forEach((node, parts) -> {
            writeString(buf, node.nodeId());
            writeString(buf, node.host());
            buf.writeInt(node.port());
            buf.writeInt(parts.size());
            parts.forEach(buf::writeInt);
        });
        return ByteBufUtil.getBytes(buf);
    }

    private static Void readEmpty(byte[] payload) {
        if (payload.length != 0) throw new SerializationException("Expected empty payload, got " + payload.length + " bytes");
        return null;
    }

    private static Boolean readBool(byte[] payload) {
        if (payload.length != 1) throw new SerializationException("Expected 1-byte boolean payload, got " + payload.length + " bytes");
        return switch (payload[0]) {
            case 0 -> Boolean.FALSE;
            case 1 -> Boolean.TRUE;
            default -> throw new SerializationException("Invalid boolean payload: " + payload[0]);
        };
    }

    private static Long readCount(byte[] payload) {
        if (payload.length != Long.BYTES) throw new SerializationException("Expected 8-byte count payload, got " + payload.length + " bytes");
        long count = Unpooled.wrappedBuffer(payload).readLong();
        if (count < 0) throw new SerializationException("Negative count in payload: " + count);
        return count;
    }

    private static byte[] readValue(byte[] payload) {
        ByteBuf buf = Unpooled.wrappedBuffer(payload);
        int len = readInt(buf);
        if (len == NO_VALUE) {
            requireFullyRead(buf);
            return null;
        }
        if (len < 0) throw new SerializationException("Invalid value length: " + len);
        if (buf.readableBytes() != len) throw new SerializationException("Value length mismatch: declared " + len + ", available " + buf.readableBytes());
        byte[] value = new byte[len];
        buf.readBytes(value);
        return value;
    }

    private static PartitionTable readPartitions(byte[] payload) {
        ByteBuf buf = Unpooled.wrappedBuffer(payload);
        int partitionCount = readInt(buf);
        if (partitionCount < 0) throw new SerializationException("Invalid partition count: " + partitionCount);
        int nodeCount = readInt(buf);
        if (nodeCount < 0 || (partitionCount > 0 && nodeCount == 0)) throw new SerializationException("Invalid node count: " + nodeCount);

        NodeInfo[] owners = new NodeInfo[partitionCount];
        for (int n = 0; n < nodeCount; n++) {
            NodeInfo node;
            try {
                node = new NodeInfo(readString(buf), readString(buf), readInt(buf));
            } catch (IllegalArgumentException e) {
                throw new SerializationException("Invalid node in partition table: " + e.getMessage(), e);
            }
            int owned = readInt(buf);
            if (owned < 0 || owned > partitionCount) throw new SerializationException("Invalid owned partition count: " + owned);
            for (int i = 0; i < owned; i++) {
                int partition = readInt(buf);
                if (partition < 0 || partition >= partitionCount) throw new SerializationException("Partition out of range: " + partition);
                if (owners[partition] != null) throw new SerializationException("Partition " + partition + " assigned twice");
                owners[partition] = node;
            }
        }
        requireFullyRead(buf);
        for (int p = 0; p < owners.length; p++) {
            if (owners[p] == null) throw new SerializationException("Partition " + p + " has no owner");
        }
        return PartitionTable.of(Arrays.asList(owners));
    }

    private static void writeString(ByteBuf buf, String s) {
        byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
        buf.writeInt(bytes.length);
        buf.writeBytes(bytes);
    }

    private static String readString(ByteBuf buf) {
        int len = readInt(buf);
        if (len < 0 || len > MAX_STRING_LENGTH) throw new SerializationException("Invalid string length: " + len);
        if (buf.readableBytes() < len) throw new SerializationException("Not enough data for string (expected " + len + ")");
        byte[] bytes = new byte[len];
        buf.readBytes(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static int readInt(ByteBuf buf) {
        if (buf.readableBytes() < Integer.BYTES) throw new SerializationException("Unexpected end of payload when reading int");
        return buf.readInt();
    }

    private static void requireFullyRead(ByteBuf buf) {
        if (buf.isReadable()) throw new SerializationException("Trailing bytes in payload: " + buf.readableBytes());
    }
}
