package com.iksanov.partitionedcache.common.codec;

import com.iksanov.partitionedcache.common.exception.InvalidCacheRequestException;
import com.iksanov.partitionedcache.common.exception.SerializationException;
import com.iksanov.partitionedcache.common.protocol.*;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.MessageToMessageCodec;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Encodes {@link RequestFrame}s and {@link CacheResponse}s into frame bodies and back.
 * Framing (the length prefix) is done by the surrounding pipeline.
 */
public final class CacheMessageCodec extends MessageToMessageCodec<ByteBuf, Object> {

    private static final byte PROTOCOL_VERSION = 1;
    private static final byte TYPE_REQUEST = 0;
    private static final byte TYPE_RESPONSE = 1;
    private static final int MAX_STRING_LENGTH = 10_000;

    @Override
    protected void encode(ChannelHandlerContext ctx, Object msg, List<Object> out) {
        ByteBuf buffer = ctx.alloc().buffer();
        buffer.writeByte(PROTOCOL_VERSION);
        if (msg instanceof RequestFrame frame) {
            buffer.writeByte(TYPE_REQUEST);
            encodeRequest(buffer, frame);
        } else if (msg instanceof CacheResponse response) {
            buffer.writeByte(TYPE_RESPONSE);
            encodeResponse(buffer, response);
        } else {
            buffer.release();
            throw new SerializationException("Unsupported message type: " + msg.getClass());
        }
        out.add(buffer);
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        if (in.readableBytes() < 2) throw new CorruptedFrameException("Not enough data to read header");
        byte version = in.readByte();
        if (version != PROTOCOL_VERSION) throw new CorruptedFrameException("Unsupported protocol version: " + version);

        byte messageType = in.readByte();
        switch (messageType) {
            case TYPE_REQUEST -> out.add(decodeRequest(in));
            case TYPE_RESPONSE -> out.add(decodeResponse(in));
            default -> throw new CorruptedFrameException("Unknown message type: " + messageType);
        }
    }

    private void encodeRequest(ByteBuf buffer, RequestFrame frame) {
        CacheRequest request = frame.request();
        buffer.writeShort(request.operation().code());
        buffer.writeLong(frame.requestId());
        buffer.writeInt(request.cacheId());
        buffer.writeByte(request.flags());
        if (request instanceof KeyRequest keyRequest) {
            buffer.writeInt(keyRequest.partition());
            writeBytes(buffer, keyRequest.key());
        } else if (request instanceof PutRequest putRequest) {
            buffer.writeInt(putRequest.partition());
            writeBytes(buffer, putRequest.key());
            writeBytes(buffer, putRequest.value());
        } else if (request instanceof SizeRequest sizeRequest) {
            buffer.writeInt(sizeRequest.peekModes());
        }
        // cache-wide requests have no body
    }

    private void encodeResponse(ByteBuf buffer, CacheResponse response) {
        buffer.writeLong(response.requestId());
        buffer.writeShort(response.status().code());
        if (response.isSuccess()) {
            writeBytes(buffer, response.payload());
        } else {
            writeNullableString(buffer, response.errorMessage());
        }
    }

    private RequestFrame decodeRequest(ByteBuf in) {
        short code = readShortSafe(in);
        ClientOperation operation = ClientOperation.fromCode(code);
        if (operation == null) throw new InvalidCacheRequestException("Invalid operation code: " + code);
        long requestId = readLongSafe(in);
        int cacheId = readIntSafe(in);
        byte flags = (byte) readByteSafe(in);

        CacheRequest request = switch (operation) {
            case CACHE_GET, CACHE_CONTAINS_KEY, CACHE_REMOVE_KEY, CACHE_CLEAR_KEY -> {
                int partition = readIntSafe(in);
                yield new KeyRequest(operation, cacheId, flags, partition, readBytes(in));
            }
            case CACHE_PUT -> {
                int partition = readIntSafe(in);
                byte[] key = readBytes(in);
                yield new PutRequest(cacheId, flags, partition, key, readBytes(in));
            }
            case CACHE_GET_SIZE -> new SizeRequest(cacheId, flags, readIntSafe(in));
            case CACHE_REMOVE_ALL, CACHE_CLEAR, CACHE_PARTITIONS -> new CacheWideRequest(operation, cacheId, flags);
        };
        if (in.isReadable()) throw new CorruptedFrameException("Trailing bytes after " + operation + " request: " + in.readableBytes());
        return new RequestFrame(requestId, request);
    }

    private CacheResponse decodeResponse(ByteBuf in) {
        long requestId = readLongSafe(in);
        short code = readShortSafe(in);
        ResponseStatus status = ResponseStatus.fromCode(code);
        if (status == null) throw new CorruptedFrameException("Unknown response status: " + code);
        if (status == ResponseStatus.SUCCESS) return CacheResponse.ok(requestId, readBytes(in));
        return new CacheResponse(requestId, status, null, readNullableString(in));
    }

    private void writeBytes(ByteBuf buffer, byte[] bytes) {
        buffer.writeInt(bytes.length);
        buffer.writeBytes(bytes);
    }

    private byte[] readBytes(ByteBuf in) {
        int len = readIntSafe(in);
        if (len < 0) throw new SerializationException("Invalid byte array length: " + len);
        if (in.readableBytes() < len) throw new CorruptedFrameException("Not enough data for byte array (expected " + len + ")");
        byte[] bytes = new byte[len];
        in.readBytes(bytes);
        return bytes;
    }

    /**
     * Writes at most {@value #MAX_STRING_LENGTH} UTF-8 bytes so the peer's length check never trips.
     */
    private void writeNullableString(ByteBuf buffer, String s) {
        if (s == null) {
            buffer.writeInt(-1);
            return;
        }
        byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
        int len = Math.min(bytes.length, MAX_STRING_LENGTH);
        // never cut a multi-byte character in half
        while (len > 0 && len < bytes.length && (bytes[len] & 0xC0) == 0x80) len--;
        buffer.writeInt(len);
        buffer.writeBytes(bytes, 0, len);
    }

    private String readNullableString(ByteBuf in) {
        int len = readIntSafe(in);
        if (len == -1) return null;
        if (len < 0 || len > MAX_STRING_LENGTH) throw new SerializationException("Invalid nullable string length: " + len);
        if (in.readableBytes() < len) throw new CorruptedFrameException("Not enough data for nullable string (expected " + len + ")");
        byte[] bytes = new byte[len];
        in.readBytes(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private int readByteSafe(ByteBuf in) {
        if (in.readableBytes() < 1) throw new CorruptedFrameException("Unexpected end of frame when reading byte");
        return in.readByte();
    }

    private short readShortSafe(ByteBuf in) {
        if (in.readableBytes() < Short.BYTES) throw new CorruptedFrameException("Unexpected end of frame when reading short");
        return in.readShort();
    }

    private int readIntSafe(ByteBuf in) {
        if (in.readableBytes() < Integer.BYTES) throw new CorruptedFrameException("Unexpected end of frame when reading int");
        return in.readInt();
    }

    private long readLongSafe(ByteBuf in) {
        if (in.readableBytes() < Long.BYTES) throw new CorruptedFrameException("Unexpected end of frame when reading long");
        return in.readLong();
    }
}
