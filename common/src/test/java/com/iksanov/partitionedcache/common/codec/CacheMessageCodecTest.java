package com.iksanov.partitionedcache.common.codec;

import com.iksanov.partitionedcache.common.exception.InvalidCacheRequestException;
import com.iksanov.partitionedcache.common.protocol.*;
import io.netty.buffer.ByteBuf;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.DecoderException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link CacheMessageCodec}.
 * Covers every request variant, success and error responses, header validation and truncated frames.
 */
class CacheMessageCodecTest {

    private static final int CACHE_ID = "users".hashCode();

    private <T> T passThrough(Object message) {
        EmbeddedChannel channel = new EmbeddedChannel(new CacheMessageCodec());
        assertTrue(channel.writeOutbound(message));
        ByteBuf encoded = channel.readOutbound();
        assertNotNull(encoded);
        assertTrue(encoded.readableBytes() > 0);
        assertTrue(channel.writeInbound(encoded));
        return channel.readInbound();
    }

    @Test
    @DisplayName("PutRequest should keep key, value, partition and flags")
    void testPutRequest() {
        PutRequest put = new PutRequest(CACHE_ID, CacheRequest.FLAG_KEEP_BINARY, 17, new byte[]{9, 1, 2}, new byte[]{3, 4, 5, 6});
        RequestFrame decoded = passThrough(new RequestFrame(42L, put));

        assertEquals(42L, decoded.requestId());
        assertEquals(put, decoded.request());
        assertTrue(decoded.request().keepBinary());
    }

    @Test
    @DisplayName("Every single-key operation should be encoded with its own opcode")
    void testKeyRequests() {
        for (ClientOperation op : new ClientOperation[]{
                ClientOperation.CACHE_GET, ClientOperation.CACHE_CONTAINS_KEY,
                ClientOperation.CACHE_REMOVE_KEY, ClientOperation.CACHE_CLEAR_KEY}) {
            KeyRequest request = new KeyRequest(op, CACHE_ID, (byte) 0, 3, new byte[]{1, 2, 3});
            RequestFrame decoded = passThrough(new RequestFrame(7L, request));
            assertEquals(request, decoded.request(), "Mismatch for " + op);
        }
    }

    @Test
    @DisplayName("SizeRequest should carry the peek mode mask untouched")
    void testSizeRequest() {
        int mask = CachePeekMode.toMask(CachePeekMode.PRIMARY, CachePeekMode.BACKUP);
        RequestFrame decoded = passThrough(new RequestFrame(1L, new SizeRequest(CACHE_ID, (byte) 0, mask)));
        SizeRequest size = assertInstanceOf(SizeRequest.class, decoded.request());
        assertEquals(mask, size.peekModes());
    }

    @Test
    @DisplayName("Cache-wide requests should round-trip without a body")
    void testCacheWideRequests() {
        for (ClientOperation op : new ClientOperation[]{
                ClientOperation.CACHE_CLEAR, ClientOperation.CACHE_REMOVE_ALL, ClientOperation.CACHE_PARTITIONS}) {
            CacheWideRequest request = new CacheWideRequest(op, CACHE_ID, (byte) 0);
            RequestFrame decoded = passThrough(new RequestFrame(5L, request));
            assertEquals(request, decoded.request());
        }
    }

    @Test
    @DisplayName("Successful response should keep its payload")
    void testSuccessResponse() {
        CacheResponse response = CacheResponse.ok(11L, ResponsePayloads.count(123));
        CacheResponse decoded = passThrough(response);
        assertEquals(response, decoded);
        assertEquals(123L, ResponsePayloads.COUNT.read(decoded.payload()));
    }

    @Test
    @DisplayName("Error response should keep status and message")
    void testErrorResponse() {
        CacheResponse response = CacheResponse.error(12L, ResponseStatus.NOT_PRIMARY, "partition 3 is owned by node-2");
        CacheResponse decoded = passThrough(response);
        assertEquals(ResponseStatus.NOT_PRIMARY, decoded.status());
        assertEquals("partition 3 is owned by node-2", decoded.errorMessage());
        assertEquals(0, decoded.payload().length);
    }

    @Test
    @DisplayName("Oversized error message should be cut to the decodable limit")
    void testOversizedErrorMessage() {
        CacheResponse decoded = passThrough(CacheResponse.error(13L, ResponseStatus.STORE_FAILURE, "x".repeat(10_001)));
        assertEquals(ResponseStatus.STORE_FAILURE, decoded.status());
        assertEquals("x".repeat(10_000), decoded.errorMessage());
    }

    @Test
    @DisplayName("Cut error message should not split a multi-byte character")
    void testOversizedMultiByteErrorMessage() {
        // 3 bytes per char: 3334 chars = 10002 bytes, so the last char does not fit
        CacheResponse decoded = passThrough(CacheResponse.error(14L, ResponseStatus.FAILED, "\u20ac".repeat(3334)));
        assertEquals(ResponseStatus.FAILED, decoded.status());
        assertEquals("\u20ac".repeat(3333), decoded.errorMessage());
    }

    @Test
    @DisplayName("Codec should throw an exception for an unknown message type")
    void testInvalidTypeThrowsException() {
        EmbeddedChannel channel = new EmbeddedChannel(new CacheMessageCodec());
        ByteBuf bad = channel.alloc().buffer();
        bad.writeByte(1);
        bad.writeByte(99);
        assertThrows(CorruptedFrameException.class, () -> channel.writeInbound(bad));
    }

    @Test
    @DisplayName("Codec should throw an exception for invalid protocol version")
    void testInvalidVersionThrowsException() {
        EmbeddedChannel channel = new EmbeddedChannel(new CacheMessageCodec());
        ByteBuf bad = channel.alloc().buffer();
        bad.writeByte(42);
        bad.writeByte(0);
        assertThrows(CorruptedFrameException.class, () -> channel.writeInbound(bad));
    }

    @Test
    @DisplayName("Codec should reject an unknown opcode")
    void testUnknownOpcode() {
        EmbeddedChannel channel = new EmbeddedChannel(new CacheMessageCodec());
        ByteBuf bad = channel.alloc().buffer();
        bad.writeByte(1);
        bad.writeByte(0);
        bad.writeShort(4242);
        DecoderException ex = assertThrows(DecoderException.class, () -> channel.writeInbound(bad));
        assertInstanceOf(InvalidCacheRequestException.class, ex.getCause());
    }

    @Test
    @DisplayName("Codec should reject a truncated key")
    void testTruncatedKey() {
        EmbeddedChannel channel = new EmbeddedChannel(new CacheMessageCodec());
        ByteBuf bad = channel.alloc().buffer();
        bad.writeByte(1);
        bad.writeByte(0);
        bad.writeShort(ClientOperation.CACHE_GET.code());
        bad.writeLong(1L);
        bad.writeInt(CACHE_ID);
        bad.writeByte(0);
        bad.writeInt(0);
        bad.writeInt(10);
        bad.writeBytes(new byte[]{1, 2});
        assertThrows(CorruptedFrameException.class, () -> channel.writeInbound(bad));
    }

    @Test
    @DisplayName("Codec should reject an unknown response status")
    void testUnknownStatus() {
        EmbeddedChannel channel = new EmbeddedChannel(new CacheMessageCodec());
        ByteBuf bad = channel.alloc().buffer();
        bad.writeByte(1);
        bad.writeByte(1);
        bad.writeLong(1L);
        bad.writeShort(777);
        assertThrows(CorruptedFrameException.class, () -> channel.writeInbound(bad));
    }
}
