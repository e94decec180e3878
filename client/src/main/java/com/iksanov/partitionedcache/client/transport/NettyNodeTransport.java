package com.iksanov.partitionedcache.client.transport;

import com.iksanov.partitionedcache.client.config.ClientConfig;
import com.iksanov.partitionedcache.common.cluster.NodeInfo;
import com.iksanov.partitionedcache.common.codec.CacheMessageCodec;
import com.iksanov.partitionedcache.common.exception.CacheConnectionException;
import com.iksanov.partitionedcache.common.protocol.CacheRequest;
import com.iksanov.partitionedcache.common.protocol.CacheResponse;
import com.iksanov.partitionedcache.common.protocol.RequestFrame;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import io.netty.util.AttributeKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One pooled Netty channel per node. Connects are asynchronous and shared by every request to
 * the same node. Responses are matched to requests by a per-transport request id; a channel that
 * closes fails every request still pending on it.
 */
public class NettyNodeTransport implements NodeTransport {

    private static final Logger log = LoggerFactory.getLogger(NettyNodeTransport.class);
    private static final AttributeKey<ResponseHandler> HANDLER_KEY = AttributeKey.valueOf("responseHandler");
    private final EventLoopGroup eventLoopGroup;
    private final Bootstrap bootstrap;
    private final ClientConfig.ConnectionConfig config;
    private final Map<NodeInfo, ChannelFuture> connectionPool = new ConcurrentHashMap<>();
    private final AtomicLong requestIds = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public NettyNodeTransport(ClientConfig.ConnectionConfig config) {
        this.config = config;
        this.eventLoopGroup = new NioEventLoopGroup(config.getIoThreads());
        this.bootstrap = createBootstrap();
    }

    private Bootstrap createBootstrap() {
        return new Bootstrap()
                .group(eventLoopGroup)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, config.getConnectTimeoutMillis())
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ResponseHandler handler = new ResponseHandler();
                        ch.attr(HANDLER_KEY).set(handler);
                        ch.pipeline()
                                .addLast(new LengthFieldBasedFrameDecoder(config.getMaxFrameLength(), 0, 4, 0, 4))
                                .addLast(new LengthFieldPrepender(4))
                                .addLast(new CacheMessageCodec())
                                .addLast(handler);
                    }
                });
    }

    @Override
    public CompletableFuture<CacheResponse> send(NodeInfo node, CacheRequest request) {
        CompletableFuture<CacheResponse> future = new CompletableFuture<>();
        if (closed.get()) {
            future.completeExceptionally(new CacheConnectionException("Transport is closed"));
            return future;
        }

        try {
            connection(node).addListener((ChannelFutureListener) connectFuture -> {
                if (!connectFuture.isSuccess()) {
                    future.completeExceptionally(new CacheConnectionException("Failed to connect to " + node.nodeId(), connectFuture.cause()));
                    return;
                }
                write(node, connectFuture.channel(), request, future);
            });
        } catch (Exception e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    private void write(NodeInfo node, Channel channel, CacheRequest request, CompletableFuture<CacheResponse> future) {
        // timed out or cancelled while the connect was pending
        if (future.isDone()) return;
        ResponseHandler handler = channel.attr(HANDLER_KEY).get();
        if (handler == null) {
            future.completeExceptionally(new CacheConnectionException("No handler found for channel to " + node.nodeId()));
            return;
        }
        long requestId = requestIds.incrementAndGet();
        handler.register(requestId, future);
        future.whenComplete((response, error) -> handler.unregister(requestId));

        channel.writeAndFlush(new RequestFrame(requestId, request)).addListener((ChannelFutureListener) writeFuture -> {
            if (!writeFuture.isSuccess()) {
                future.completeExceptionally(new CacheConnectionException("Failed to write request to " + node.nodeId(), writeFuture.cause()));
                removeChannel(node);
            }
        });
    }

    /**
     * Returns the pending or established connection to the node, starting a new connect if there is none.
     * Never blocks: callers chain on the returned future, so the dispatcher timeout bounds connect time too.
     */
    private ChannelFuture connection(NodeInfo node) {
        ChannelFuture current = connectionPool.get(node);
        if (isUsable(current)) return current;
        ChannelFuture[] created = new ChannelFuture[1];
        ChannelFuture future = connectionPool.compute(node, (n, existing) -> {
            if (isUsable(existing)) return existing;
            created[0] = bootstrap.connect(n.host(), n.port());
            return created[0];
        });
        if (created[0] != null) watch(node, created[0]);
        return future;
    }

    private void watch(NodeInfo node, ChannelFuture connectFuture) {
        connectFuture.addListener((ChannelFutureListener) f -> {
            if (!f.isSuccess()) {
                log.warn("Failed to connect to {} ({}:{}): {}", node.nodeId(), node.host(), node.port(),
                        f.cause() == null ? "cancelled" : f.cause().getMessage());
                connectionPool.remove(node, connectFuture);
                return;
            }
            log.info("Connected to cache node: {} ({}:{})", node.nodeId(), node.host(), node.port());
            f.channel().closeFuture().addListener(closeFuture -> {
                log.info("Connection closed to {}", node.nodeId());
                connectionPool.remove(node, connectFuture);
            });
        });
    }

    private static boolean isUsable(ChannelFuture future) {
        return future != null && (!future.isDone() || (future.isSuccess() && future.channel().isActive()));
    }

    private void removeChannel(NodeInfo node) {
        ChannelFuture future = connectionPool.remove(node);
        if (future != null && future.channel().isActive()) future.channel().close();
    }

    int openConnections() {
        return (int) connectionPool.values().stream()
                .filter(f -> f.isSuccess() && f.channel().isActive())
                .count();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        log.info("Shutting down node transport...");
        connectionPool.values().forEach(future -> future.channel().close());
        connectionPool.clear();
        eventLoopGroup.shutdownGracefully();
        log.info("Node transport shutdown complete");
    }

    static class ResponseHandler extends SimpleChannelInboundHandler<CacheResponse> {

        private final Map<Long, CompletableFuture<CacheResponse>> pendingRequests = new ConcurrentHashMap<>();

        void register(long requestId, CompletableFuture<CacheResponse> future) {
            pendingRequests.put(requestId, future);
        }

        void unregister(long requestId) {
            pendingRequests.remove(requestId);
        }

        int pending() {
            return pendingRequests.size();
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, CacheResponse response) {
            CompletableFuture<CacheResponse> future = pendingRequests.remove(response.requestId());
            if (future != null) {
                future.complete(response);
            } else {
                log.warn("Received response for unknown or expired requestId: {}", response.requestId());
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.error("Channel exception: {}", cause.getMessage(), cause);
            failAll(cause);
            ctx.close();
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            failAll(new CacheConnectionException("Channel closed"));
            ctx.fireChannelInactive();
        }

        private void failAll(Throwable cause) {
            pendingRequests.values().forEach(f -> {if (!f.isDone()) f.completeExceptionally(cause);});
            pendingRequests.clear();
        }
    }
}
