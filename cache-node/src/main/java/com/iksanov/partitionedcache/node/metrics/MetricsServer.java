package com.iksanov.partitionedcache.node.metrics;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.function.Supplier;

/**
 * HTTP endpoint for Prometheus scraping and health checks, on its own port.
 */
public class MetricsServer {

    private static final Logger log = LoggerFactory.getLogger(MetricsServer.class);
    private final int port;
    private final CacheMetrics cacheMetrics;
    private final NetMetrics netMetrics;
    private final Supplier<String> healthSupplier;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public MetricsServer(int port, CacheMetrics cacheMetrics, NetMetrics netMetrics, Supplier<String> healthSupplier) {
        this.port = port;
        this.cacheMetrics = cacheMetrics;
        this.netMetrics = netMetrics;
        this.healthSupplier = healthSupplier;
    }

    public void start() {
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(1);
        try {
            ServerBootstrap bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ch.pipeline()
                                    .addLast(new HttpServerCodec())
                                    .addLast(new HttpObjectAggregator(64 * 1024))
                                    .addLast(new MetricsHandler());
                        }
                    })
                    .option(ChannelOption.SO_BACKLOG, 128);
            serverChannel = bootstrap.bind(port).sync().channel();
            log.info("Metrics server started on port {}", port);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while starting metrics server", e);
            shutdown();
        } catch (Exception e) {
            log.error("Failed to start metrics server on port {}", port, e);
            shutdown();
        }
    }

    public void shutdown() {
        if (serverChannel != null) serverChannel.close();
        if (workerGroup != null) workerGroup.shutdownGracefully();
        if (bossGroup != null) bossGroup.shutdownGracefully();
        log.info("Metrics server shut down");
    }

    private class MetricsHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
            String uri = request.uri();
            if ("/metrics".equals(uri)) {
                respond(ctx, HttpResponseStatus.OK, cacheMetrics.scrape() + "\n" + netMetrics.scrape(),
                        "text/plain; version=0.0.4; charset=utf-8");
            } else if ("/health".equals(uri)) {
                respond(ctx, HttpResponseStatus.OK, healthSupplier.get(), "application/json");
            } else {
                respond(ctx, HttpResponseStatus.NOT_FOUND, "Not Found", "text/plain");
            }
        }

        private void respond(ChannelHandlerContext ctx, HttpResponseStatus status, String body, String contentType) {
            FullHttpResponse response = new DefaultFullHttpResponse(
                    HttpVersion.HTTP_1_1, status, Unpooled.copiedBuffer(body, StandardCharsets.UTF_8));
            response.headers().set(HttpHeaderNames.CONTENT_TYPE, contentType);
            response.headers().set(HttpHeaderNames.CONTENT_LENGTH, response.content().readableBytes());
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.error("Error in metrics handler", cause);
            ctx.close();
        }
    }
}
