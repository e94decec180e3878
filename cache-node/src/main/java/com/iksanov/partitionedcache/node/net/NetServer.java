package com.iksanov.partitionedcache.node.net;

import com.iksanov.partitionedcache.common.exception.CacheException;
import com.iksanov.partitionedcache.node.config.NetServerConfig;
import com.iksanov.partitionedcache.node.metrics.NetMetrics;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.PooledByteBufAllocator;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * TCP server of a cache node. {@link #start()} returns once the port is bound.
 */
public final class NetServer {

    private static final Logger log = LoggerFactory.getLogger(NetServer.class);
    private final NetServerConfig config;
    private final RequestProcessor processor;
    private final NetMetrics metrics;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;
    private volatile boolean running = false;

    public NetServer(NetServerConfig config, RequestProcessor processor, NetMetrics metrics) {
        this.config = Objects.requireNonNull(config, "config");
        this.processor = Objects.requireNonNull(processor, "processor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public synchronized void start() {
        if (running) {
            log.warn("NetServer is already running on {}:{}", config.host(), boundPort());
            return;
        }

        bossGroup = new NioEventLoopGroup(Math.max(1, config.bossThreads()));
        workerGroup = config.workerThreads() > 0 ? new NioEventLoopGroup(config.workerThreads()) : new NioEventLoopGroup();

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, config.backlog())
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.ALLOCATOR, PooledByteBufAllocator.DEFAULT)
                .childHandler(new NetServerInitializer(processor, config.maxFrameLength(), metrics));

        InetSocketAddress address = new InetSocketAddress(config.host(), config.port());
        log.info("Starting NetServer with config: {}", config);
        ChannelFuture bind = bootstrap.bind(address).awaitUninterruptibly();
        if (!bind.isSuccess()) {
            metrics.incrementErrors();
            log.error("Failed to bind NetServer on {}:{}", config.host(), config.port(), bind.cause());
            shutdownEventLoopGroups();
            throw new CacheException("NetServer failed to bind " + config.host() + ":" + config.port(), bind.cause());
        }
        serverChannel = bind.channel();
        running = true;
        log.info("NetServer started on {}:{}", config.host(), boundPort());
    }

    public synchronized void stop() {
        if (!running) {
            log.warn("NetServer is not running");
            return;
        }
        log.info("Stopping NetServer on {}:{}", config.host(), boundPort());
        try {
            serverChannel.close().syncUninterruptibly();
        } catch (Exception e) {
            metrics.incrementErrors();
            log.error("Error closing NetServer channel: {}", e.getMessage(), e);
        } finally {
            shutdownEventLoopGroups();
            running = false;
            log.info("NetServer stopped");
        }
    }

    private void shutdownEventLoopGroups() {
        try {
            if (workerGroup != null) {
                workerGroup.shutdownGracefully(config.shutdownQuietPeriodSeconds(), config.shutdownTimeoutSeconds(), TimeUnit.SECONDS)
                        .await(config.shutdownTimeoutSeconds(), TimeUnit.SECONDS);
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully(config.shutdownQuietPeriodSeconds(), config.shutdownTimeoutSeconds(), TimeUnit.SECONDS)
                        .await(config.shutdownTimeoutSeconds(), TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted during NetServer shutdown");
        }
    }

    /**
     * @return the port actually bound, or the configured one when not running
     */
    public int boundPort() {
        Channel channel = serverChannel;
        if (channel != null && channel.localAddress() instanceof InetSocketAddress local) return local.getPort();
        return config.port();
    }

    public boolean isRunning() {
        return running;
    }
}
