package com.iksanov.partitionedcache.node.net;

import com.iksanov.partitionedcache.node.metrics.NetMetrics;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.AttributeKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counts client connections and logs when they open and close, with how long each lasted.
 */
@ChannelHandler.Sharable
public class ChannelLifecycleHandler extends ChannelInboundHandlerAdapter {

    private static final Logger log = LoggerFactory.getLogger(ChannelLifecycleHandler.class);
    static final AttributeKey<Long> OPENED_AT = AttributeKey.valueOf("partitionedcache.openedAt");
    private final NetMetrics metrics;

    public ChannelLifecycleHandler(NetMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        ctx.channel().attr(OPENED_AT).set(System.currentTimeMillis());
        metrics.incrementConnections();
        log.info("Client connected from {} (active: {})", ctx.channel().remoteAddress(), metrics.getActiveConnections());
        ctx.fireChannelActive();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        metrics.incrementClosedConnections();
        Long openedAt = ctx.channel().attr(OPENED_AT).get();
        long lifetime = openedAt == null ? 0 : System.currentTimeMillis() - openedAt;
        log.info("Client {} disconnected after {} ms (active: {})", ctx.channel().remoteAddress(), lifetime, metrics.getActiveConnections());
        ctx.fireChannelInactive();
    }
}
