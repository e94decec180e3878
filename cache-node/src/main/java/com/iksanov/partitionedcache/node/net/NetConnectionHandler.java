package com.iksanov.partitionedcache.node.net;

import com.iksanov.partitionedcache.common.protocol.CacheResponse;
import com.iksanov.partitionedcache.common.protocol.RequestFrame;
import com.iksanov.partitionedcache.common.protocol.ResponseStatus;
import com.iksanov.partitionedcache.node.metrics.NetMetrics;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands decoded {@link RequestFrame}s to the {@link RequestProcessor} and writes back the response.
 * Requests are processed on the channel's event loop, so responses on one connection keep request order.
 */
@ChannelHandler.Sharable
public class NetConnectionHandler extends SimpleChannelInboundHandler<RequestFrame> {
    private static final Logger log = LoggerFactory.getLogger(NetConnectionHandler.class);
    private final RequestProcessor processor;
    private final NetMetrics metrics;

    public NetConnectionHandler(RequestProcessor processor, NetMetrics metrics) {
        this.processor = processor;
        this.metrics = metrics;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RequestFrame frame) {
        CacheResponse response;
        try {
            response = processor.process(frame);
        } catch (Exception e) {
            metrics.incrementErrors();
            log.error("Error while processing requestId={} op={}: {}", frame.requestId(), frame.request().operation(), e.getMessage(), e);
            response = CacheResponse.error(frame.requestId(), ResponseStatus.FAILED, String.valueOf(e.getMessage()));
        }
        ctx.writeAndFlush(response);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        metrics.incrementErrors();
        log.error("Closing channel {} after error: {}", ctx.channel().remoteAddress(), cause.getMessage(), cause);
        ctx.close();
    }
}
