package com.iksanov.partitionedcache.node.net;

import com.iksanov.partitionedcache.common.codec.CacheMessageCodec;
import com.iksanov.partitionedcache.node.metrics.NetMetrics;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;

/**
 * Pipeline of an accepted connection: lifecycle tracking, length framing, the message codec
 * and the request handler. The sharable handlers are created once per server.
 */
public class NetServerInitializer extends ChannelInitializer<SocketChannel> {
    private final int maxFrameLength;
    private final ChannelLifecycleHandler lifecycleHandler;
    private final NetConnectionHandler connectionHandler;

    public NetServerInitializer(RequestProcessor requestProcessor, int maxFrameLength, NetMetrics metrics) {
        this.maxFrameLength = maxFrameLength;
        this.lifecycleHandler = new ChannelLifecycleHandler(metrics);
        this.connectionHandler = new NetConnectionHandler(requestProcessor, metrics);
    }

    @Override
    protected void initChannel(SocketChannel ch) {
        ChannelPipeline p = ch.pipeline();
        p.addLast(lifecycleHandler);
        p.addLast(new LoggingHandler(LogLevel.DEBUG));
        p.addLast(new LengthFieldBasedFrameDecoder(maxFrameLength, 0, 4, 0, 4));
        p.addLast(new LengthFieldPrepender(4));
        p.addLast(new CacheMessageCodec());
        p.addLast(connectionHandler);
    }
}
