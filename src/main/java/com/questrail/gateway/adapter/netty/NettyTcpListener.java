package com.questrail.gateway.adapter.netty;

import com.questrail.gateway.adapter.InboundReply;
import com.questrail.gateway.api.Message;
import com.questrail.gateway.api.ProtocolKind;
import com.questrail.gateway.config.TransportSettings;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;

import java.util.concurrent.Executor;

/**
 * Raw TCP listener: every length-prefixed frame is one message, every reply one
 * frame. Failed replies carry the {@link InboundReply#ERROR_PREFIX} marker.
 */
final class NettyTcpListener extends AbstractNettyListener
{
    NettyTcpListener(EventLoopGroup bossGroup, EventLoopGroup workerGroup, Executor handlerPool,
                     TransportSettings settings)
    {
        super(bossGroup, workerGroup, handlerPool, settings);
    }

    @Override
    public ProtocolKind kind()
    {
        return ProtocolKind.TCP;
    }

    @Override
    protected void initChildPipeline(ChannelPipeline pipeline, SerialExecutor serial)
    {
        TcpFraming.install(pipeline, settings.maxFrameLength());
        pipeline.addLast("handler", new ListenerInboundHandler<ByteBuf>(ByteBuf.class, serial) {
            @Override
            protected void channelRead0(ChannelHandlerContext ctx, ByteBuf frame)
            {
                Message message = Message.builder(ProtocolKind.TCP)
                        .connectionId(connectionId(ctx.channel()))
                        .payload(ByteBufUtil.getBytes(frame))
                        .remoteAddress(ctx.channel().remoteAddress())
                        .build();
                dispatch(serial, message, reply -> {
                    if (reply.status() != InboundReply.Status.NONE) {
                        ctx.writeAndFlush(Unpooled.wrappedBuffer(reply.wirePayload()));
                    }
                });
            }
        });
    }
}
