package com.questrail.gateway.adapter.netty;

import com.questrail.gateway.api.ProtocolKind;
import com.questrail.gateway.config.TransportSettings;
import com.questrail.gateway.registry.Endpoint;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;

/**
 * Raw TCP adapter. Each payload travels as one frame with a 4-byte big-endian
 * length prefix (see {@link TcpFraming}).
 */
final class NettyTcpAdapter extends AbstractNettyAdapter<Void>
{
    NettyTcpAdapter(EventLoopGroup group, TransportSettings settings)
    {
        super(group, settings);
    }

    @Override
    public ProtocolKind kind()
    {
        return ProtocolKind.TCP;
    }

    @Override
    protected Void newAttachment(Endpoint target, InboundQueue inbound)
    {
        return null;
    }

    @Override
    protected void initPipeline(ChannelPipeline pipeline, Endpoint target, InboundQueue inbound, Void attachment)
    {
        TcpFraming.install(pipeline, settings.maxFrameLength());
        pipeline.addLast("inbound", new QueueingInboundHandler<ByteBuf>(ByteBuf.class, inbound) {
            @Override
            protected byte[] payloadOf(ByteBuf frame)
            {
                return ByteBufUtil.getBytes(frame);
            }
        });
    }

    @Override
    protected ChannelFuture write(NettyConnection connection, Void attachment, byte[] payload)
    {
        return connection.channel().writeAndFlush(Unpooled.wrappedBuffer(payload));
    }
}
