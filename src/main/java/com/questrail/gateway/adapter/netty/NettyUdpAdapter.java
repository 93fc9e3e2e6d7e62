package com.questrail.gateway.adapter.netty;

import com.questrail.gateway.api.ProtocolKind;
import com.questrail.gateway.config.TransportSettings;
import com.questrail.gateway.registry.Endpoint;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;

import java.net.InetSocketAddress;

/**
 * UDP adapter.
 *
 * <p>{@code connect} binds an ephemeral local socket and connects it to the
 * target, which validates that the target is addressable without sending
 * anything. Each payload is one datagram; datagrams from any other sender are
 * dropped by the connected socket.</p>
 */
final class NettyUdpAdapter extends AbstractNettyAdapter<InetSocketAddress>
{
    NettyUdpAdapter(EventLoopGroup group, TransportSettings settings)
    {
        super(group, settings);
    }

    @Override
    public ProtocolKind kind()
    {
        return ProtocolKind.UDP;
    }

    @Override
    protected Class<? extends Channel> channelType()
    {
        return NioDatagramChannel.class;
    }

    @Override
    protected void configure(Bootstrap bootstrap)
    {
        bootstrap.option(ChannelOption.SO_BROADCAST, false);
    }

    @Override
    protected InetSocketAddress newAttachment(Endpoint target, InboundQueue inbound)
    {
        return target.socketAddress();
    }

    @Override
    protected void initPipeline(ChannelPipeline pipeline, Endpoint target, InboundQueue inbound, InetSocketAddress remote)
    {
        pipeline.addLast("inbound", new QueueingInboundHandler<DatagramPacket>(DatagramPacket.class, inbound) {
            @Override
            protected byte[] payloadOf(DatagramPacket packet)
            {
                return ByteBufUtil.getBytes(packet.content());
            }
        });
    }

    @Override
    protected ChannelFuture write(NettyConnection connection, InetSocketAddress remote, byte[] payload)
    {
        return connection.channel().writeAndFlush(new DatagramPacket(Unpooled.wrappedBuffer(payload), remote));
    }
}
