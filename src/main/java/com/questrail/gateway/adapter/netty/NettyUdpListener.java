package com.questrail.gateway.adapter.netty;

import com.questrail.gateway.adapter.InboundReply;
import com.questrail.gateway.api.Message;
import com.questrail.gateway.api.ProtocolKind;
import com.questrail.gateway.config.TransportSettings;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.Executor;

/**
 * UDP listener.
 *
 * <p>There is no accepted connection to serialize on, so each datagram is
 * handled independently on the handler pool and answered, if at all, with one
 * datagram to its sender. The sender address doubles as connection id.</p>
 */
final class NettyUdpListener extends AbstractNettyListener
{
    private static final Logger log = LoggerFactory.getLogger(NettyUdpListener.class);

    NettyUdpListener(EventLoopGroup bossGroup, EventLoopGroup workerGroup, Executor handlerPool,
                     TransportSettings settings)
    {
        super(bossGroup, workerGroup, handlerPool, settings);
    }

    @Override
    public ProtocolKind kind()
    {
        return ProtocolKind.UDP;
    }

    @Override
    protected ChannelFuture bind(InetSocketAddress bindAddress)
    {
        return new Bootstrap()
                .group(workerGroup)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, false)
                .handler(new DatagramHandler())
                .bind(bindAddress);
    }

    @Override
    protected void initChildPipeline(ChannelPipeline pipeline, SerialExecutor serial)
    {
        throw new UnsupportedOperationException("UDP listener accepts no child channels");
    }

    private final class DatagramHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            InetSocketAddress sender = packet.sender();
            Message message = Message.builder(ProtocolKind.UDP)
                    .connectionId("udp-" + sender.getAddress().getHostAddress() + ":" + sender.getPort())
                    .payload(ByteBufUtil.getBytes(packet.content()))
                    .remoteAddress(sender)
                    .build();
            dispatch(handlerPool, message, reply -> {
                if (reply.status() != InboundReply.Status.NONE) {
                    ctx.writeAndFlush(new DatagramPacket(Unpooled.wrappedBuffer(reply.wirePayload()), sender));
                }
            });
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            // A datagram socket survives per-packet errors such as ICMP unreachable.
            log.debug("UDP listener error on {}", ctx.channel(), cause);
        }
    }
}
