package com.questrail.gateway.adapter.netty;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Last handler of a client pipeline: copies each complete inbound message into
 * the connection's {@link InboundQueue} and turns channel closure or failure
 * into a closed queue.
 *
 * <p>Copying into {@code byte[]} keeps reference-counted buffers inside the
 * pipeline; {@link SimpleChannelInboundHandler} releases the original.</p>
 *
 * @param <T> decoded message type delivered by the preceding codec
 */
abstract class QueueingInboundHandler<T> extends SimpleChannelInboundHandler<T>
{
    private static final Logger log = LoggerFactory.getLogger(QueueingInboundHandler.class);

    protected final InboundQueue inbound;

    protected QueueingInboundHandler(Class<? extends T> messageType, InboundQueue inbound)
    {
        super(messageType);
        this.inbound = Objects.requireNonNull(inbound, "inbound");
    }

    /**
     * Extract the payload, or {@code null} to skip a control message.
     */
    protected abstract byte[] payloadOf(T message);

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, T message)
    {
        byte[] payload = payloadOf(message);
        if (payload != null) {
            inbound.offer(payload);
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception
    {
        inbound.markClosed(null);
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
    {
        log.debug("Client channel {} failed", ctx.channel(), cause);
        inbound.markClosed(cause);
        ctx.close();
    }
}
