package com.questrail.gateway.adapter.netty;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base for the last handler of an accepted channel: a pipeline failure closes
 * that one connection and is logged, never propagated to the listener.
 */
abstract class ListenerInboundHandler<T> extends SimpleChannelInboundHandler<T>
{
    private static final Logger log = LoggerFactory.getLogger(ListenerInboundHandler.class);

    protected final SerialExecutor serial;

    protected ListenerInboundHandler(Class<? extends T> messageType, SerialExecutor serial)
    {
        super(messageType);
        this.serial = serial;
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
    {
        log.debug("Closing inbound channel {} after failure", ctx.channel(), cause);
        ctx.close();
    }
}
