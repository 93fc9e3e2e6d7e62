package com.questrail.gateway.adapter.netty;

import com.questrail.gateway.adapter.Connection;
import com.questrail.gateway.api.ProtocolKind;
import com.questrail.gateway.registry.Endpoint;

import io.netty.channel.Channel;

import java.util.Objects;

/**
 * Netty-backed {@link Connection}. The channel and protocol attachment stay
 * inside this package; callers only see the {@link Connection} surface.
 */
final class NettyConnection implements Connection
{
    private final String id;
    private final ProtocolKind protocol;
    private final Endpoint endpoint;
    private final Channel channel;
    private final InboundQueue inbound;
    private final Object attachment;

    NettyConnection(String id, ProtocolKind protocol, Endpoint endpoint,
                    Channel channel, InboundQueue inbound, Object attachment)
    {
        this.id = Objects.requireNonNull(id, "id");
        this.protocol = Objects.requireNonNull(protocol, "protocol");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.inbound = Objects.requireNonNull(inbound, "inbound");
        this.attachment = attachment;
    }

    @Override
    public String id()
    {
        return id;
    }

    @Override
    public ProtocolKind protocol()
    {
        return protocol;
    }

    @Override
    public Endpoint endpoint()
    {
        return endpoint;
    }

    Channel channel()
    {
        return channel;
    }

    InboundQueue inbound()
    {
        return inbound;
    }

    Object attachment()
    {
        return attachment;
    }

    @Override
    public String toString()
    {
        return "NettyConnection{" + id + " -> " + endpoint.id() + ", active=" + channel.isActive() + "}";
    }
}
