package com.questrail.gateway.adapter.netty;

import com.questrail.gateway.api.ProtocolKind;
import com.questrail.gateway.config.TransportSettings;
import com.questrail.gateway.registry.Endpoint;

import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpVersion;

/**
 * HTTP/1.1 adapter over a keep-alive connection.
 *
 * <p>{@code send} issues one {@code POST} whose body is the payload;
 * {@code receive} yields the body of the next response. Non-2xx responses are
 * still delivered as payloads: status interpretation belongs to the business
 * layer, not the transport.</p>
 */
final class NettyHttpAdapter extends AbstractNettyAdapter<String>
{
    NettyHttpAdapter(EventLoopGroup group, TransportSettings settings)
    {
        super(group, settings);
    }

    @Override
    public ProtocolKind kind()
    {
        return ProtocolKind.HTTP;
    }

    @Override
    protected String newAttachment(Endpoint target, InboundQueue inbound)
    {
        return target.address() + ":" + target.port();
    }

    @Override
    protected void initPipeline(ChannelPipeline pipeline, Endpoint target, InboundQueue inbound, String host)
    {
        pipeline.addLast("http-codec", new HttpClientCodec());
        pipeline.addLast("http-aggregator", new HttpObjectAggregator(settings.maxFrameLength()));
        pipeline.addLast("inbound", new QueueingInboundHandler<FullHttpResponse>(FullHttpResponse.class, inbound) {
            @Override
            protected byte[] payloadOf(FullHttpResponse response)
            {
                return ByteBufUtil.getBytes(response.content());
            }
        });
    }

    @Override
    protected ChannelFuture write(NettyConnection connection, String host, byte[] payload)
    {
        FullHttpRequest request = new DefaultFullHttpRequest(
                HttpVersion.HTTP_1_1, HttpMethod.POST, settings.httpPath(), Unpooled.wrappedBuffer(payload));
        request.headers()
                .set(HttpHeaderNames.HOST, host)
                .set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_OCTET_STREAM)
                .set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE)
                .setInt(HttpHeaderNames.CONTENT_LENGTH, payload.length);
        return connection.channel().writeAndFlush(request);
    }
}
