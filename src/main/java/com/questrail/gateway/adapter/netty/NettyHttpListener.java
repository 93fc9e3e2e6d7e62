package com.questrail.gateway.adapter.netty;

import com.questrail.gateway.adapter.InboundReply;
import com.questrail.gateway.api.Message;
import com.questrail.gateway.api.ProtocolKind;
import com.questrail.gateway.config.TransportSettings;

import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;

import java.util.Map;
import java.util.concurrent.Executor;

/**
 * HTTP/1.1 listener.
 *
 * <p>The request body is the message payload; request headers become message
 * headers. Replies map to {@code 200 OK}, {@code 502 Bad Gateway} (failed, the
 * reason as body) or {@code 204 No Content}. Keep-alive is honoured.</p>
 */
final class NettyHttpListener extends AbstractNettyListener
{
    NettyHttpListener(EventLoopGroup bossGroup, EventLoopGroup workerGroup, Executor handlerPool,
                      TransportSettings settings)
    {
        super(bossGroup, workerGroup, handlerPool, settings);
    }

    @Override
    public ProtocolKind kind()
    {
        return ProtocolKind.HTTP;
    }

    @Override
    protected void initChildPipeline(ChannelPipeline pipeline, SerialExecutor serial)
    {
        pipeline.addLast("http-codec", new HttpServerCodec());
        pipeline.addLast("http-aggregator", new HttpObjectAggregator(settings.maxFrameLength()));
        pipeline.addLast("handler", new ListenerInboundHandler<FullHttpRequest>(FullHttpRequest.class, serial) {
            @Override
            protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request)
            {
                Message.Builder builder = Message.builder(ProtocolKind.HTTP)
                        .connectionId(connectionId(ctx.channel()))
                        .payload(ByteBufUtil.getBytes(request.content()))
                        .remoteAddress(ctx.channel().remoteAddress());
                for (Map.Entry<String, String> header : request.headers()) {
                    builder.header(header.getKey(), header.getValue());
                }
                boolean keepAlive = HttpUtil.isKeepAlive(request);

                dispatch(serial, builder.build(), reply -> {
                    FullHttpResponse response = toResponse(reply);
                    if (keepAlive) {
                        response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
                        ctx.writeAndFlush(response);
                    } else {
                        ChannelFuture written = ctx.writeAndFlush(response);
                        written.addListener(ChannelFutureListener.CLOSE);
                    }
                });
            }
        });
    }

    static FullHttpResponse toResponse(InboundReply reply)
    {
        HttpResponseStatus status = switch (reply.status()) {
            case OK -> HttpResponseStatus.OK;
            case FAILED -> HttpResponseStatus.BAD_GATEWAY;
            case NONE -> HttpResponseStatus.NO_CONTENT;
        };
        byte[] body = reply.payload();
        FullHttpResponse response = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1, status, Unpooled.wrappedBuffer(body));
        response.headers()
                .set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_OCTET_STREAM)
                .setInt(HttpHeaderNames.CONTENT_LENGTH, body.length);
        return response;
    }
}
