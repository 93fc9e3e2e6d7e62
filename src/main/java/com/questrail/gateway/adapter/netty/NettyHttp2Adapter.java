package com.questrail.gateway.adapter.netty;

import com.questrail.gateway.api.ProtocolKind;
import com.questrail.gateway.config.TransportSettings;
import com.questrail.gateway.registry.Endpoint;

import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.ChannelPromise;
import io.netty.channel.EventLoopGroup;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpScheme;
import io.netty.handler.codec.http2.DefaultHttp2DataFrame;
import io.netty.handler.codec.http2.DefaultHttp2Headers;
import io.netty.handler.codec.http2.DefaultHttp2HeadersFrame;
import io.netty.handler.codec.http2.DefaultHttp2WindowUpdateFrame;
import io.netty.handler.codec.http2.Http2ChannelDuplexHandler;
import io.netty.handler.codec.http2.Http2DataFrame;
import io.netty.handler.codec.http2.Http2FrameCodecBuilder;
import io.netty.handler.codec.http2.Http2FrameStream;
import io.netty.handler.codec.http2.Http2Headers;
import io.netty.handler.codec.http2.Http2HeadersFrame;
import io.netty.handler.codec.http2.Http2ResetFrame;
import io.netty.util.ReferenceCountUtil;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * HTTP/2 cleartext adapter (prior knowledge, no upgrade).
 *
 * <p>Each {@code send} opens a new stream carrying one {@code POST}; the DATA
 * frames of each response stream are reassembled and handed to
 * {@code receive} as a single payload once the peer ends the stream.</p>
 */
final class NettyHttp2Adapter extends AbstractNettyAdapter<NettyHttp2Adapter.StreamHandler>
{
    NettyHttp2Adapter(EventLoopGroup group, TransportSettings settings)
    {
        super(group, settings);
    }

    @Override
    public ProtocolKind kind()
    {
        return ProtocolKind.HTTP2;
    }

    @Override
    protected StreamHandler newAttachment(Endpoint target, InboundQueue inbound)
    {
        return new StreamHandler(target.address() + ":" + target.port(), settings.httpPath(), inbound);
    }

    @Override
    protected void initPipeline(ChannelPipeline pipeline, Endpoint target, InboundQueue inbound, StreamHandler handler)
    {
        pipeline.addLast("h2-codec", Http2FrameCodecBuilder.forClient().build());
        pipeline.addLast("h2-streams", handler);
    }

    @Override
    protected ChannelFuture write(NettyConnection connection, StreamHandler handler, byte[] payload)
    {
        return handler.post(payload);
    }

    /**
     * Opens request streams and reassembles response streams. All state is
     * confined to the channel's event loop.
     */
    static final class StreamHandler extends Http2ChannelDuplexHandler
    {
        private final String authority;
        private final String path;
        private final InboundQueue inbound;
        private final Map<Integer, ByteArrayOutputStream> responses = new HashMap<>();
        private volatile ChannelHandlerContext ctx;

        StreamHandler(String authority, String path, InboundQueue inbound)
        {
            this.authority = authority;
            this.path = path;
            this.inbound = inbound;
        }

        @Override
        protected void handlerAdded0(ChannelHandlerContext ctx)
        {
            this.ctx = ctx;
        }

        ChannelFuture post(byte[] payload)
        {
            ChannelPromise promise = ctx.newPromise();
            ctx.executor().execute(() -> {
                Http2FrameStream stream = newStream();
                Http2Headers headers = new DefaultHttp2Headers()
                        .method(HttpMethod.POST.asciiName())
                        .scheme(HttpScheme.HTTP.name())
                        .path(path)
                        .authority(authority)
                        .set("content-type", HttpHeaderValues.APPLICATION_OCTET_STREAM)
                        .setInt("content-length", payload.length);
                ctx.write(new DefaultHttp2HeadersFrame(headers).stream(stream));
                ctx.writeAndFlush(new DefaultHttp2DataFrame(Unpooled.wrappedBuffer(payload), true).stream(stream), promise);
            });
            return promise;
        }

        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg)
        {
            try {
                if (msg instanceof Http2HeadersFrame headers) {
                    int id = headers.stream().id();
                    responses.putIfAbsent(id, new ByteArrayOutputStream());
                    if (headers.isEndStream()) {
                        inbound.offer(responses.remove(id).toByteArray());
                    }
                } else if (msg instanceof Http2DataFrame data) {
                    int id = data.stream().id();
                    ByteArrayOutputStream body = responses.computeIfAbsent(id, k -> new ByteArrayOutputStream());
                    data.content().readBytes(body, data.content().readableBytes());
                    if (data.initialFlowControlledBytes() > 0) {
                        ctx.writeAndFlush(new DefaultHttp2WindowUpdateFrame(data.initialFlowControlledBytes())
                                .stream(data.stream()));
                    }
                    if (data.isEndStream()) {
                        inbound.offer(responses.remove(id).toByteArray());
                    }
                } else if (msg instanceof Http2ResetFrame reset) {
                    responses.remove(reset.stream().id());
                    inbound.markClosed(new IOException("Stream " + reset.stream().id()
                            + " reset with error code " + reset.errorCode()));
                    ctx.close();
                }
            } catch (IOException e) {
                exceptionCaught(ctx, e);
            } finally {
                ReferenceCountUtil.release(msg);
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
            inbound.markClosed(cause);
            ctx.close();
        }
    }
}
