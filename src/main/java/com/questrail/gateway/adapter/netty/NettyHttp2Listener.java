package com.questrail.gateway.adapter.netty;

import com.questrail.gateway.adapter.InboundReply;
import com.questrail.gateway.api.Message;
import com.questrail.gateway.api.ProtocolKind;
import com.questrail.gateway.config.TransportSettings;

import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelDuplexHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.handler.codec.http2.DefaultHttp2DataFrame;
import io.netty.handler.codec.http2.DefaultHttp2Headers;
import io.netty.handler.codec.http2.DefaultHttp2HeadersFrame;
import io.netty.handler.codec.http2.DefaultHttp2WindowUpdateFrame;
import io.netty.handler.codec.http2.Http2DataFrame;
import io.netty.handler.codec.http2.Http2FrameCodecBuilder;
import io.netty.handler.codec.http2.Http2FrameStream;
import io.netty.handler.codec.http2.Http2Headers;
import io.netty.handler.codec.http2.Http2HeadersFrame;
import io.netty.handler.codec.http2.Http2ResetFrame;
import io.netty.util.ReferenceCountUtil;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * HTTP/2 cleartext listener (prior knowledge).
 *
 * <p>Each request stream is one message: regular headers become message
 * headers (pseudo-headers are dropped) and the reassembled DATA frames become
 * the payload. The reply is sent on the same stream with {@code :status} 200,
 * 502 or 204, mirroring the HTTP/1.1 listener.</p>
 */
final class NettyHttp2Listener extends AbstractNettyListener
{
    private static final Logger log = LoggerFactory.getLogger(NettyHttp2Listener.class);

    NettyHttp2Listener(EventLoopGroup bossGroup, EventLoopGroup workerGroup, Executor handlerPool,
                       TransportSettings settings)
    {
        super(bossGroup, workerGroup, handlerPool, settings);
    }

    @Override
    public ProtocolKind kind()
    {
        return ProtocolKind.HTTP2;
    }

    @Override
    protected void initChildPipeline(ChannelPipeline pipeline, SerialExecutor serial)
    {
        pipeline.addLast("h2-codec", Http2FrameCodecBuilder.forServer().build());
        pipeline.addLast("h2-requests", new RequestStreamHandler(serial));
    }

    private static final class PendingRequest
    {
        final Map<String, String> headers = new HashMap<>();
        final ByteArrayOutputStream body = new ByteArrayOutputStream();
    }

    private final class RequestStreamHandler extends ChannelDuplexHandler
    {
        private final SerialExecutor serial;
        private final Map<Integer, PendingRequest> pending = new HashMap<>();

        RequestStreamHandler(SerialExecutor serial)
        {
            this.serial = serial;
        }

        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg)
        {
            try {
                if (msg instanceof Http2HeadersFrame frame) {
                    PendingRequest request = pending.computeIfAbsent(frame.stream().id(), k -> new PendingRequest());
                    for (Map.Entry<CharSequence, CharSequence> header : frame.headers()) {
                        String name = header.getKey().toString();
                        if (!name.startsWith(":")) {
                            request.headers.put(name, header.getValue().toString());
                        }
                    }
                    if (frame.isEndStream()) {
                        complete(ctx, frame.stream());
                    }
                } else if (msg instanceof Http2DataFrame data) {
                    PendingRequest request = pending.computeIfAbsent(data.stream().id(), k -> new PendingRequest());
                    data.content().readBytes(request.body, data.content().readableBytes());
                    if (data.initialFlowControlledBytes() > 0) {
                        ctx.writeAndFlush(new DefaultHttp2WindowUpdateFrame(data.initialFlowControlledBytes())
                                .stream(data.stream()));
                    }
                    if (data.isEndStream()) {
                        complete(ctx, data.stream());
                    }
                } else if (msg instanceof Http2ResetFrame reset) {
                    pending.remove(reset.stream().id());
                }
            } catch (IOException e) {
                exceptionCaught(ctx, e);
            } finally {
                ReferenceCountUtil.release(msg);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.debug("Closing HTTP/2 connection {} after failure", ctx.channel(), cause);
            ctx.close();
        }

        private void complete(ChannelHandlerContext ctx, Http2FrameStream stream)
        {
            PendingRequest request = pending.remove(stream.id());
            Message message = Message.builder(ProtocolKind.HTTP2)
                    .connectionId(connectionId(ctx.channel()))
                    .payload(request.body.toByteArray())
                    .headers(request.headers)
                    .remoteAddress(ctx.channel().remoteAddress())
                    .build();
            dispatch(serial, message, reply -> respond(ctx, stream, reply));
        }

        private void respond(ChannelHandlerContext ctx, Http2FrameStream stream, InboundReply reply)
        {
            String status = switch (reply.status()) {
                case OK -> "200";
                case FAILED -> "502";
                case NONE -> "204";
            };
            byte[] body = reply.payload();
            Http2Headers headers = new DefaultHttp2Headers()
                    .status(status)
                    .set("content-type", "application/octet-stream")
                    .setInt("content-length", body.length);
            if (body.length == 0) {
                ctx.writeAndFlush(new DefaultHttp2HeadersFrame(headers, true).stream(stream));
                return;
            }
            ctx.write(new DefaultHttp2HeadersFrame(headers).stream(stream));
            ctx.writeAndFlush(new DefaultHttp2DataFrame(Unpooled.wrappedBuffer(body), true).stream(stream));
        }
    }
}
