package com.questrail.gateway.adapter.netty;

import com.questrail.gateway.adapter.InboundReply;
import com.questrail.gateway.api.Message;
import com.questrail.gateway.api.ProtocolKind;
import com.questrail.gateway.config.TransportSettings;

import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * WebSocket listener on {@link TransportSettings#webSocketPath()}.
 *
 * <p>Headers of the upgrade request (including any session header) are attached
 * to every message received on that connection. Each complete data message is
 * one {@link Message}; the reply goes back as a frame of the same type.</p>
 */
final class NettyWebSocketListener extends AbstractNettyListener
{
    private static final int HANDSHAKE_AGGREGATE_BYTES = 65536;

    NettyWebSocketListener(EventLoopGroup bossGroup, EventLoopGroup workerGroup, Executor handlerPool,
                           TransportSettings settings)
    {
        super(bossGroup, workerGroup, handlerPool, settings);
    }

    @Override
    public ProtocolKind kind()
    {
        return ProtocolKind.WEBSOCKET;
    }

    @Override
    protected void initChildPipeline(ChannelPipeline pipeline, SerialExecutor serial)
    {
        pipeline.addLast("http-codec", new HttpServerCodec());
        pipeline.addLast("http-aggregator", new HttpObjectAggregator(HANDSHAKE_AGGREGATE_BYTES));
        pipeline.addLast("ws-protocol", new WebSocketServerProtocolHandler(
                settings.webSocketPath(), null, true, settings.maxFrameLength()));
        pipeline.addLast("ws-aggregator", new WebSocketFrameAggregator(settings.maxFrameLength()));
        pipeline.addLast("handler", new ListenerInboundHandler<WebSocketFrame>(WebSocketFrame.class, serial) {
            private final Map<String, String> upgradeHeaders = new HashMap<>();

            @Override
            public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception
            {
                if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete handshake) {
                    for (Map.Entry<String, String> header : handshake.requestHeaders()) {
                        upgradeHeaders.put(header.getKey(), header.getValue());
                    }
                }
                super.userEventTriggered(ctx, evt);
            }

            @Override
            protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame)
            {
                boolean text = frame instanceof TextWebSocketFrame;
                if (!text && !(frame instanceof BinaryWebSocketFrame)) {
                    return;
                }
                Message message = Message.builder(ProtocolKind.WEBSOCKET)
                        .connectionId(connectionId(ctx.channel()))
                        .payload(ByteBufUtil.getBytes(frame.content()))
                        .headers(upgradeHeaders)
                        .remoteAddress(ctx.channel().remoteAddress())
                        .build();
                dispatch(serial, message, reply -> {
                    if (reply.status() == InboundReply.Status.NONE) {
                        return;
                    }
                    byte[] bytes = reply.wirePayload();
                    ctx.writeAndFlush(text
                            ? new TextWebSocketFrame(new String(bytes, StandardCharsets.UTF_8))
                            : new BinaryWebSocketFrame(Unpooled.wrappedBuffer(bytes)));
                });
            }
        });
    }
}
