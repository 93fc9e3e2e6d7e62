package com.questrail.gateway.adapter.netty;

import com.questrail.gateway.adapter.TransportUnavailableException;
import com.questrail.gateway.api.ProtocolKind;
import com.questrail.gateway.config.TransportSettings;
import com.questrail.gateway.registry.Endpoint;

import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;

import java.net.URI;
import java.nio.channels.ClosedChannelException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * NettyWebSocketAdapter
 * -----------------------------------------------------------------------------
 * WebSocket client adapter. One payload is one binary message; fragmented
 * messages from the peer are aggregated before they reach {@code receive}, so
 * message boundaries survive the transport.
 *
 * <p>{@code connect} returns only after the opening handshake has completed,
 * within the same deadline as the TCP connect.</p>
 */
final class NettyWebSocketAdapter extends AbstractNettyAdapter<CompletableFuture<Void>>
{
    private static final int HANDSHAKE_AGGREGATE_BYTES = 8192;

    NettyWebSocketAdapter(EventLoopGroup group, TransportSettings settings)
    {
        super(group, settings);
    }

    @Override
    public ProtocolKind kind()
    {
        return ProtocolKind.WEBSOCKET;
    }

    @Override
    protected CompletableFuture<Void> newAttachment(Endpoint target, InboundQueue inbound)
    {
        return new CompletableFuture<>();
    }

    @Override
    protected void initPipeline(ChannelPipeline pipeline, Endpoint target, InboundQueue inbound,
                                CompletableFuture<Void> handshake)
    {
        URI uri = URI.create("ws://" + target.address() + ":" + target.port() + settings.webSocketPath());

        pipeline.addLast("http-codec", new HttpClientCodec());
        pipeline.addLast("http-aggregator", new HttpObjectAggregator(HANDSHAKE_AGGREGATE_BYTES));
        pipeline.addLast("ws-protocol", new WebSocketClientProtocolHandler(
                WebSocketClientHandshakerFactory.newHandshaker(
                        uri, WebSocketVersion.V13, null, true, new DefaultHttpHeaders(), settings.maxFrameLength()),
                settings.connectTimeout().toMillis()));
        pipeline.addLast("ws-aggregator", new WebSocketFrameAggregator(settings.maxFrameLength()));
        pipeline.addLast("inbound", new QueueingInboundHandler<WebSocketFrame>(WebSocketFrame.class, inbound) {
            @Override
            protected byte[] payloadOf(WebSocketFrame frame)
            {
                if (frame instanceof BinaryWebSocketFrame || frame instanceof TextWebSocketFrame) {
                    return ByteBufUtil.getBytes(frame.content());
                }
                return null;
            }

            @Override
            public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception
            {
                if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_COMPLETE) {
                    handshake.complete(null);
                } else if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_TIMEOUT) {
                    handshake.completeExceptionally(new TimeoutException("WebSocket handshake timed out"));
                }
                super.userEventTriggered(ctx, evt);
            }

            @Override
            public void channelInactive(ChannelHandlerContext ctx) throws Exception
            {
                handshake.completeExceptionally(new ClosedChannelException());
                super.channelInactive(ctx);
            }

            @Override
            public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
            {
                handshake.completeExceptionally(cause);
                super.exceptionCaught(ctx, cause);
            }
        });
    }

    @Override
    protected void awaitReady(Channel channel, Endpoint target, CompletableFuture<Void> handshake, long remainingNanos)
            throws TransportUnavailableException
    {
        try {
            handshake.get(Math.max(0, remainingNanos), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            throw new TransportUnavailableException("WebSocket handshake with " + target.id() + " timed out", e);
        } catch (ExecutionException e) {
            throw new TransportUnavailableException("WebSocket handshake with " + target.id() + " failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportUnavailableException("Interrupted during WebSocket handshake with " + target.id(), e);
        }
    }

    @Override
    protected ChannelFuture write(NettyConnection connection, CompletableFuture<Void> handshake, byte[] payload)
    {
        return connection.channel().writeAndFlush(new BinaryWebSocketFrame(Unpooled.wrappedBuffer(payload)));
    }
}
