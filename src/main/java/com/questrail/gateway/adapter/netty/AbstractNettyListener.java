package com.questrail.gateway.adapter.netty;

import com.questrail.gateway.adapter.InboundMessageHandler;
import com.questrail.gateway.adapter.InboundReply;
import com.questrail.gateway.adapter.ProtocolListener;
import com.questrail.gateway.adapter.TransportUnavailableException;
import com.questrail.gateway.api.Message;
import com.questrail.gateway.config.TransportSettings;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.GlobalEventExecutor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * AbstractNettyListener
 * =============================================================================
 * Server-side plumbing shared by the Netty listeners.
 *
 * <h2>Threading</h2>
 * The accept loop runs on the boss group, socket I/O on the worker group.
 * Neither ever runs the gateway's handler: every decoded {@link Message} is
 * handed to the accepted connection's {@link SerialExecutor}, which runs on the
 * shared handler pool. A slow or blocking handler therefore holds one pool
 * thread and delays only its own connection.
 *
 * <h2>Lifecycle</h2>
 * {@link #start} binds synchronously within the configured connect timeout.
 * {@link #stop} closes the server channel and every accepted channel; the event
 * loop groups belong to the transport factory and are not shut down here.
 */
abstract class AbstractNettyListener implements ProtocolListener
{
    private static final Logger log = LoggerFactory.getLogger(AbstractNettyListener.class);

    protected final EventLoopGroup bossGroup;
    protected final EventLoopGroup workerGroup;
    protected final Executor handlerPool;
    protected final TransportSettings settings;

    private final ChannelGroup accepted = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);

    private volatile Channel serverChannel;
    private volatile InboundMessageHandler handler;

    protected AbstractNettyListener(EventLoopGroup bossGroup,
                                    EventLoopGroup workerGroup,
                                    Executor handlerPool,
                                    TransportSettings settings)
    {
        this.bossGroup = Objects.requireNonNull(bossGroup, "bossGroup");
        this.workerGroup = Objects.requireNonNull(workerGroup, "workerGroup");
        this.handlerPool = Objects.requireNonNull(handlerPool, "handlerPool");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * Install the protocol codecs and the message handler on an accepted channel.
     */
    protected abstract void initChildPipeline(ChannelPipeline pipeline, SerialExecutor serial);

    /**
     * Bind the server channel. Connection-oriented listeners use the default
     * {@link ServerBootstrap}; datagram listeners override.
     */
    protected ChannelFuture bind(InetSocketAddress bindAddress)
    {
        return new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<Channel>() {
                    @Override
                    protected void initChannel(Channel ch)
                    {
                        accepted.add(ch);
                        initChildPipeline(ch.pipeline(), new SerialExecutor(handlerPool));
                    }
                })
                .bind(bindAddress);
    }

    @Override
    public final synchronized InetSocketAddress start(InetSocketAddress bindAddress, InboundMessageHandler handler)
            throws TransportUnavailableException
    {
        Objects.requireNonNull(bindAddress, "bindAddress");
        Objects.requireNonNull(handler, "handler");
        if (isRunning()) {
            throw new IllegalStateException(kind() + " listener already running on " + serverChannel.localAddress());
        }

        this.handler = handler;
        ChannelFuture bound = bind(bindAddress);
        long timeoutMillis = settings.connectTimeout().toMillis();
        if (!bound.awaitUninterruptibly(timeoutMillis, TimeUnit.MILLISECONDS)) {
            bound.channel().close();
            throw new TransportUnavailableException("Bind of " + kind() + " listener to " + bindAddress
                    + " timed out after " + timeoutMillis + "ms");
        }
        if (!bound.isSuccess()) {
            throw new TransportUnavailableException("Bind of " + kind() + " listener to " + bindAddress + " failed",
                    bound.cause());
        }

        serverChannel = bound.channel();
        InetSocketAddress local = (InetSocketAddress) serverChannel.localAddress();
        log.info("{} listener bound to {}", kind(), local);
        return local;
    }

    @Override
    public final synchronized void stop()
    {
        Channel ch = serverChannel;
        serverChannel = null;
        if (ch == null) {
            return;
        }
        ch.close().awaitUninterruptibly(settings.writeTimeout().toMillis(), TimeUnit.MILLISECONDS);
        accepted.close().awaitUninterruptibly(settings.writeTimeout().toMillis(), TimeUnit.MILLISECONDS);
        log.info("{} listener on {} stopped", kind(), ch.localAddress());
    }

    @Override
    public final boolean isRunning()
    {
        Channel ch = serverChannel;
        return ch != null && ch.isActive();
    }

    @Override
    public final Optional<InetSocketAddress> boundAddress()
    {
        Channel ch = serverChannel;
        return ch == null ? Optional.empty() : Optional.of((InetSocketAddress) ch.localAddress());
    }

    // -------------------------------------------------------------------------
    // Dispatch
    // -------------------------------------------------------------------------

    protected final String connectionId(Channel channel)
    {
        return kind().wireName() + "-in-" + channel.id().asShortText();
    }

    /**
     * Run the gateway handler for {@code message} on {@code executor} and pass
     * its reply to {@code replyWriter}. A handler that throws is answered with a
     * failed reply; the connection stays up.
     */
    protected final void dispatch(Executor executor, Message message, Consumer<InboundReply> replyWriter)
    {
        executor.execute(() -> {
            InboundReply reply;
            try {
                InboundMessageHandler h = handler;
                reply = h == null ? InboundReply.failed("listener stopped") : h.onMessage(message);
                if (reply == null) {
                    reply = InboundReply.none();
                }
            } catch (RuntimeException e) {
                log.warn("Handler failed for {}", message, e);
                reply = InboundReply.failed("handler failed");
            }
            replyWriter.accept(reply);
        });
    }
}
