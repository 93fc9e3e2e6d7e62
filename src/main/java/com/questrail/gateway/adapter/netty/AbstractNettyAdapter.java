package com.questrail.gateway.adapter.netty;

import com.questrail.gateway.adapter.Connection;
import com.questrail.gateway.adapter.ProtocolAdapter;
import com.questrail.gateway.adapter.SendFailedException;
import com.questrail.gateway.adapter.TransportException;
import com.questrail.gateway.adapter.TransportUnavailableException;
import com.questrail.gateway.config.TransportSettings;
import com.questrail.gateway.registry.Endpoint;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * AbstractNettyAdapter
 * =============================================================================
 * Shared client-side plumbing for the Netty adapters.
 *
 * <h2>What subclasses supply</h2>
 * <ul>
 *   <li>a per-connection attachment (handshake tracker, HTTP/2 stream handler)</li>
 *   <li>the channel pipeline, ending in a handler that copies each complete
 *       inbound message into the connection's {@link InboundQueue}</li>
 *   <li>how one payload is written (framing)</li>
 *   <li>optionally, a readiness wait after the TCP connect (WebSocket handshake)</li>
 * </ul>
 *
 * <h2>What this class guarantees</h2>
 * Deadlines on every blocking call, release of the channel when a connect or
 * readiness wait fails, idempotent {@link #disconnect(Connection)} that only logs.
 *
 * @param <A> per-connection attachment type
 */
abstract class AbstractNettyAdapter<A> implements ProtocolAdapter
{
    private static final Logger log = LoggerFactory.getLogger(AbstractNettyAdapter.class);

    private final AtomicLong connectionIds = new AtomicLong();

    protected final EventLoopGroup group;
    protected final TransportSettings settings;

    protected AbstractNettyAdapter(EventLoopGroup group, TransportSettings settings)
    {
        this.group = Objects.requireNonNull(group, "group");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    // -------------------------------------------------------------------------
    // Protocol hooks
    // -------------------------------------------------------------------------

    protected abstract A newAttachment(Endpoint target, InboundQueue inbound);

    protected abstract void initPipeline(ChannelPipeline pipeline, Endpoint target, InboundQueue inbound, A attachment);

    protected abstract ChannelFuture write(NettyConnection connection, A attachment, byte[] payload);

    protected Class<? extends Channel> channelType()
    {
        return NioSocketChannel.class;
    }

    protected void configure(Bootstrap bootstrap)
    {
        bootstrap.option(ChannelOption.TCP_NODELAY, true);
    }

    /**
     * Wait until the freshly connected channel can carry payloads.
     */
    protected void awaitReady(Channel channel, Endpoint target, A attachment, long remainingNanos)
            throws TransportUnavailableException
    {
        // Plain transports are ready as soon as connect completes.
    }

    // -------------------------------------------------------------------------
    // ProtocolAdapter
    // -------------------------------------------------------------------------

    @Override
    public final Connection connect(Endpoint target, Duration timeout) throws TransportUnavailableException
    {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(timeout, "timeout");
        if (target.protocol() != kind()) {
            throw new IllegalArgumentException(kind() + " adapter cannot connect to " + target.id());
        }

        final long deadline = System.nanoTime() + timeout.toNanos();
        final InboundQueue inbound = new InboundQueue();
        final A attachment = newAttachment(target, inbound);

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(channelType())
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.max(1, Math.min(Integer.MAX_VALUE, timeout.toMillis())))
                .handler(new ChannelInitializer<Channel>() {
                    @Override
                    protected void initChannel(Channel ch)
                    {
                        initPipeline(ch.pipeline(), target, inbound, attachment);
                    }
                });
        configure(bootstrap);

        ChannelFuture future = bootstrap.connect(target.socketAddress());
        if (!future.awaitUninterruptibly(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            future.cancel(false);
            future.channel().close();
            throw new TransportUnavailableException("Connect to " + target.id() + " timed out after " + timeout.toMillis() + "ms");
        }
        if (!future.isSuccess()) {
            future.channel().close();
            throw new TransportUnavailableException("Connect to " + target.id() + " failed", future.cause());
        }

        Channel channel = future.channel();
        try {
            awaitReady(channel, target, attachment, deadline - System.nanoTime());
        } catch (TransportUnavailableException e) {
            channel.close();
            throw e;
        }

        NettyConnection connection = new NettyConnection(
                kind().wireName() + "-" + connectionIds.incrementAndGet() + "-" + channel.id().asShortText(),
                kind(), target, channel, inbound, attachment);
        channel.closeFuture().addListener((ChannelFutureListener) f -> inbound.markClosed(null));

        log.debug("Connected {}", connection);
        return connection;
    }

    @Override
    public final void send(Connection connection, byte[] payload) throws SendFailedException
    {
        Objects.requireNonNull(payload, "payload");
        NettyConnection c = own(connection);
        if (!c.channel().isActive()) {
            throw new SendFailedException("Connection " + c.id() + " is closed");
        }
        if (payload.length > settings.maxFrameLength()) {
            throw new SendFailedException("Payload of " + payload.length + " bytes exceeds max frame length "
                    + settings.maxFrameLength());
        }

        ChannelFuture written = write(c, attachment(c), payload);
        if (!written.awaitUninterruptibly(settings.writeTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
            throw new SendFailedException("Write on " + c.id() + " timed out after "
                    + settings.writeTimeout().toMillis() + "ms");
        }
        if (!written.isSuccess()) {
            throw new SendFailedException("Write on " + c.id() + " failed", written.cause());
        }
    }

    @Override
    public final byte[] receive(Connection connection, Duration timeout) throws TransportException
    {
        Objects.requireNonNull(timeout, "timeout");
        NettyConnection c = own(connection);
        return c.inbound().take(timeout, c.id());
    }

    @Override
    public final int discardPending(Connection connection)
    {
        NettyConnection c = own(connection);
        int dropped = c.inbound().clear();
        if (dropped > 0) {
            log.debug("Discarded {} stale payload(s) on {}", dropped, c.id());
        }
        return dropped;
    }

    @Override
    public final void disconnect(Connection connection)
    {
        if (!(connection instanceof NettyConnection c) || c.protocol() != kind()) {
            log.warn("Ignoring disconnect of foreign connection {}", connection);
            return;
        }
        Channel channel = c.channel();
        if (!channel.isOpen()) {
            c.inbound().markClosed(null);
            return;
        }

        ChannelFuture closed = channel.close();
        if (!closed.awaitUninterruptibly(settings.writeTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
            log.warn("Close of {} did not complete within {}ms", c.id(), settings.writeTimeout().toMillis());
        } else if (!closed.isSuccess()) {
            log.warn("Close of {} failed", c.id(), closed.cause());
        }
        c.inbound().markClosed(null);
    }

    @Override
    public final boolean isConnected(Connection connection)
    {
        return connection instanceof NettyConnection c
                && c.protocol() == kind()
                && c.channel().isActive()
                && !c.inbound().isClosed();
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private NettyConnection own(Connection connection)
    {
        Objects.requireNonNull(connection, "connection");
        if (!(connection instanceof NettyConnection c) || c.protocol() != kind()) {
            throw new IllegalArgumentException(kind() + " adapter does not own " + connection);
        }
        return c;
    }

    @SuppressWarnings("unchecked")
    private A attachment(NettyConnection connection)
    {
        return (A) connection.attachment();
    }
}
