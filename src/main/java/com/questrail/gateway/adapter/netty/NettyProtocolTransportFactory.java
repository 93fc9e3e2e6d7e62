package com.questrail.gateway.adapter.netty;

import com.questrail.gateway.adapter.ProtocolAdapter;
import com.questrail.gateway.adapter.ProtocolListener;
import com.questrail.gateway.adapter.ProtocolTransportFactory;
import com.questrail.gateway.api.ProtocolKind;
import com.questrail.gateway.config.TransportSettings;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.util.concurrent.DefaultThreadFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * NettyProtocolTransportFactory
 * =============================================================================
 * Production transport wiring: one Netty adapter and listener implementation
 * per {@link ProtocolKind}, chosen here and nowhere else.
 *
 * <h2>Resources</h2>
 * The factory owns three event loop groups (client I/O, server accept, server
 * I/O) and the cached pool that runs the gateway's inbound handler. All threads
 * are daemons. {@link #close()} shuts every one of them down; adapters and
 * listeners obtained from a closed factory are unusable.
 */
public final class NettyProtocolTransportFactory implements ProtocolTransportFactory
{
    private static final Logger log = LoggerFactory.getLogger(NettyProtocolTransportFactory.class);

    private final TransportSettings settings;
    private final EventLoopGroup clientGroup;
    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ExecutorService handlerPool;
    private final Map<ProtocolKind, ProtocolAdapter> adapters = new EnumMap<>(ProtocolKind.class);

    public NettyProtocolTransportFactory(TransportSettings settings)
    {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clientGroup = new NioEventLoopGroup(settings.ioThreads(), new DefaultThreadFactory("gateway-client", true));
        this.bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("gateway-accept", true));
        this.workerGroup = new NioEventLoopGroup(settings.ioThreads(), new DefaultThreadFactory("gateway-io", true));
        this.handlerPool = Executors.newCachedThreadPool(new DefaultThreadFactory("gateway-handler", true));

        adapters.put(ProtocolKind.HTTP, new NettyHttpAdapter(clientGroup, settings));
        adapters.put(ProtocolKind.HTTP2, new NettyHttp2Adapter(clientGroup, settings));
        adapters.put(ProtocolKind.WEBSOCKET, new NettyWebSocketAdapter(clientGroup, settings));
        adapters.put(ProtocolKind.TCP, new NettyTcpAdapter(clientGroup, settings));
        adapters.put(ProtocolKind.UDP, new NettyUdpAdapter(clientGroup, settings));
    }

    @Override
    public Set<ProtocolKind> supportedProtocols()
    {
        return Collections.unmodifiableSet(EnumSet.copyOf(adapters.keySet()));
    }

    @Override
    public ProtocolAdapter adapter(ProtocolKind kind)
    {
        ProtocolAdapter adapter = adapters.get(Objects.requireNonNull(kind, "kind"));
        if (adapter == null) {
            throw new IllegalArgumentException("Unsupported protocol: " + kind);
        }
        return adapter;
    }

    @Override
    public ProtocolListener newListener(ProtocolKind kind)
    {
        return switch (Objects.requireNonNull(kind, "kind")) {
            case HTTP -> new NettyHttpListener(bossGroup, workerGroup, handlerPool, settings);
            case HTTP2 -> new NettyHttp2Listener(bossGroup, workerGroup, handlerPool, settings);
            case WEBSOCKET -> new NettyWebSocketListener(bossGroup, workerGroup, handlerPool, settings);
            case TCP -> new NettyTcpListener(bossGroup, workerGroup, handlerPool, settings);
            case UDP -> new NettyUdpListener(bossGroup, workerGroup, handlerPool, settings);
        };
    }

    @Override
    public void close()
    {
        clientGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        handlerPool.shutdown();

        clientGroup.terminationFuture().awaitUninterruptibly(5, TimeUnit.SECONDS);
        bossGroup.terminationFuture().awaitUninterruptibly(5, TimeUnit.SECONDS);
        workerGroup.terminationFuture().awaitUninterruptibly(5, TimeUnit.SECONDS);
        log.debug("Netty transports closed");
    }
}
