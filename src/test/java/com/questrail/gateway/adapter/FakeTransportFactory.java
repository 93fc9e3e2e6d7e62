package com.questrail.gateway.adapter;

import com.questrail.gateway.api.Message;
import com.questrail.gateway.api.ProtocolKind;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory {@link ProtocolTransportFactory}: one {@link FakeProtocolAdapter}
 * per protocol and listeners that never touch the network. Tests push inbound
 * messages through {@link FakeListener#deliver}.
 */
public final class FakeTransportFactory implements ProtocolTransportFactory {

    public static final class FakeListener implements ProtocolListener {
        private final ProtocolKind kind;
        private volatile InboundMessageHandler handler;
        private volatile InetSocketAddress bound;

        private FakeListener(ProtocolKind kind) {
            this.kind = kind;
        }

        @Override
        public ProtocolKind kind() {
            return kind;
        }

        @Override
        public InetSocketAddress start(InetSocketAddress bindAddress, InboundMessageHandler handler)
                throws TransportUnavailableException {
            if (bindAddress.getPort() == BUSY_PORT) {
                throw new TransportUnavailableException("port " + BUSY_PORT + " in use");
            }
            this.handler = Objects.requireNonNull(handler, "handler");
            this.bound = bindAddress.getPort() == 0
                    ? new InetSocketAddress(bindAddress.getAddress(), 40000 + kind.ordinal())
                    : bindAddress;
            return bound;
        }

        @Override
        public void stop() {
            handler = null;
        }

        @Override
        public boolean isRunning() {
            return handler != null;
        }

        @Override
        public Optional<InetSocketAddress> boundAddress() {
            return Optional.ofNullable(bound);
        }

        public InboundReply deliver(Message message) {
            InboundMessageHandler h = handler;
            if (h == null) {
                throw new IllegalStateException(kind + " listener is not running");
            }
            return h.onMessage(message);
        }
    }

    /** Binding to this port always fails. */
    public static final int BUSY_PORT = 1;

    private final Map<ProtocolKind, FakeProtocolAdapter> adapters = new EnumMap<>(ProtocolKind.class);
    private final List<FakeListener> listeners = Collections.synchronizedList(new ArrayList<>());
    private volatile boolean closed;

    public FakeTransportFactory() {
        for (ProtocolKind kind : ProtocolKind.values()) {
            adapters.put(kind, new FakeProtocolAdapter(kind));
        }
    }

    @Override
    public Set<ProtocolKind> supportedProtocols() {
        return Collections.unmodifiableSet(adapters.keySet());
    }

    @Override
    public FakeProtocolAdapter adapter(ProtocolKind kind) {
        return adapters.get(kind);
    }

    @Override
    public FakeListener newListener(ProtocolKind kind) {
        FakeListener listener = new FakeListener(kind);
        listeners.add(listener);
        return listener;
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * The most recently created listener for {@code kind}.
     */
    public FakeListener listener(ProtocolKind kind) {
        synchronized (listeners) {
            for (int i = listeners.size() - 1; i >= 0; i--) {
                if (listeners.get(i).kind() == kind) {
                    return listeners.get(i);
                }
            }
        }
        throw new IllegalStateException("No " + kind + " listener");
    }

    public int listenersCreated() {
        return listeners.size();
    }
}
