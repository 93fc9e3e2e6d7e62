package com.questrail.gateway.adapter;

import com.questrail.gateway.api.ProtocolKind;

import java.util.Set;

/**
 * Selects the concrete adapter and listener for each {@link ProtocolKind}.
 *
 * <p>The choice is made once, at construction time; nothing downstream inspects
 * runtime types to find out which protocol it is talking to.</p>
 */
public interface ProtocolTransportFactory extends AutoCloseable
{
    Set<ProtocolKind> supportedProtocols();

    /**
     * Shared, thread-safe adapter for {@code kind}.
     *
     * @throws IllegalArgumentException if {@code kind} is not supported
     */
    ProtocolAdapter adapter(ProtocolKind kind);

    /**
     * A new, unstarted listener for {@code kind}.
     *
     * @throws IllegalArgumentException if {@code kind} is not supported
     */
    ProtocolListener newListener(ProtocolKind kind);

    /**
     * Release transport resources (event loops, worker pools).
     */
    @Override
    void close();
}
