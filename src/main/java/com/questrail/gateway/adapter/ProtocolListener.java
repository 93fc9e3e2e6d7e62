package com.questrail.gateway.adapter;

import com.questrail.gateway.api.ProtocolKind;

import java.net.InetSocketAddress;
import java.util.Optional;

/**
 * Server-side half of a protocol: binds, accepts, normalizes inbound traffic
 * into {@link com.questrail.gateway.api.Message}s and writes replies back with
 * the protocol's own framing.
 *
 * <p>Each listener runs its own accept loop; each accepted connection is served
 * by its own serial worker so that a slow client cannot hold up others.</p>
 */
public interface ProtocolListener
{
    ProtocolKind kind();

    /**
     * Bind and start accepting.
     *
     * @param bindAddress local address; port 0 picks an ephemeral port
     * @param handler     receives every decoded inbound message
     * @return the address actually bound
     * @throws TransportUnavailableException if the bind fails
     */
    InetSocketAddress start(InetSocketAddress bindAddress, InboundMessageHandler handler)
            throws TransportUnavailableException;

    /**
     * Stop accepting and close every accepted connection. Idempotent.
     */
    void stop();

    boolean isRunning();

    Optional<InetSocketAddress> boundAddress();
}
