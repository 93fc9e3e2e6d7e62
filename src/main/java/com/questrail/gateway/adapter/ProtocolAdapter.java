package com.questrail.gateway.adapter;

import com.questrail.gateway.api.ProtocolKind;
import com.questrail.gateway.registry.Endpoint;

import java.time.Duration;

/**
 * ProtocolAdapter
 * =============================================================================
 * Uniform client-side transport contract, implemented once per {@link ProtocolKind}.
 *
 * <h2>Framing</h2>
 * Each implementation owns its framing (length prefixes for TCP, WebSocket
 * frame boundaries, HTTP message bodies, HTTP/2 streams, datagrams). Callers
 * only ever see whole payloads: one {@link #send} produces exactly one
 * message on the peer, one {@link #receive} yields exactly one message.
 *
 * <h2>Deadlines</h2>
 * No operation blocks indefinitely. {@code connect} and {@code receive} take
 * an explicit timeout; {@code send} is bounded by the adapter's configured
 * write timeout. On expiry any partially acquired socket is released.
 *
 * <h2>Thread safety</h2>
 * Adapters are shared by all sessions and must be safe for concurrent use.
 * A single connection is used by one exchange at a time (the session layer
 * serializes exchanges).
 *
 * <h2>Late replies</h2>
 * A reply that arrives after its {@code receive} timed out stays buffered on
 * the connection. Callers drop it with {@link #discardPending} before the next
 * request so it is never returned as the answer to a different one.
 */
public interface ProtocolAdapter
{
    ProtocolKind kind();

    /**
     * Establish a transport-level connection. For connectionless protocols this
     * only validates that the target is addressable.
     *
     * @throws TransportUnavailableException if the endpoint cannot be reached in time
     */
    Connection connect(Endpoint target, Duration timeout) throws TransportUnavailableException;

    /**
     * Send one framed payload.
     *
     * @throws SendFailedException if the transport rejects the write or times out
     */
    void send(Connection connection, byte[] payload) throws SendFailedException;

    /**
     * Wait for the next complete inbound payload.
     *
     * @throws ReceiveTimeoutException    if nothing arrives before {@code timeout}
     * @throws ConnectionClosedException  if the connection closed with nothing buffered
     */
    byte[] receive(Connection connection, Duration timeout) throws TransportException;

    /**
     * Drop every complete payload buffered on the connection without blocking.
     * A recorded closure is kept, so a later {@code receive} still reports it.
     *
     * @return number of payloads dropped
     */
    int discardPending(Connection connection);

    /**
     * Close the connection. Idempotent; failures are logged, never thrown.
     */
    void disconnect(Connection connection);

    /**
     * Pure query; no side effects.
     */
    boolean isConnected(Connection connection);
}
