package com.questrail.gateway.api;

import java.net.SocketAddress;
import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Message
 * -----------------------------------------------------------------------------
 * Protocol-neutral form of one inbound unit of work.
 *
 * <p>Listeners normalize whatever arrived on the wire (an HTTP request body, a
 * WebSocket frame, a length-prefixed TCP frame, a datagram, an HTTP/2 stream)
 * into this record before anything else in the gateway sees it. Header names
 * are lower-cased; protocols without headers carry an empty map.</p>
 *
 * <p>The payload array is copied on the way in and on the way out.</p>
 */
public final class Message
{
    /** Header carrying an explicit logical session id. */
    public static final String SESSION_HEADER = "x-session-id";

    private final ProtocolKind sourceProtocol;
    private final String connectionId;
    private final byte[] payload;
    private final Map<String, String> headers;
    private final SocketAddress remoteAddress;
    private final Instant receivedAt;

    private Message(Builder b)
    {
        this.sourceProtocol = Objects.requireNonNull(b.sourceProtocol, "sourceProtocol");
        this.connectionId = Objects.requireNonNull(b.connectionId, "connectionId");
        this.payload = b.payload.clone();
        this.headers = Map.copyOf(b.headers);
        this.remoteAddress = b.remoteAddress;
        this.receivedAt = Objects.requireNonNull(b.receivedAt, "receivedAt");
    }

    public ProtocolKind sourceProtocol()
    {
        return sourceProtocol;
    }

    /**
     * Identifier of the transport connection (or, for UDP, the sender) the
     * message arrived on.
     */
    public String connectionId()
    {
        return connectionId;
    }

    public byte[] payload()
    {
        return payload.clone();
    }

    public int size()
    {
        return payload.length;
    }

    public Map<String, String> headers()
    {
        return headers;
    }

    public Optional<String> header(String name)
    {
        return Optional.ofNullable(headers.get(name.toLowerCase(Locale.ROOT)));
    }

    /**
     * Logical session this message belongs to: the {@value #SESSION_HEADER}
     * header when present, otherwise the connection id.
     */
    public String sessionId()
    {
        return header(SESSION_HEADER).filter(s -> !s.isBlank()).orElse(connectionId);
    }

    public Optional<SocketAddress> remoteAddress()
    {
        return Optional.ofNullable(remoteAddress);
    }

    public Instant receivedAt()
    {
        return receivedAt;
    }

    @Override
    public String toString()
    {
        return "Message{" + sourceProtocol + ", connection=" + connectionId
                + ", bytes=" + payload.length + ", headers=" + headers.keySet() + "}";
    }

    public static Builder builder(ProtocolKind sourceProtocol)
    {
        return new Builder(sourceProtocol);
    }

    public static final class Builder
    {
        private final ProtocolKind sourceProtocol;
        private String connectionId = "local";
        private byte[] payload = new byte[0];
        private final Map<String, String> headers = new HashMap<>();
        private SocketAddress remoteAddress;
        private Instant receivedAt = Instant.now();

        private Builder(ProtocolKind sourceProtocol)
        {
            this.sourceProtocol = sourceProtocol;
        }

        public Builder connectionId(String connectionId)
        {
            this.connectionId = connectionId;
            return this;
        }

        public Builder payload(byte[] payload)
        {
            this.payload = Objects.requireNonNull(payload, "payload");
            return this;
        }

        public Builder header(String name, String value)
        {
            headers.put(name.toLowerCase(Locale.ROOT), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder headers(Map<String, String> values)
        {
            values.forEach(this::header);
            return this;
        }

        public Builder remoteAddress(SocketAddress remoteAddress)
        {
            this.remoteAddress = remoteAddress;
            return this;
        }

        public Builder receivedAt(Instant receivedAt)
        {
            this.receivedAt = receivedAt;
            return this;
        }

        public Message build()
        {
            return new Message(this);
        }
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Message other)) {
            return false;
        }
        return sourceProtocol == other.sourceProtocol
                && connectionId.equals(other.connectionId)
                && Arrays.equals(payload, other.payload)
                && headers.equals(other.headers)
                && Objects.equals(remoteAddress, other.remoteAddress)
                && receivedAt.equals(other.receivedAt);
    }

    @Override
    public int hashCode()
    {
        int result = Objects.hash(sourceProtocol, connectionId, headers, remoteAddress, receivedAt);
        return 31 * result + Arrays.hashCode(payload);
    }
}
