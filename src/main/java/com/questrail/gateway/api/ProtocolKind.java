package com.questrail.gateway.api;

import java.util.Locale;

/**
 * The fixed set of transport protocols the gateway can listen on, connect
 * with and migrate sessions between.
 */
public enum ProtocolKind
{
    HTTP("http", false),
    HTTP2("http2", false),
    WEBSOCKET("websocket", false),
    TCP("tcp", false),
    UDP("udp", true);

    private final String wireName;
    private final boolean connectionless;

    ProtocolKind(String wireName, boolean connectionless)
    {
        this.wireName = wireName;
        this.connectionless = connectionless;
    }

    /**
     * Lower-case name used in configuration, observability attributes and logs.
     */
    public String wireName()
    {
        return wireName;
    }

    /**
     * {@code true} for datagram protocols where {@code connect} only validates
     * that the target is addressable.
     */
    public boolean isConnectionless()
    {
        return connectionless;
    }

    /**
     * Parses a wire name ({@code "websocket"}) or constant name ({@code "WEBSOCKET"}).
     *
     * @throws IllegalArgumentException for an unknown protocol
     */
    public static ProtocolKind fromWireName(String name)
    {
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (ProtocolKind kind : values()) {
            if (kind.wireName.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown protocol: " + name);
    }

    @Override
    public String toString()
    {
        return wireName;
    }
}
