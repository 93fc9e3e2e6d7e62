package com.questrail.gateway.config;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Local bind address of one protocol listener.
 */
public record ListenerAddress(String address, int port) {

    public ListenerAddress {
        Objects.requireNonNull(address, "address");
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
    }

    public InetSocketAddress toSocketAddress() {
        return new InetSocketAddress(address, port);
    }

    @Override
    public String toString() {
        return address + ":" + port;
    }
}
