package com.questrail.gateway.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Transport-level knobs shared by every adapter and listener.
 *
 * <ul>
 *   <li><b>connectTimeout</b> default deadline for {@code connect} and for binding
 *       listeners when the caller supplies none</li>
 *   <li><b>writeTimeout</b> bound on a single {@code send}</li>
 *   <li><b>maxFrameLength</b> largest payload accepted on any protocol</li>
 *   <li><b>httpPath</b> request path used by the HTTP and HTTP/2 adapters</li>
 *   <li><b>webSocketPath</b> upgrade path used by the WebSocket adapter and listener</li>
 *   <li><b>ioThreads</b> event-loop threads per Netty group; 0 lets Netty decide</li>
 * </ul>
 */
public record TransportSettings(
        Duration connectTimeout,
        Duration writeTimeout,
        int maxFrameLength,
        String httpPath,
        String webSocketPath,
        int ioThreads
) {
    public TransportSettings {
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(writeTimeout, "writeTimeout");
        Objects.requireNonNull(httpPath, "httpPath");
        Objects.requireNonNull(webSocketPath, "webSocketPath");

        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (writeTimeout.isNegative() || writeTimeout.isZero()) {
            throw new IllegalArgumentException("writeTimeout must be positive");
        }
        if (maxFrameLength <= 0) {
            throw new IllegalArgumentException("maxFrameLength must be positive");
        }
        if (!httpPath.startsWith("/") || !webSocketPath.startsWith("/")) {
            throw new IllegalArgumentException("paths must start with '/'");
        }
        if (ioThreads < 0) {
            throw new IllegalArgumentException("ioThreads must be >= 0");
        }
    }

    /**
     * connectTimeout 5s, writeTimeout 5s, maxFrameLength 1 MiB, httpPath "/",
     * webSocketPath "/ws", ioThreads 0.
     */
    public static TransportSettings defaults() {
        return new TransportSettings(
                Duration.ofSeconds(5),
                Duration.ofSeconds(5),
                1024 * 1024,
                "/",
                "/ws",
                0
        );
    }
}
