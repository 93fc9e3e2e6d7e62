package com.questrail.gateway.observability;

import com.questrail.gateway.api.ErrorKind;

import java.time.Instant;

/**
 * Record representing an error surfaced by the gateway. {@code sessionId} is
 * {@code null} for errors not tied to a session (listener binds, probes).
 */
public record GatewayErrorEvent(
    Instant timestamp,
    ErrorKind kind,
    String sessionId,
    String message,
    Throwable cause
) {
}
