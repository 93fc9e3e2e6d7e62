package com.questrail.gateway.api;

/**
 * Typed error categories returned by the gateway's public operations.
 */
public enum ErrorKind
{
    /** Endpoint unreachable; every healthy alternative was also tried. */
    TRANSPORT_UNAVAILABLE,
    /** Transport rejected or timed out a write. */
    SEND_FAILED,
    /** No data arrived before the caller's deadline, or the connection closed. */
    RECEIVE_TIMEOUT,
    /** Event not legal in the session's current state, or its guard refused it. */
    INVALID_TRANSITION,
    /** A switch was requested while the session is already migrating. */
    MIGRATION_IN_PROGRESS,
    MIGRATION_FAILED,
    NO_HEALTHY_ENDPOINT,
    HANDLER_FAILED,
    UNKNOWN_SESSION,
    LISTEN_FAILED,
    /** The gateway is shut down or shutting down. */
    SHUTDOWN
}
