package com.questrail.gateway.state;

/**
 * Lifecycle state of one session.
 */
public enum GatewayState
{
    IDLE,
    CONNECTING,
    CONNECTED,
    /** A migration is in flight; a second switch is refused. */
    SWITCHING,
    DISCONNECTING,
    /** Failed; leaves only through {@code Retry} once the backoff has elapsed. */
    ERROR
}
