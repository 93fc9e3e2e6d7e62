package com.questrail.gateway.migration;

/**
 * How a session's traffic is moved from its current connection to a connection
 * on another protocol. Every strategy reports the same {@link MigrationResult}
 * shape so their trade-offs can be compared directly.
 */
public enum MigrationStrategy
{
    /**
     * Stop admitting new exchanges, wait (bounded) for in-flight ones to finish,
     * then switch. Nothing is dropped unless the drain deadline expires.
     */
    GRACEFUL_DRAIN,

    /**
     * Close the old connection and open the new one without waiting. Every
     * in-flight exchange is dropped.
     */
    IMMEDIATE_SWITCH,

    /**
     * Open the new connection first, keep both live for the overlap window, then
     * close the old one. The old connection stays authoritative for writes until
     * it is closed.
     */
    OVERLAP_TRANSITION,

    /**
     * Serialize application state, close the old connection, open the new one and
     * restore the state before new traffic is admitted.
     */
    STATE_PRESERVING
}
