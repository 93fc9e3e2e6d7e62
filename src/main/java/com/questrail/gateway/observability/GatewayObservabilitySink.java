package com.questrail.gateway.observability;

/**
 * Receives the gateway's observability events. Implementations can provide
 * logging, metrics or tracing; the gateway does not own a metrics backend.
 *
 * <p>Callbacks may arrive concurrently from different sessions and from the
 * health checker. Implementations MUST NOT throw and SHOULD return quickly.</p>
 */
public interface GatewayObservabilitySink {
    /**
     * Called for structured gateway events (switches, completed migrations,
     * health results, routing decisions).
     */
    void onGatewayEvent(GatewayEvent event);

    /**
     * Called after a session's state changed.
     */
    void onStateTransition(SessionStateTransitionEvent event);

    /**
     * Called when an error is surfaced to a caller or client.
     */
    void onError(GatewayErrorEvent event);
}
