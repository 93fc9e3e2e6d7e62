package com.questrail.gateway.observability;

import com.questrail.gateway.state.GatewayState;
import com.questrail.gateway.state.SessionEvent;

import java.time.Instant;

/**
 * Record of one state change of one session.
 */
public record SessionStateTransitionEvent(
    Instant timestamp,
    String sessionId,
    GatewayState oldState,
    GatewayState newState,
    SessionEvent triggeringEvent
) {
    public boolean isFailure() {
        return newState == GatewayState.ERROR && oldState != GatewayState.ERROR;
    }
}
