package com.questrail.gateway.state;

import com.questrail.gateway.api.ErrorKind;
import com.questrail.gateway.api.GatewayError;

/**
 * Outcome of {@link GatewayStateMachine#fire}.
 */
public sealed interface TransitionResult
{
    GatewayState stateAfter();

    default boolean isTransitioned()
    {
        return this instanceof Transitioned;
    }

    /**
     * The transition happened and its action completed.
     */
    record Transitioned(GatewayState from, GatewayState to, SessionEvent event) implements TransitionResult
    {
        @Override
        public GatewayState stateAfter()
        {
            return to;
        }
    }

    /**
     * No row for the event, or its guard refused. The state did not change.
     */
    record Rejected(GatewayState state, SessionEvent event, ErrorKind kind, String reason) implements TransitionResult
    {
        @Override
        public GatewayState stateAfter()
        {
            return state;
        }

        public GatewayError toGatewayError()
        {
            return GatewayError.of(kind, reason);
        }
    }

    /**
     * The action threw; the session is now in {@link GatewayState#ERROR}.
     */
    record Failed(GatewayState from, SessionEvent.Error error) implements TransitionResult
    {
        @Override
        public GatewayState stateAfter()
        {
            return GatewayState.ERROR;
        }

        public GatewayError toGatewayError()
        {
            return error.toGatewayError();
        }
    }
}
