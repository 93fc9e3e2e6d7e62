package com.questrail.gateway.state;

import com.questrail.gateway.api.ErrorKind;
import com.questrail.gateway.api.GatewayError;
import com.questrail.gateway.api.ProtocolKind;
import com.questrail.gateway.migration.MigrationStrategy;
import com.questrail.gateway.session.SessionBinding;

import java.time.Duration;
import java.util.Objects;

/**
 * SessionEvent
 * -----------------------------------------------------------------------------
 * Events dispatched into the {@link GatewayStateMachine}.
 *
 * <p>Each event carries what its transition's action needs. Nested records keep
 * the closed set visible in one place; {@link #type()} is the key used by the
 * {@link TransitionTable}.</p>
 */
public sealed interface SessionEvent
{
    enum Type
    {
        CONNECT,
        CONNECTED,
        SWITCH,
        SWITCHED,
        ROLLED_BACK,
        ERROR,
        DISCONNECT,
        DISCONNECTED,
        RETRY
    }

    Type type();

    /** Open a backend connection on {@code protocol}. */
    record Connect(ProtocolKind protocol) implements SessionEvent
    {
        public Connect {
            Objects.requireNonNull(protocol, "protocol");
        }

        @Override
        public Type type()
        {
            return Type.CONNECT;
        }
    }

    /** The connection opened by {@link Connect} is ready to be bound. */
    record Connected(SessionBinding binding) implements SessionEvent
    {
        public Connected {
            Objects.requireNonNull(binding, "binding");
        }

        @Override
        public Type type()
        {
            return Type.CONNECTED;
        }
    }

    record Switch(ProtocolKind target, MigrationStrategy strategy) implements SessionEvent
    {
        public Switch {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(strategy, "strategy");
        }

        @Override
        public Type type()
        {
            return Type.SWITCH;
        }
    }

    /** Migration finished; {@code binding} replaces the session's connection. */
    record Switched(SessionBinding binding) implements SessionEvent
    {
        public Switched {
            Objects.requireNonNull(binding, "binding");
        }

        @Override
        public Type type()
        {
            return Type.SWITCHED;
        }
    }

    /** Migration aborted while the previous connection was still open. */
    record RolledBack(MigrationStrategy strategy, String reason) implements SessionEvent
    {
        public RolledBack {
            Objects.requireNonNull(strategy, "strategy");
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public Type type()
        {
            return Type.ROLLED_BACK;
        }
    }

    /**
     * A failure. {@code trigger} is the event whose action failed, or
     * {@code null} when the error was reported directly.
     */
    record Error(SessionEvent trigger, ErrorKind kind, String reason, Throwable cause) implements SessionEvent
    {
        public Error {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(reason, "reason");
        }

        public static Error of(GatewayError error)
        {
            return new Error(null, error.kind(), error.message(), error.cause());
        }

        public GatewayError toGatewayError()
        {
            return new GatewayError(kind, reason, cause);
        }

        @Override
        public Type type()
        {
            return Type.ERROR;
        }

        @Override
        public String toString()
        {
            return "Error[" + kind + ": " + reason + (trigger == null ? "" : ", trigger=" + trigger.type()) + "]";
        }
    }

    /** Tear the session down, letting in-flight exchanges finish for up to {@code drainTimeout}. */
    record Disconnect(String reason, Duration drainTimeout) implements SessionEvent
    {
        public Disconnect {
            Objects.requireNonNull(reason, "reason");
            Objects.requireNonNull(drainTimeout, "drainTimeout");
        }

        @Override
        public Type type()
        {
            return Type.DISCONNECT;
        }
    }

    record Disconnected() implements SessionEvent
    {
        @Override
        public Type type()
        {
            return Type.DISCONNECTED;
        }
    }

    record Retry() implements SessionEvent
    {
        @Override
        public Type type()
        {
            return Type.RETRY;
        }
    }
}
