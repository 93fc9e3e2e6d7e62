package com.questrail.gateway.migration;

import com.questrail.gateway.api.ProtocolKind;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One in-flight protocol switch. Created when a session enters
 * {@code SWITCHING}, discarded when it leaves.
 *
 * @param startedAtNanos monotonic start, used to measure migration time
 * @param capturedState  serialized application state, present only once a
 *                       state-preserving migration has captured it
 */
public record MigrationPlan(String sessionId,
                            ProtocolKind fromProtocol,
                            ProtocolKind toProtocol,
                            MigrationStrategy strategy,
                            Instant startedAt,
                            long startedAtNanos,
                            byte[] capturedState)
{
    public MigrationPlan {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(fromProtocol, "fromProtocol");
        Objects.requireNonNull(toProtocol, "toProtocol");
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(startedAt, "startedAt");
        capturedState = capturedState == null ? null : capturedState.clone();
    }

    public MigrationPlan withCapturedState(byte[] state)
    {
        return new MigrationPlan(sessionId, fromProtocol, toProtocol, strategy, startedAt, startedAtNanos,
                Objects.requireNonNull(state, "state"));
    }

    @Override
    public byte[] capturedState()
    {
        return capturedState == null ? null : capturedState.clone();
    }

    public Optional<byte[]> captured()
    {
        return capturedState == null ? Optional.empty() : Optional.of(capturedState.clone());
    }

    @Override
    public String toString()
    {
        return "MigrationPlan{" + sessionId + ": " + fromProtocol + " -> " + toProtocol + " via " + strategy + "}";
    }
}
