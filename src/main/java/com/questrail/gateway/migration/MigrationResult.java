package com.questrail.gateway.migration;

import com.questrail.gateway.api.ProtocolKind;

import java.util.Objects;

/**
 * Uniform report of a completed migration, whatever the strategy.
 *
 * @param droppedConnections in-flight exchanges that were cut off when the old
 *                           connection closed; their callers must retry
 * @param migrationTimeMs    monotonic time from entering {@code SWITCHING} until the
 *                           new connection was ready
 */
public record MigrationResult(MigrationStrategy strategy,
                              ProtocolKind fromProtocol,
                              ProtocolKind toProtocol,
                              int droppedConnections,
                              long migrationTimeMs)
{
    public MigrationResult {
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(fromProtocol, "fromProtocol");
        Objects.requireNonNull(toProtocol, "toProtocol");
        if (droppedConnections < 0) {
            throw new IllegalArgumentException("droppedConnections must be >= 0");
        }
    }
}
