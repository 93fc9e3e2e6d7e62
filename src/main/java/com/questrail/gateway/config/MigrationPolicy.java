package com.questrail.gateway.config;

import com.questrail.gateway.migration.MigrationStrategy;

import java.time.Duration;
import java.util.Objects;

/**
 * Migration defaults.
 *
 * <ul>
 *   <li><b>defaultStrategy</b> used when inbound routing triggers a switch and
 *       the caller did not pick a strategy</li>
 *   <li><b>drainTimeout</b> upper bound on the graceful-drain wait</li>
 *   <li><b>overlapWindow</b> how long both connections stay live during an
 *       overlap transition</li>
 * </ul>
 */
public record MigrationPolicy(
        MigrationStrategy defaultStrategy,
        Duration drainTimeout,
        Duration overlapWindow
) {
    public MigrationPolicy {
        Objects.requireNonNull(defaultStrategy, "defaultStrategy");
        Objects.requireNonNull(drainTimeout, "drainTimeout");
        Objects.requireNonNull(overlapWindow, "overlapWindow");
        if (drainTimeout.isNegative()) {
            throw new IllegalArgumentException("drainTimeout must be non-negative");
        }
        if (overlapWindow.isNegative()) {
            throw new IllegalArgumentException("overlapWindow must be non-negative");
        }
    }

    /**
     * Graceful drain, 10 second drain timeout, 250 ms overlap window.
     */
    public static MigrationPolicy defaults() {
        return new MigrationPolicy(MigrationStrategy.GRACEFUL_DRAIN, Duration.ofSeconds(10), Duration.ofMillis(250));
    }
}
