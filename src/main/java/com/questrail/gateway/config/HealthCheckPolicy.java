package com.questrail.gateway.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Cadence and per-probe deadline of the endpoint health checker.
 */
public record HealthCheckPolicy(Duration interval, Duration probeTimeout) {

    public HealthCheckPolicy {
        Objects.requireNonNull(interval, "interval");
        Objects.requireNonNull(probeTimeout, "probeTimeout");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        if (probeTimeout.isNegative() || probeTimeout.isZero()) {
            throw new IllegalArgumentException("probeTimeout must be positive");
        }
    }

    /**
     * Probe every 30 seconds, give each probe 5 seconds.
     */
    public static HealthCheckPolicy defaults() {
        return new HealthCheckPolicy(Duration.ofSeconds(30), Duration.ofSeconds(5));
    }
}
