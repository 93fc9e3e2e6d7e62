package com.questrail.gateway.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Session-level operational policy.
 *
 * <ul>
 *   <li><b>idleTimeout</b> sessions without activity for this long are closed</li>
 *   <li><b>retryBackoff</b> minimum time in {@code Error} before {@code Retry} is accepted</li>
 *   <li><b>failureThreshold</b> consecutive send/receive failures that force a disconnect</li>
 *   <li><b>connectTimeout</b> deadline for opening a session's backend connection</li>
 * </ul>
 */
public record SessionPolicy(
        Duration idleTimeout,
        Duration retryBackoff,
        int failureThreshold,
        Duration connectTimeout
) {
    public SessionPolicy {
        Objects.requireNonNull(idleTimeout, "idleTimeout");
        Objects.requireNonNull(retryBackoff, "retryBackoff");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        if (idleTimeout.isNegative() || idleTimeout.isZero()) {
            throw new IllegalArgumentException("idleTimeout must be positive");
        }
        if (retryBackoff.isNegative()) {
            throw new IllegalArgumentException("retryBackoff must be non-negative");
        }
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
    }

    public static SessionPolicy defaults() {
        return new SessionPolicy(Duration.ofMinutes(5), Duration.ofSeconds(1), 3, Duration.ofSeconds(5));
    }
}
