package com.questrail.gateway.session;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Consecutive exchange-failure tracker.
 *
 * - Counts send/receive failures per session
 * - Resets on a successful exchange
 * - Reports when the disconnect threshold is reached; acting on it is the caller's job
 */
public final class ExchangeFailureTracker {

    private final int threshold;
    private final ConcurrentMap<String, Integer> failures = new ConcurrentHashMap<>();

    public ExchangeFailureTracker(int threshold) {
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be >= 1");
        }
        this.threshold = threshold;
    }

    /**
     * Record one failed exchange.
     *
     * @return {@code true} when this failure reaches the threshold
     */
    public boolean recordFailure(String sessionId) {
        return failures.merge(sessionId, 1, Integer::sum) >= threshold;
    }

    public void reset(String sessionId) {
        failures.remove(sessionId);
    }

    /**
     * Current consecutive failure count (0 if none).
     */
    public int failuresFor(String sessionId) {
        return failures.getOrDefault(sessionId, 0);
    }

    public int threshold() {
        return threshold;
    }
}
