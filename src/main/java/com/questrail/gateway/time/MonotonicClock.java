package com.questrail.gateway.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every gateway deadline: retry backoff, idle-session expiry,
 * drain bounds and health-check cadence.
 *
 * <h2>Binding invariant</h2>
 * Operational timing MUST be computed from this clock. Wall-clock instants
 * ({@link WallClock}) are only stamped onto sessions and observability records.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick in nanoseconds. Only differences
     * between two readings are meaningful.
     */
    long nowNanos();

    /**
     * Returns {@code true} once at least {@code durationNanos} have passed since
     * {@code sinceNanos}.
     */
    default boolean hasElapsed(long sinceNanos, long durationNanos)
    {
        return nowNanos() - sinceNanos >= durationNanos;
    }
}
