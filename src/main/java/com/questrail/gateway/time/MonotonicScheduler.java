package com.questrail.gateway.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Scheduling surface for the gateway's background work (health-check rounds,
 * idle-session sweeps).
 *
 * <p>Deadlines are expressed in {@link MonotonicClock} ticks, never as wall-clock
 * instants. Tests drive a deterministic implementation; production uses
 * {@link ScheduledExecutorScheduler}.</p>
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos deadline in {@link MonotonicClock#nowNanos()} ticks
     * @param task          work to run
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Schedule a task after a relative delay measured on {@code clock}.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }
        return scheduleAtNanos(clock.nowNanos() + delay.toNanos(), task);
    }
}
