package com.questrail.gateway.time;

/**
 * Cancellation handle for a task armed on a {@link MonotonicScheduler}.
 *
 * <p>Health-check rounds, idle-session sweeps and similar periodic work keep
 * one of these so the gateway can disarm them on shutdown.</p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if the task will not run; {@code false} if it already
     *         ran or was cancelled earlier
     */
    boolean cancel();
}
