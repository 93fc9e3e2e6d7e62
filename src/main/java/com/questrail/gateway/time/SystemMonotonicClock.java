package com.questrail.gateway.time;

/**
 * {@link MonotonicClock} backed by {@link System#nanoTime()}. Unaffected by NTP
 * or manual clock changes; tests use a manual clock instead.
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
