package com.questrail.gateway.session;

import com.questrail.gateway.state.GatewayState;
import com.questrail.gateway.time.Cancellable;
import com.questrail.gateway.time.MonotonicClock;
import com.questrail.gateway.time.MonotonicScheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Closes sessions that have been idle for longer than the idle timeout.
 *
 * <p>A sweep runs every {@code idleTimeout / 4} (at least one second) on the
 * gateway scheduler. Sessions that are mid-migration or still have exchanges
 * in flight are never reaped; they are looked at again next sweep.</p>
 */
public final class SessionReaper
{
    private static final Logger log = LoggerFactory.getLogger(SessionReaper.class);
    private static final Duration MIN_SWEEP_INTERVAL = Duration.ofSeconds(1);

    private final SessionRegistry sessions;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final Duration idleTimeout;
    private final Duration sweepInterval;
    private final Consumer<Session> closer;

    private volatile Cancellable next;
    private volatile boolean running;

    public SessionReaper(SessionRegistry sessions,
                         MonotonicClock clock,
                         MonotonicScheduler scheduler,
                         Duration idleTimeout,
                         Consumer<Session> closer)
    {
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.idleTimeout = Objects.requireNonNull(idleTimeout, "idleTimeout");
        this.closer = Objects.requireNonNull(closer, "closer");

        Duration quarter = idleTimeout.dividedBy(4);
        this.sweepInterval = quarter.compareTo(MIN_SWEEP_INTERVAL) < 0 ? MIN_SWEEP_INTERVAL : quarter;
    }

    public synchronized void start()
    {
        if (running) {
            return;
        }
        running = true;
        scheduleNext();
    }

    public synchronized void stop()
    {
        running = false;
        Cancellable c = next;
        if (c != null) {
            c.cancel();
        }
    }

    /**
     * Close every session idle past the timeout.
     *
     * @return the sessions handed to the closer
     */
    public List<Session> sweep()
    {
        long idleNanos = idleTimeout.toNanos();
        List<Session> reaped = new ArrayList<>();
        for (Session session : sessions.all()) {
            if (!clock.hasElapsed(session.lastActivityNanos(), idleNanos) || !isQuiescent(session)) {
                continue;
            }
            log.info("Closing session {} after {} idle", session.id(), idleTimeout);
            reaped.add(session);
            closer.accept(session);
        }
        return reaped;
    }

    private static boolean isQuiescent(Session session)
    {
        session.lock();
        try {
            GatewayState state = session.state();
            return state != GatewayState.SWITCHING
                    && state != GatewayState.CONNECTING
                    && state != GatewayState.DISCONNECTING
                    && session.inFlight() == 0;
        } finally {
            session.unlock();
        }
    }

    private void scheduleNext()
    {
        next = scheduler.scheduleAfter(sweepInterval, clock, () -> {
            if (!running) {
                return;
            }
            try {
                sweep();
            } catch (RuntimeException e) {
                log.warn("Idle-session sweep failed", e);
            }
            synchronized (this) {
                if (running) {
                    scheduleNext();
                }
            }
        });
    }
}
