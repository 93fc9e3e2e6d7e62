package com.questrail.gateway.state;

import com.questrail.gateway.api.ErrorKind;
import com.questrail.gateway.api.GatewayException;
import com.questrail.gateway.observability.GatewayObservabilitySink;
import com.questrail.gateway.observability.SessionStateTransitionEvent;
import com.questrail.gateway.session.Session;
import com.questrail.gateway.time.MonotonicClock;
import com.questrail.gateway.time.WallClock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * GatewayStateMachine
 * =============================================================================
 * Single authority over session state.
 *
 * <h2>Firing an event</h2>
 * <ol>
 *   <li>No row for {@code (state, event)}: rejected with
 *       {@link ErrorKind#INVALID_TRANSITION}, or
 *       {@link ErrorKind#MIGRATION_IN_PROGRESS} for a switch during a switch.
 *       State unchanged.</li>
 *   <li>Guard refuses: rejected with {@link ErrorKind#INVALID_TRANSITION}.
 *       State unchanged.</li>
 *   <li>Action completes: the session enters the row's target state.</li>
 *   <li>Action throws: the failure becomes an {@link SessionEvent.Error} that
 *       carries the triggering event. If the table has an {@code ERROR} row for
 *       the source state, that row's action (rollback, cleanup) runs first; the
 *       session then enters {@link GatewayState#ERROR} regardless. A session is
 *       never left mid-action.</li>
 * </ol>
 *
 * <h2>Locking</h2>
 * {@link #fire} takes the session lock, so transitions of one session are
 * strictly ordered. The lock is reentrant; callers that already hold it (the
 * facade does while it inspects state) may fire directly.
 */
public final class GatewayStateMachine
{
    private static final Logger log = LoggerFactory.getLogger(GatewayStateMachine.class);

    private final TransitionTable table;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final GatewayObservabilitySink sink;

    public GatewayStateMachine(TransitionTable table,
                               MonotonicClock clock,
                               WallClock wallClock,
                               GatewayObservabilitySink sink)
    {
        this.table = Objects.requireNonNull(table, "table");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public TransitionTable table()
    {
        return table;
    }

    public TransitionResult fire(Session session, SessionEvent event)
    {
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(event, "event");

        session.lock();
        try {
            final GatewayState from = session.state();
            Optional<TransitionTable.Row> found = table.lookup(from, event.type());
            if (found.isEmpty()) {
                ErrorKind kind = from == GatewayState.SWITCHING && event.type() == SessionEvent.Type.SWITCH
                        ? ErrorKind.MIGRATION_IN_PROGRESS
                        : ErrorKind.INVALID_TRANSITION;
                return new TransitionResult.Rejected(from, event, kind,
                        "Event " + event.type() + " is not allowed in state " + from);
            }

            TransitionTable.Row row = found.get();
            Optional<String> refusal = row.guard().check(session, event);
            if (refusal.isPresent()) {
                return new TransitionResult.Rejected(from, event, ErrorKind.INVALID_TRANSITION, refusal.get());
            }

            try {
                row.action().run(session, event);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return fail(session, from, event, row, e);
            } catch (Exception e) {
                return fail(session, from, event, row, e);
            }

            enter(session, from, row.to(), event);
            if (event instanceof SessionEvent.Error error && row.to() == GatewayState.ERROR) {
                session.recordError(error.toGatewayError(), clock.nowNanos());
            }
            return new TransitionResult.Transitioned(from, row.to(), event);
        } finally {
            session.unlock();
        }
    }

    // -------------------------------------------------------------------------
    // Action failure
    // -------------------------------------------------------------------------

    private TransitionResult fail(Session session,
                                  GatewayState from,
                                  SessionEvent trigger,
                                  TransitionTable.Row failedRow,
                                  Exception failure)
    {
        SessionEvent.Error error = new SessionEvent.Error(
                trigger,
                GatewayException.kindOf(failure, fallbackKind(trigger)),
                failure.getMessage() == null ? failure.getClass().getSimpleName() : failure.getMessage(),
                failure);
        log.debug("Session {}: action for {} in {} failed", session.id(), trigger.type(), from, failure);

        Optional<TransitionTable.Row> errorRow = table.lookup(from, SessionEvent.Type.ERROR);
        if (errorRow.isPresent() && errorRow.get() != failedRow) {
            try {
                errorRow.get().action().run(session, error);
            } catch (Exception cleanup) {
                failure.addSuppressed(cleanup);
                log.warn("Session {}: error handling in {} also failed", session.id(), from, cleanup);
            }
        }

        enter(session, from, GatewayState.ERROR, error);
        session.recordError(error.toGatewayError(), clock.nowNanos());
        return new TransitionResult.Failed(from, error);
    }

    private static ErrorKind fallbackKind(SessionEvent trigger)
    {
        return switch (trigger.type()) {
            case SWITCH, SWITCHED, ROLLED_BACK -> ErrorKind.MIGRATION_FAILED;
            case ERROR -> ((SessionEvent.Error) trigger).kind();
            default -> ErrorKind.TRANSPORT_UNAVAILABLE;
        };
    }

    private void enter(Session session, GatewayState from, GatewayState to, SessionEvent event)
    {
        session.enterState(to);
        sink.onStateTransition(new SessionStateTransitionEvent(wallClock.now(), session.id(), from, to, event));
    }
}
