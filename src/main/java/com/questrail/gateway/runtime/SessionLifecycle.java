package com.questrail.gateway.runtime;

import com.questrail.gateway.adapter.TransportUnavailableException;
import com.questrail.gateway.api.ProtocolKind;
import com.questrail.gateway.balance.BalancedConnector;
import com.questrail.gateway.config.SessionPolicy;
import com.questrail.gateway.migration.MigrationPlan;
import com.questrail.gateway.session.ExchangeFailureTracker;
import com.questrail.gateway.session.Session;
import com.questrail.gateway.session.SessionBinding;
import com.questrail.gateway.state.LifecycleActions;
import com.questrail.gateway.state.SessionEvent;
import com.questrail.gateway.time.MonotonicClock;
import com.questrail.gateway.time.WallClock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * SessionLifecycle
 * =============================================================================
 * The production guards and actions of the session transition table.
 *
 * <h2>Binding ownership</h2>
 * A binding returned by the {@link BalancedConnector} holds one unit of its
 * endpoint's load. Whichever action drops a binding from the session MUST give
 * it back through {@link BalancedConnector#release}; this class is the only
 * place outside the migration strategies that does so.
 *
 * <h2>Locking</h2>
 * Every method runs inside {@code GatewayStateMachine.fire}, with the session
 * lock held.
 */
final class SessionLifecycle implements LifecycleActions
{
    private static final Logger log = LoggerFactory.getLogger(SessionLifecycle.class);

    private final BalancedConnector connector;
    private final Set<ProtocolKind> supportedProtocols;
    private final SessionPolicy policy;
    private final ExchangeFailureTracker failures;
    private final MonotonicClock clock;
    private final WallClock wallClock;

    SessionLifecycle(BalancedConnector connector,
                     Set<ProtocolKind> supportedProtocols,
                     SessionPolicy policy,
                     ExchangeFailureTracker failures,
                     MonotonicClock clock,
                     WallClock wallClock)
    {
        this.connector = Objects.requireNonNull(connector, "connector");
        this.supportedProtocols = Set.copyOf(supportedProtocols);
        this.policy = Objects.requireNonNull(policy, "policy");
        this.failures = Objects.requireNonNull(failures, "failures");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    // -------------------------------------------------------------------------
    // Guards
    // -------------------------------------------------------------------------

    @Override
    public Optional<String> canSwitch(Session session, SessionEvent.Switch event)
    {
        if (!supportedProtocols.contains(event.target())) {
            return Optional.of("Protocol " + event.target() + " is not supported");
        }
        if (event.target() == session.currentProtocol()) {
            return Optional.of("Session " + session.id() + " is already on " + event.target());
        }
        return Optional.empty();
    }

    @Override
    public Optional<String> canRetry(Session session, SessionEvent.Retry event)
    {
        if (!clock.hasElapsed(session.errorAtNanos(), policy.retryBackoff().toNanos())) {
            return Optional.of("Retry backoff of " + policy.retryBackoff().toMillis() + "ms has not elapsed");
        }
        return Optional.empty();
    }

    // -------------------------------------------------------------------------
    // Connect
    // -------------------------------------------------------------------------

    @Override
    public void openConnection(Session session, SessionEvent.Connect event) throws Exception
    {
        SessionBinding binding = connector.connect(event.protocol(), policy.connectTimeout());
        session.setPending(binding);
        log.debug("Session {}: opened {} to {}", session.id(), binding.connection(), binding.endpoint().id());
    }

    @Override
    public void bindConnection(Session session, SessionEvent.Connected event) throws Exception
    {
        SessionBinding binding = event.binding();
        if (!binding.isConnected()) {
            throw new TransportUnavailableException("Connection to " + binding.endpoint().id() + " closed before bind");
        }
        session.bind(binding);
        session.clearError();
        failures.reset(session.id());
    }

    @Override
    public void recordConnectFailure(Session session, SessionEvent.Error event)
    {
        releasePending(session);
    }

    // -------------------------------------------------------------------------
    // Switch
    // -------------------------------------------------------------------------

    @Override
    public void beginMigration(Session session, SessionEvent.Switch event)
    {
        session.setMigrationPlan(new MigrationPlan(
                session.id(),
                session.currentProtocol(),
                event.target(),
                event.strategy(),
                wallClock.now(),
                clock.nowNanos(),
                null));
    }

    @Override
    public void commitMigration(Session session, SessionEvent.Switched event)
    {
        session.setOverlap(null);
        session.bind(event.binding());
        session.setMigrationPlan(null);
        failures.reset(session.id());
    }

    @Override
    public void rollBackMigration(Session session, SessionEvent.RolledBack event)
    {
        session.overlapBinding().ifPresent(connector::release);
        session.setOverlap(null);
        session.setMigrationPlan(null);
        if (session.primaryBinding().isPresent()) {
            session.setAcceptingWork(true);
        }
        log.info("Session {}: {} migration rolled back: {}", session.id(), event.strategy(), event.reason());
    }

    @Override
    public void abortMigration(Session session, SessionEvent.Error event)
    {
        releaseAll(session);
    }

    // -------------------------------------------------------------------------
    // Disconnect / Retry
    // -------------------------------------------------------------------------

    @Override
    public void beginTeardown(Session session, SessionEvent.Disconnect event) throws Exception
    {
        session.setAcceptingWork(false);
        if (!session.awaitDrained(event.drainTimeout().toNanos())) {
            log.warn("Session {}: {} exchange(s) still in flight after {}ms drain",
                    session.id(), session.inFlight(), event.drainTimeout().toMillis());
        }
    }

    @Override
    public void releaseResources(Session session, SessionEvent.Disconnected event)
    {
        releaseAll(session);
        failures.reset(session.id());
    }

    @Override
    public void resetSession(Session session, SessionEvent.Retry event)
    {
        releaseAll(session);
        session.clearError();
        failures.reset(session.id());
    }

    /**
     * Drop and release every binding the session still holds. Lock required.
     */
    void releaseAll(Session session)
    {
        session.overlapBinding().ifPresent(connector::release);
        session.setOverlap(null);
        releasePending(session);
        session.unbind().ifPresent(connector::release);
        session.setMigrationPlan(null);
    }

    private void releasePending(Session session)
    {
        Optional<SessionBinding> pending = session.pendingBinding();
        session.setPending(null);
        pending.ifPresent(connector::release);
    }
}
