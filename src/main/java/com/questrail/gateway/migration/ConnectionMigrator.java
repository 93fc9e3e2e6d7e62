package com.questrail.gateway.migration;

import com.questrail.gateway.api.ProtocolKind;
import com.questrail.gateway.session.Session;
import com.questrail.gateway.session.SessionBinding;
import com.questrail.gateway.state.GatewayState;
import com.questrail.gateway.time.MonotonicClock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * ConnectionMigrator
 * =============================================================================
 * Moves a session from one protocol's connection to another's using one of the
 * {@link MigrationStrategy strategies}.
 *
 * <h2>Contract</h2>
 * The session MUST already be in {@link GatewayState#SWITCHING} with a
 * {@link MigrationPlan} attached; the state machine's {@code Switch}
 * transition establishes both. The migrator does not change state: it returns
 * an {@link Outcome} for the caller to commit through {@code Switched}, or
 * throws {@link MigrationFailedException} for the caller to turn into
 * {@code RolledBack} or {@code Error}.
 */
public final class ConnectionMigrator
{
    private static final Logger log = LoggerFactory.getLogger(ConnectionMigrator.class);

    /**
     * A finished migration: the uniform result plus the binding to commit.
     */
    public record Outcome(MigrationResult result, SessionBinding binding)
    {
    }

    private final Map<MigrationStrategy, MigrationStrategyExecutor> executors = new EnumMap<>(MigrationStrategy.class);
    private final MigrationContext context;
    private final MonotonicClock clock;

    public ConnectionMigrator(MigrationContext context, MonotonicClock clock)
    {
        this(context, clock, List.of(
                new GracefulDrainMigration(),
                new ImmediateSwitchMigration(),
                new OverlapTransitionMigration(),
                new StatePreservingMigration()));
    }

    public ConnectionMigrator(MigrationContext context, MonotonicClock clock, List<MigrationStrategyExecutor> executors)
    {
        this.context = Objects.requireNonNull(context, "context");
        this.clock = Objects.requireNonNull(clock, "clock");
        for (MigrationStrategyExecutor executor : executors) {
            this.executors.put(executor.strategy(), executor);
        }
        for (MigrationStrategy strategy : MigrationStrategy.values()) {
            if (!this.executors.containsKey(strategy)) {
                throw new IllegalArgumentException("No executor for " + strategy);
            }
        }
    }

    public Outcome migrate(Session session, ProtocolKind fromProtocol, ProtocolKind toProtocol, MigrationStrategy strategy)
            throws MigrationFailedException
    {
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(fromProtocol, "fromProtocol");
        Objects.requireNonNull(toProtocol, "toProtocol");
        Objects.requireNonNull(strategy, "strategy");

        MigrationPlan plan;
        session.lock();
        try {
            if (session.state() != GatewayState.SWITCHING) {
                throw new IllegalStateException("Session " + session.id() + " is not switching: " + session.state());
            }
            plan = session.migrationPlan().orElseThrow(
                    () -> new IllegalStateException("Session " + session.id() + " has no migration plan"));
        } finally {
            session.unlock();
        }
        if (plan.fromProtocol() != fromProtocol || plan.toProtocol() != toProtocol || plan.strategy() != strategy) {
            throw new IllegalArgumentException("Migration request does not match " + plan);
        }

        log.debug("Session {}: migrating {} -> {} via {}", session.id(), fromProtocol, toProtocol, strategy);
        MigrationStrategyExecutor.Outcome done = executors.get(strategy).execute(session, plan, context);

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(clock.nowNanos() - plan.startedAtNanos());
        MigrationResult result = new MigrationResult(strategy, fromProtocol, toProtocol,
                done.droppedConnections(), elapsedMs);
        return new Outcome(result, done.binding());
    }
}
