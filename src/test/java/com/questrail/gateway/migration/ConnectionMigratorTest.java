package com.questrail.gateway.migration;

import com.questrail.gateway.adapter.FakeProtocolAdapter;
import com.questrail.gateway.api.ErrorKind;
import com.questrail.gateway.api.ProtocolKind;
import com.questrail.gateway.balance.BalancedConnector;
import com.questrail.gateway.balance.LoadBalancer;
import com.questrail.gateway.balance.NoHealthyEndpointException;
import com.questrail.gateway.balance.RoundRobinStrategy;
import com.questrail.gateway.config.MigrationPolicy;
import com.questrail.gateway.registry.Endpoint;
import com.questrail.gateway.registry.EndpointRegistry;
import com.questrail.gateway.session.Session;
import com.questrail.gateway.session.SessionBinding;
import com.questrail.gateway.state.GatewayState;
import com.questrail.gateway.time.ManualMonotonicClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ConnectionMigratorTest
 * -----------------------------------------------------------------------------
 * Each strategy run against fake HTTP and WebSocket backends. The session is
 * put into SWITCHING by hand, the way the Switch transition would.
 */
class ConnectionMigratorTest {

    private static final Duration CONNECT = Duration.ofSeconds(1);

    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final EndpointRegistry registry = new EndpointRegistry();
    private final FakeProtocolAdapter http = new FakeProtocolAdapter(ProtocolKind.HTTP);
    private final FakeProtocolAdapter ws = new FakeProtocolAdapter(ProtocolKind.WEBSOCKET);
    private final BalancedConnector connector = new BalancedConnector(
            new LoadBalancer(new RoundRobinStrategy(), registry), registry,
            kind -> kind == ProtocolKind.HTTP ? http : ws);

    private final Endpoint httpBackend = Endpoint.of(ProtocolKind.HTTP, "10.2.0.1", 8080, 1);
    private final Endpoint wsBackend = Endpoint.of(ProtocolKind.WEBSOCKET, "10.2.0.2", 8081, 1);

    ConnectionMigratorTest() {
        registry.register(httpBackend);
        registry.register(wsBackend);
    }

    private ConnectionMigrator migrator(Duration drain, Duration overlap) {
        MigrationContext context = new MigrationContext(connector, new JacksonApplicationStateCodec(),
                new MigrationPolicy(MigrationStrategy.GRACEFUL_DRAIN, drain, overlap), CONNECT);
        return new ConnectionMigrator(context, clock);
    }

    private ConnectionMigrator migrator() {
        return migrator(Duration.ofMillis(50), Duration.ofMillis(20));
    }

    /**
     * A session connected over HTTP, then moved into SWITCHING with a plan.
     */
    private Session switchingSession(MigrationStrategy strategy, Map<String, Object> appState) throws Exception {
        Session session = new Session("mig-1", ProtocolKind.HTTP, appState, Instant.EPOCH, clock.nowNanos());
        SessionBinding primary = connector.connect(ProtocolKind.HTTP, CONNECT);
        session.lock();
        try {
            session.bind(primary);
            session.enterState(GatewayState.SWITCHING);
            session.setMigrationPlan(new MigrationPlan(session.id(), ProtocolKind.HTTP, ProtocolKind.WEBSOCKET,
                    strategy, Instant.EPOCH, clock.nowNanos(), null));
        } finally {
            session.unlock();
        }
        return session;
    }

    private static void beginExchanges(Session session, int count) {
        session.lock();
        try {
            for (int i = 0; i < count; i++) {
                session.beginExchange().orElseThrow();
            }
        } finally {
            session.unlock();
        }
    }

    // ---------------------------------------------------------------------
    // Graceful drain
    // ---------------------------------------------------------------------

    @Test
    void gracefulDrainOnAQuietSessionDropsNothing() throws Exception {
        Session session = switchingSession(MigrationStrategy.GRACEFUL_DRAIN, Map.of());
        clock.advanceMillis(30);

        ConnectionMigrator.Outcome outcome = migrator().migrate(session,
                ProtocolKind.HTTP, ProtocolKind.WEBSOCKET, MigrationStrategy.GRACEFUL_DRAIN);

        MigrationResult result = outcome.result();
        assertEquals(MigrationStrategy.GRACEFUL_DRAIN, result.strategy());
        assertEquals(ProtocolKind.HTTP, result.fromProtocol());
        assertEquals(ProtocolKind.WEBSOCKET, result.toProtocol());
        assertEquals(0, result.droppedConnections());
        assertEquals(30, result.migrationTimeMs());

        assertEquals(ProtocolKind.WEBSOCKET, outcome.binding().protocol());
        assertEquals(0, http.openConnections(), "old connection closed");
        assertEquals(0, httpBackend.currentLoad());
        assertEquals(1, wsBackend.currentLoad());
    }

    @Test
    void gracefulDrainWaitsForInFlightExchanges() throws Exception {
        Session session = switchingSession(MigrationStrategy.GRACEFUL_DRAIN, Map.of());
        beginExchanges(session, 1);

        CompletableFuture<Void> finisher = CompletableFuture.runAsync(() -> {
            try {
                TimeUnit.MILLISECONDS.sleep(30);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            session.lock();
            try {
                session.endExchange();
            } finally {
                session.unlock();
            }
        });

        MigrationResult result = migrator(Duration.ofSeconds(5), Duration.ofMillis(20))
                .migrate(session, ProtocolKind.HTTP, ProtocolKind.WEBSOCKET, MigrationStrategy.GRACEFUL_DRAIN)
                .result();
        finisher.join();

        assertEquals(0, result.droppedConnections());
    }

    @Test
    void gracefulDrainDropsWhatIsStillInFlightAtTheDeadline() throws Exception {
        Session session = switchingSession(MigrationStrategy.GRACEFUL_DRAIN, Map.of());
        beginExchanges(session, 2);

        MigrationResult result = migrator().migrate(session,
                ProtocolKind.HTTP, ProtocolKind.WEBSOCKET, MigrationStrategy.GRACEFUL_DRAIN).result();

        assertEquals(2, result.droppedConnections());
    }

    @Test
    void gracefulDrainFailureRollsBackToTheOldConnection() throws Exception {
        ws.refuse(wsBackend);
        Session session = switchingSession(MigrationStrategy.GRACEFUL_DRAIN, Map.of());

        MigrationFailedException e = assertThrows(MigrationFailedException.class, () -> migrator().migrate(session,
                ProtocolKind.HTTP, ProtocolKind.WEBSOCKET, MigrationStrategy.GRACEFUL_DRAIN));

        assertTrue(e.rollbackPossible());
        assertEquals(ErrorKind.MIGRATION_FAILED, e.errorKind());
        try (AutoCloseableLock ignored = new AutoCloseableLock(session)) {
            assertTrue(session.primaryBinding().orElseThrow().isConnected());
            assertTrue(session.isAcceptingWork());
        }
        assertEquals(1, httpBackend.currentLoad());
        assertEquals(0, wsBackend.currentLoad());
    }

    // ---------------------------------------------------------------------
    // Immediate switch
    // ---------------------------------------------------------------------

    @Test
    void immediateSwitchDropsEverythingInFlight() throws Exception {
        Session session = switchingSession(MigrationStrategy.IMMEDIATE_SWITCH, Map.of());
        beginExchanges(session, 3);

        MigrationResult result = migrator().migrate(session,
                ProtocolKind.HTTP, ProtocolKind.WEBSOCKET, MigrationStrategy.IMMEDIATE_SWITCH).result();

        assertEquals(3, result.droppedConnections());
        assertEquals(0, http.openConnections());
    }

    @Test
    void immediateSwitchFailureCannotRollBack() throws Exception {
        ws.refuse(wsBackend);
        Session session = switchingSession(MigrationStrategy.IMMEDIATE_SWITCH, Map.of());

        MigrationFailedException e = assertThrows(MigrationFailedException.class, () -> migrator().migrate(session,
                ProtocolKind.HTTP, ProtocolKind.WEBSOCKET, MigrationStrategy.IMMEDIATE_SWITCH));

        assertFalse(e.rollbackPossible());
        try (AutoCloseableLock ignored = new AutoCloseableLock(session)) {
            assertTrue(session.primaryBinding().isEmpty());
        }
        assertEquals(0, httpBackend.currentLoad());
    }

    // ---------------------------------------------------------------------
    // Overlap transition
    // ---------------------------------------------------------------------

    @Test
    void overlapKeepsTheOldConnectionAuthoritativeDuringTheWindow() throws Exception {
        Session session = switchingSession(MigrationStrategy.OVERLAP_TRANSITION, Map.of());
        ConnectionMigrator migrator = migrator(Duration.ofMillis(50), Duration.ofMillis(300));

        CompletableFuture<ConnectionMigrator.Outcome> running = CompletableFuture.supplyAsync(() -> {
            try {
                return migrator.migrate(session,
                        ProtocolKind.HTTP, ProtocolKind.WEBSOCKET, MigrationStrategy.OVERLAP_TRANSITION);
            } catch (MigrationFailedException e) {
                throw new IllegalStateException(e);
            }
        });

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        boolean overlapping = false;
        while (!overlapping && System.nanoTime() < deadline) {
            try (AutoCloseableLock ignored = new AutoCloseableLock(session)) {
                overlapping = session.overlapBinding().isPresent();
                if (overlapping) {
                    SessionBinding used = session.beginExchange().orElseThrow();
                    assertEquals(ProtocolKind.HTTP, used.protocol(), "old connection carries traffic");
                    assertEquals(ProtocolKind.WEBSOCKET, session.overlapBinding().orElseThrow().protocol());
                    session.endExchange();
                }
            }
            if (!overlapping) {
                TimeUnit.MILLISECONDS.sleep(5);
            }
        }
        assertTrue(overlapping, "both connections should be live during the window");

        ConnectionMigrator.Outcome outcome = running.get(5, TimeUnit.SECONDS);
        assertEquals(0, outcome.result().droppedConnections());
        assertEquals(0, http.openConnections());
        assertEquals(1, ws.openConnections());
    }

    @Test
    void overlapFailureLeavesTheOldConnectionInPlace() throws Exception {
        ws.refuse(wsBackend);
        Session session = switchingSession(MigrationStrategy.OVERLAP_TRANSITION, Map.of());

        MigrationFailedException e = assertThrows(MigrationFailedException.class, () -> migrator().migrate(session,
                ProtocolKind.HTTP, ProtocolKind.WEBSOCKET, MigrationStrategy.OVERLAP_TRANSITION));

        assertTrue(e.rollbackPossible());
        assertEquals(1, http.openConnections());
    }

    // ---------------------------------------------------------------------
    // State preserving
    // ---------------------------------------------------------------------

    @Test
    void statePreservingRestoresTheApplicationState() throws Exception {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("user", "bob");
        state.put("step", 4);
        state.put("verified", true);
        state.put("items", List.of("x", "y"));
        state.put("limits", Map.of("daily", 10));
        Session session = switchingSession(MigrationStrategy.STATE_PRESERVING, state);

        ConnectionMigrator.Outcome outcome = migrator().migrate(session,
                ProtocolKind.HTTP, ProtocolKind.WEBSOCKET, MigrationStrategy.STATE_PRESERVING);

        assertEquals(state, session.applicationState());
        assertEquals(ProtocolKind.WEBSOCKET, outcome.binding().protocol());
        try (AutoCloseableLock ignored = new AutoCloseableLock(session)) {
            assertTrue(session.migrationPlan().orElseThrow().captured().isPresent());
            assertFalse(session.isAcceptingWork(), "no work admitted before the commit");
        }
    }

    @Test
    void unserializableStateFailsBeforeTheOldConnectionIsTouched() throws Exception {
        Session session = switchingSession(MigrationStrategy.STATE_PRESERVING, Map.of("opaque", new Object()));

        MigrationFailedException e = assertThrows(MigrationFailedException.class, () -> migrator().migrate(session,
                ProtocolKind.HTTP, ProtocolKind.WEBSOCKET, MigrationStrategy.STATE_PRESERVING));

        assertTrue(e.rollbackPossible());
        try (AutoCloseableLock ignored = new AutoCloseableLock(session)) {
            assertTrue(session.isAcceptingWork());
            assertTrue(session.primaryBinding().isPresent());
        }
        assertTrue(ws.opened().isEmpty());
    }

    @Test
    void statePreservingTargetFailureCannotRollBack() throws Exception {
        ws.refuse(wsBackend);
        Session session = switchingSession(MigrationStrategy.STATE_PRESERVING, Map.of("k", "v"));

        MigrationFailedException e = assertThrows(MigrationFailedException.class, () -> migrator().migrate(session,
                ProtocolKind.HTTP, ProtocolKind.WEBSOCKET, MigrationStrategy.STATE_PRESERVING));

        assertFalse(e.rollbackPossible());
    }

    // ---------------------------------------------------------------------
    // Preconditions
    // ---------------------------------------------------------------------

    @Test
    void noHealthyTargetIsReportedAsTheCause() throws Exception {
        registry.deregister(wsBackend);
        Session session = switchingSession(MigrationStrategy.GRACEFUL_DRAIN, Map.of());

        MigrationFailedException e = assertThrows(MigrationFailedException.class, () -> migrator().migrate(session,
                ProtocolKind.HTTP, ProtocolKind.WEBSOCKET, MigrationStrategy.GRACEFUL_DRAIN));

        assertInstanceOf(NoHealthyEndpointException.class, e.getCause());
    }

    @Test
    void migrationRequiresASwitchingSessionWithAMatchingPlan() throws Exception {
        Session session = switchingSession(MigrationStrategy.GRACEFUL_DRAIN, Map.of());

        assertThrows(IllegalArgumentException.class, () -> migrator().migrate(session,
                ProtocolKind.HTTP, ProtocolKind.WEBSOCKET, MigrationStrategy.IMMEDIATE_SWITCH));

        try (AutoCloseableLock ignored = new AutoCloseableLock(session)) {
            session.enterState(GatewayState.CONNECTED);
        }
        assertThrows(IllegalStateException.class, () -> migrator().migrate(session,
                ProtocolKind.HTTP, ProtocolKind.WEBSOCKET, MigrationStrategy.GRACEFUL_DRAIN));
    }

    /**
     * Scoped session lock for assertions.
     */
    private static final class AutoCloseableLock implements AutoCloseable {
        private final Session session;

        AutoCloseableLock(Session session) {
            this.session = session;
            session.lock();
        }

        @Override
        public void close() {
            session.unlock();
        }
    }
}
