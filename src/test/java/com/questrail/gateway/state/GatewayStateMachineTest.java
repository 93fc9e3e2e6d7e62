package com.questrail.gateway.state;

import com.questrail.gateway.adapter.FakeProtocolAdapter;
import com.questrail.gateway.adapter.TransportUnavailableException;
import com.questrail.gateway.api.ErrorKind;
import com.questrail.gateway.api.ProtocolKind;
import com.questrail.gateway.migration.MigrationStrategy;
import com.questrail.gateway.observability.RecordingObservabilitySink;
import com.questrail.gateway.observability.SessionStateTransitionEvent;
import com.questrail.gateway.registry.Endpoint;
import com.questrail.gateway.session.Session;
import com.questrail.gateway.session.SessionBinding;
import com.questrail.gateway.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * GatewayStateMachineTest
 * -----------------------------------------------------------------------------
 * Exercises the standard transition table through the state machine with
 * recording lifecycle actions. No transport, no threads.
 */
class GatewayStateMachineTest {

    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final FakeProtocolAdapter adapter = new FakeProtocolAdapter(ProtocolKind.HTTP);
    private final Endpoint endpoint = Endpoint.of(ProtocolKind.HTTP, "127.0.0.1", 8080, 1);

    private final List<String> calls = new ArrayList<>();
    private RecordingActions actions;
    private GatewayStateMachine machine;

    /**
     * Records every action call; individual tests make chosen calls fail.
     */
    private final class RecordingActions implements LifecycleActions {
        Exception failOpen;
        Exception failCommit;
        RuntimeException failBegin;
        boolean interruptTeardown;
        String refuseSwitch;

        @Override
        public Optional<String> canSwitch(Session session, SessionEvent.Switch event) {
            return Optional.ofNullable(refuseSwitch);
        }

        @Override
        public void openConnection(Session session, SessionEvent.Connect event) throws Exception {
            calls.add("open");
            if (failOpen != null) {
                throw failOpen;
            }
        }

        @Override
        public void bindConnection(Session session, SessionEvent.Connected event) {
            calls.add("bind");
        }

        @Override
        public void beginMigration(Session session, SessionEvent.Switch event) {
            calls.add("begin");
            if (failBegin != null) {
                throw failBegin;
            }
        }

        @Override
        public void commitMigration(Session session, SessionEvent.Switched event) throws Exception {
            calls.add("commit");
            if (failCommit != null) {
                throw failCommit;
            }
        }

        @Override
        public void abortMigration(Session session, SessionEvent.Error event) {
            calls.add("abort:" + event.kind());
        }

        @Override
        public void beginTeardown(Session session, SessionEvent.Disconnect event) throws InterruptedException {
            calls.add("teardown");
            if (interruptTeardown) {
                throw new InterruptedException("drain wait interrupted");
            }
        }

        @Override
        public void releaseResources(Session session, SessionEvent.Disconnected event) {
            calls.add("release");
        }
    }

    @BeforeEach
    void setUp() {
        actions = new RecordingActions();
        machine = new GatewayStateMachine(TransitionTable.standard(actions), clock, () -> Instant.EPOCH, sink);
    }

    private Session newSession() {
        return new Session("s-1", ProtocolKind.HTTP, Map.of(), Instant.EPOCH, clock.nowNanos());
    }

    private Session sessionIn(GatewayState state) {
        Session session = newSession();
        session.lock();
        try {
            session.enterState(state);
        } finally {
            session.unlock();
        }
        return session;
    }

    private SessionBinding binding() throws TransportUnavailableException {
        return new SessionBinding(adapter.connect(endpoint, Duration.ofSeconds(1)), endpoint, adapter);
    }

    private Map<SessionEvent.Type, SessionEvent> sampleEvents() throws Exception {
        Map<SessionEvent.Type, SessionEvent> events = new EnumMap<>(SessionEvent.Type.class);
        events.put(SessionEvent.Type.CONNECT, new SessionEvent.Connect(ProtocolKind.HTTP));
        events.put(SessionEvent.Type.CONNECTED, new SessionEvent.Connected(binding()));
        events.put(SessionEvent.Type.SWITCH, new SessionEvent.Switch(ProtocolKind.TCP, MigrationStrategy.IMMEDIATE_SWITCH));
        events.put(SessionEvent.Type.SWITCHED, new SessionEvent.Switched(binding()));
        events.put(SessionEvent.Type.ROLLED_BACK, new SessionEvent.RolledBack(MigrationStrategy.GRACEFUL_DRAIN, "test"));
        events.put(SessionEvent.Type.ERROR, new SessionEvent.Error(null, ErrorKind.SEND_FAILED, "test", null));
        events.put(SessionEvent.Type.DISCONNECT, new SessionEvent.Disconnect("test", Duration.ZERO));
        events.put(SessionEvent.Type.DISCONNECTED, new SessionEvent.Disconnected());
        events.put(SessionEvent.Type.RETRY, new SessionEvent.Retry());
        return events;
    }

    // ---------------------------------------------------------------------
    // Legality
    // ---------------------------------------------------------------------

    @Test
    void everyPairOutsideTheTableIsRejectedAndLeavesStateUnchanged() throws Exception {
        Map<SessionEvent.Type, SessionEvent> events = sampleEvents();
        int rejected = 0;

        for (GatewayState state : GatewayState.values()) {
            for (SessionEvent.Type type : SessionEvent.Type.values()) {
                if (machine.table().isLegal(state, type)) {
                    continue;
                }
                Session session = sessionIn(state);
                TransitionResult result = machine.fire(session, events.get(type));

                TransitionResult.Rejected r = assertInstanceOf(TransitionResult.Rejected.class, result,
                        state + " + " + type);
                assertEquals(state, session.state(), state + " + " + type);
                ErrorKind expected = state == GatewayState.SWITCHING && type == SessionEvent.Type.SWITCH
                        ? ErrorKind.MIGRATION_IN_PROGRESS
                        : ErrorKind.INVALID_TRANSITION;
                assertEquals(expected, r.kind(), state + " + " + type);
                rejected++;
            }
        }

        assertEquals(GatewayState.values().length * SessionEvent.Type.values().length - 10, rejected);
        assertTrue(calls.isEmpty(), "no action may run for a rejected event");
        assertTrue(sink.getStateTransitions().isEmpty());
    }

    @Test
    void tableHasExactlyTheLifecycleRows() {
        TransitionTable table = machine.table();

        assertTrue(table.isLegal(GatewayState.IDLE, SessionEvent.Type.CONNECT));
        assertTrue(table.isLegal(GatewayState.CONNECTING, SessionEvent.Type.CONNECTED));
        assertTrue(table.isLegal(GatewayState.CONNECTING, SessionEvent.Type.ERROR));
        assertTrue(table.isLegal(GatewayState.CONNECTED, SessionEvent.Type.SWITCH));
        assertTrue(table.isLegal(GatewayState.SWITCHING, SessionEvent.Type.SWITCHED));
        assertTrue(table.isLegal(GatewayState.SWITCHING, SessionEvent.Type.ROLLED_BACK));
        assertTrue(table.isLegal(GatewayState.SWITCHING, SessionEvent.Type.ERROR));
        assertTrue(table.isLegal(GatewayState.CONNECTED, SessionEvent.Type.DISCONNECT));
        assertTrue(table.isLegal(GatewayState.DISCONNECTING, SessionEvent.Type.DISCONNECTED));
        assertTrue(table.isLegal(GatewayState.ERROR, SessionEvent.Type.RETRY));

        assertFalse(table.isLegal(GatewayState.CONNECTED, SessionEvent.Type.ERROR));
        assertFalse(table.isLegal(GatewayState.ERROR, SessionEvent.Type.CONNECT));
        assertEquals(2, table.rowsFrom(GatewayState.CONNECTED).size());
        assertTrue(table.rowsFrom(GatewayState.IDLE).stream().allMatch(r -> r.to() == GatewayState.CONNECTING));
    }

    // ---------------------------------------------------------------------
    // Happy path
    // ---------------------------------------------------------------------

    @Test
    void fullLifecycleRunsActionsInOrderAndPublishesTransitions() throws Exception {
        Session session = newSession();

        assertTrue(machine.fire(session, new SessionEvent.Connect(ProtocolKind.HTTP)).isTransitioned());
        assertTrue(machine.fire(session, new SessionEvent.Connected(binding())).isTransitioned());
        assertEquals(GatewayState.CONNECTED, session.state());

        TransitionResult switching = machine.fire(session,
                new SessionEvent.Switch(ProtocolKind.WEBSOCKET, MigrationStrategy.GRACEFUL_DRAIN));
        assertEquals(GatewayState.SWITCHING, switching.stateAfter());
        assertTrue(machine.fire(session, new SessionEvent.Switched(binding())).isTransitioned());

        assertTrue(machine.fire(session, new SessionEvent.Disconnect("done", Duration.ZERO)).isTransitioned());
        assertTrue(machine.fire(session, new SessionEvent.Disconnected()).isTransitioned());
        assertEquals(GatewayState.IDLE, session.state());

        assertEquals(List.of("open", "bind", "begin", "commit", "teardown", "release"), calls);

        List<SessionStateTransitionEvent> published = sink.getStateTransitions();
        assertEquals(6, published.size());
        assertEquals(GatewayState.IDLE, published.get(0).oldState());
        assertEquals(GatewayState.CONNECTING, published.get(0).newState());
        assertEquals(GatewayState.IDLE, published.get(5).newState());
        assertTrue(published.stream().noneMatch(SessionStateTransitionEvent::isFailure));
    }

    @Test
    void rolledBackReturnsToConnected() {
        Session session = sessionIn(GatewayState.SWITCHING);

        TransitionResult result = machine.fire(session,
                new SessionEvent.RolledBack(MigrationStrategy.OVERLAP_TRANSITION, "target refused"));

        assertEquals(new TransitionResult.Transitioned(GatewayState.SWITCHING, GatewayState.CONNECTED,
                new SessionEvent.RolledBack(MigrationStrategy.OVERLAP_TRANSITION, "target refused")), result);
        assertEquals(GatewayState.CONNECTED, session.state());
    }

    // ---------------------------------------------------------------------
    // Guards
    // ---------------------------------------------------------------------

    @Test
    void guardRefusalIsAnInvalidTransition() {
        actions.refuseSwitch = "already on tcp";
        Session session = sessionIn(GatewayState.CONNECTED);

        TransitionResult result = machine.fire(session,
                new SessionEvent.Switch(ProtocolKind.TCP, MigrationStrategy.IMMEDIATE_SWITCH));

        TransitionResult.Rejected rejected = assertInstanceOf(TransitionResult.Rejected.class, result);
        assertEquals(ErrorKind.INVALID_TRANSITION, rejected.kind());
        assertEquals("already on tcp", rejected.reason());
        assertEquals(GatewayState.CONNECTED, session.state());
        assertTrue(calls.isEmpty());
    }

    // ---------------------------------------------------------------------
    // Action failures
    // ---------------------------------------------------------------------

    @Test
    void failingConnectActionMovesToErrorWithTransportKind() {
        actions.failOpen = new TransportUnavailableException("nobody home");
        clock.advanceMillis(42);
        Session session = newSession();

        TransitionResult result = machine.fire(session, new SessionEvent.Connect(ProtocolKind.HTTP));

        TransitionResult.Failed failed = assertInstanceOf(TransitionResult.Failed.class, result);
        assertEquals(GatewayState.IDLE, failed.from());
        assertEquals(ErrorKind.TRANSPORT_UNAVAILABLE, failed.error().kind());
        assertEquals(SessionEvent.Type.CONNECT, failed.error().trigger().type());
        assertEquals(GatewayState.ERROR, session.state());

        session.lock();
        try {
            assertEquals(ErrorKind.TRANSPORT_UNAVAILABLE, session.lastError().orElseThrow().kind());
            assertEquals(42_000_000L, session.errorAtNanos());
        } finally {
            session.unlock();
        }
        assertTrue(sink.getStateTransitions().get(0).isFailure());
    }

    @Test
    void failingCommitRunsTheSwitchingErrorRowFirst() {
        actions.failCommit = new IllegalStateException("binding vanished");
        Session session = sessionIn(GatewayState.SWITCHING);

        TransitionResult result = assertDoesNotThrow(() -> machine.fire(session, new SessionEvent.Switched(binding())));

        TransitionResult.Failed failed = assertInstanceOf(TransitionResult.Failed.class, result);
        assertEquals(ErrorKind.MIGRATION_FAILED, failed.error().kind());
        assertEquals(List.of("commit", "abort:MIGRATION_FAILED"), calls);
        assertEquals(GatewayState.ERROR, session.state());
    }

    @Test
    void runtimeFailureInSwitchActionIsMigrationFailed() {
        actions.failBegin = new IllegalArgumentException("bad plan");
        Session session = sessionIn(GatewayState.CONNECTED);

        TransitionResult result = machine.fire(session,
                new SessionEvent.Switch(ProtocolKind.UDP, MigrationStrategy.STATE_PRESERVING));

        TransitionResult.Failed failed = assertInstanceOf(TransitionResult.Failed.class, result);
        assertEquals(ErrorKind.MIGRATION_FAILED, failed.toGatewayError().kind());
        assertEquals("bad plan", failed.toGatewayError().message());
        assertEquals(GatewayState.ERROR, session.state());
    }

    @Test
    void interruptedTeardownKeepsTheInterruptFlag() {
        actions.interruptTeardown = true;
        Session session = sessionIn(GatewayState.CONNECTED);

        TransitionResult result = machine.fire(session, new SessionEvent.Disconnect("stop", Duration.ofSeconds(1)));

        boolean interrupted = Thread.interrupted();
        assertTrue(interrupted, "interrupt status must survive the failed action");
        TransitionResult.Failed failed = assertInstanceOf(TransitionResult.Failed.class, result);
        assertEquals(GatewayState.CONNECTED, failed.from());
        assertEquals("drain wait interrupted", failed.error().reason());
        assertEquals(GatewayState.ERROR, session.state());
    }

    @Test
    void uninterruptedFailureLeavesTheInterruptFlagClear() {
        actions.failBegin = new IllegalArgumentException("bad plan");
        Session session = sessionIn(GatewayState.CONNECTED);

        machine.fire(session, new SessionEvent.Switch(ProtocolKind.UDP, MigrationStrategy.STATE_PRESERVING));

        assertFalse(Thread.interrupted());
    }

    @Test
    void reportedErrorWhileConnectingIsRecorded() {
        Session session = sessionIn(GatewayState.CONNECTING);
        clock.advanceMillis(7);

        TransitionResult result = machine.fire(session,
                new SessionEvent.Error(null, ErrorKind.NO_HEALTHY_ENDPOINT, "none left", null));

        assertTrue(result.isTransitioned());
        session.lock();
        try {
            assertEquals(ErrorKind.NO_HEALTHY_ENDPOINT, session.lastError().orElseThrow().kind());
            assertEquals(7_000_000L, session.errorAtNanos());
        } finally {
            session.unlock();
        }
    }
}
