package com.questrail.gateway.session;

import com.questrail.gateway.adapter.FakeProtocolAdapter;
import com.questrail.gateway.api.ProtocolKind;
import com.questrail.gateway.registry.Endpoint;
import com.questrail.gateway.state.GatewayState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SessionTest
 * -----------------------------------------------------------------------------
 * Work admission, drain and the lock discipline of the mutable fields.
 */
class SessionTest {

    private final FakeProtocolAdapter adapter = new FakeProtocolAdapter(ProtocolKind.TCP);
    private final Endpoint endpoint = Endpoint.of(ProtocolKind.TCP, "10.0.0.9", 9000, 1);
    private final Session session = new Session("s-1", ProtocolKind.HTTP, Map.of(), Instant.EPOCH, 0L);

    private SessionBinding binding() throws Exception {
        return new SessionBinding(adapter.connect(endpoint, Duration.ofSeconds(1)), endpoint, adapter);
    }

    @Test
    void bindingSwitchesTheCurrentProtocolAndAdmitsWorkOnceConnected() throws Exception {
        session.lock();
        try {
            assertTrue(session.beginExchange().isEmpty(), "idle sessions admit nothing");

            SessionBinding binding = binding();
            session.setPending(binding);
            session.bind(binding);
            assertEquals(ProtocolKind.TCP, session.currentProtocol());
            assertTrue(session.pendingBinding().isEmpty());
            assertTrue(session.beginExchange().isEmpty(), "still IDLE");

            session.enterState(GatewayState.CONNECTED);
            assertSame(binding, session.beginExchange().orElseThrow());
            assertEquals(1, session.inFlight());

            session.setAcceptingWork(false);
            assertTrue(session.beginExchange().isEmpty());
            session.endExchange();
            session.endExchange();
            assertEquals(0, session.inFlight());
        } finally {
            session.unlock();
        }
    }

    @Test
    void drainWaitsForTheLastExchange() throws Exception {
        session.lock();
        try {
            session.bind(binding());
            session.enterState(GatewayState.CONNECTED);
            session.beginExchange().orElseThrow();

            assertFalse(session.awaitDrained(20, TimeUnit.MILLISECONDS));

            Thread finisher = new Thread(() -> {
                session.lock();
                try {
                    session.endExchange();
                } finally {
                    session.unlock();
                }
            });
            finisher.start();

            assertTrue(session.awaitDrained(5, TimeUnit.SECONDS));
            finisher.join();
        } finally {
            session.unlock();
        }
    }

    @Test
    void unbindStopsAdmission() throws Exception {
        session.lock();
        try {
            SessionBinding binding = binding();
            session.bind(binding);
            session.enterState(GatewayState.CONNECTED);

            assertSame(binding, session.unbind().orElseThrow());
            assertTrue(session.beginExchange().isEmpty());
            assertThrows(IllegalStateException.class, () -> session.setOverlap(binding()),
                    "overlap needs a primary");
        } finally {
            session.unlock();
        }
    }

    @Test
    void guardedFieldsRequireTheLock() {
        assertThrows(IllegalStateException.class, session::primaryBinding);
        assertThrows(IllegalStateException.class, () -> session.enterState(GatewayState.ERROR));
        assertThrows(IllegalStateException.class, session::lastError);
        assertEquals(GatewayState.IDLE, session.state(), "state reads are lock-free");
    }

    @Test
    void applicationStateIsAnImmutableCopy() {
        Map<String, Object> source = new HashMap<>();
        source.put("user", "alice");
        session.replaceApplicationState(source);
        source.put("user", "mallory");

        session.putApplicationState("cart", 3);

        assertEquals("alice", session.applicationState().get("user"));
        assertEquals(3, session.applicationState().get("cart"));
        assertThrows(UnsupportedOperationException.class, () -> session.applicationState().put("x", 1));
    }

    @Test
    void exchangePermitAdmitsOneHolderAtATime() throws Exception {
        assertTrue(session.tryAcquireExchange(0L));
        assertFalse(session.tryAcquireExchange(TimeUnit.MILLISECONDS.toNanos(20)));

        session.releaseExchange();

        assertTrue(session.tryAcquireExchange(0L));
        session.releaseExchange();
    }

    @Test
    void exchangePermitIsNeverAwaitedUnderTheSessionLock() {
        session.lock();
        try {
            assertThrows(IllegalStateException.class, () -> session.tryAcquireExchange(0L));
        } finally {
            session.unlock();
        }
    }
}
