package com.questrail.gateway.balance;

import com.questrail.gateway.adapter.FakeProtocolAdapter;
import com.questrail.gateway.adapter.TransportUnavailableException;
import com.questrail.gateway.api.ErrorKind;
import com.questrail.gateway.api.ProtocolKind;
import com.questrail.gateway.registry.Endpoint;
import com.questrail.gateway.registry.EndpointRegistry;
import com.questrail.gateway.registry.HealthProbes;
import com.questrail.gateway.session.SessionBinding;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BalancedConnectorTest
 * -----------------------------------------------------------------------------
 * Failover across refusing endpoints and load bookkeeping of bindings.
 */
class BalancedConnectorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private final EndpointRegistry registry = new EndpointRegistry();
    private final FakeProtocolAdapter adapter = new FakeProtocolAdapter(ProtocolKind.TCP);
    private final BalancedConnector connector = new BalancedConnector(
            new LoadBalancer(new RoundRobinStrategy(), registry), registry, kind -> adapter);

    private Endpoint register(int port) {
        Endpoint e = Endpoint.of(ProtocolKind.TCP, "10.0.0.2", port, 1);
        registry.register(e);
        return e;
    }

    @Test
    void refusingEndpointIsSkippedAndItsLoadGivenBack() throws Exception {
        Endpoint refusing = register(9001);
        Endpoint accepting = register(9002);
        adapter.refuse(refusing);

        SessionBinding binding = connector.connect(ProtocolKind.TCP, TIMEOUT);

        assertEquals(accepting, binding.endpoint());
        assertEquals(0, refusing.currentLoad());
        assertEquals(1, accepting.currentLoad());
        assertTrue(binding.isConnected());
    }

    @Test
    void everyEndpointRefusingIsTransportUnavailable() {
        Endpoint a = register(9001);
        Endpoint b = register(9002);
        adapter.refuse(a);
        adapter.refuse(b);

        TransportUnavailableException e = assertThrows(TransportUnavailableException.class,
                () -> connector.connect(ProtocolKind.TCP, TIMEOUT));

        assertEquals(ErrorKind.TRANSPORT_UNAVAILABLE, e.errorKind());
        assertEquals(1, e.getSuppressed().length, "earlier refusal kept as suppressed");
        assertEquals(0, a.currentLoad());
        assertEquals(0, b.currentLoad());
    }

    @Test
    void nothingHealthyIsNoHealthyEndpoint() {
        Endpoint only = register(9001);
        HealthProbes.markDown(registry, only);

        NoHealthyEndpointException e = assertThrows(NoHealthyEndpointException.class,
                () -> connector.connect(ProtocolKind.TCP, TIMEOUT));

        assertEquals(ProtocolKind.TCP, e.protocol());
        assertEquals(ErrorKind.NO_HEALTHY_ENDPOINT, e.errorKind());
        assertTrue(adapter.opened().isEmpty());
    }

    @Test
    void fullEndpointIsPassedOver() throws Exception {
        Endpoint small = new Endpoint(ProtocolKind.TCP, "10.0.0.2", 9001, 1, 1);
        Endpoint large = register(9002);
        registry.register(small);

        SessionBinding first = connector.connect(ProtocolKind.TCP, TIMEOUT);
        SessionBinding second = connector.connect(ProtocolKind.TCP, TIMEOUT);
        SessionBinding third = connector.connect(ProtocolKind.TCP, TIMEOUT);
        SessionBinding fourth = connector.connect(ProtocolKind.TCP, TIMEOUT);

        assertEquals(large, first.endpoint());
        assertEquals(small, second.endpoint());
        assertEquals(large, third.endpoint());
        assertEquals(large, fourth.endpoint(), "small is at maxLoad");
        assertEquals(1, small.currentLoad());
        assertEquals(3, large.currentLoad());
    }

    @Test
    void releaseClosesTheConnectionAndReturnsLoad() throws Exception {
        Endpoint e = register(9001);

        SessionBinding binding = connector.connect(ProtocolKind.TCP, TIMEOUT);
        assertEquals(1, e.currentLoad());

        connector.release(binding);

        assertFalse(binding.isConnected());
        assertEquals(0, e.currentLoad());
        assertEquals(0, adapter.openConnections());
    }
}
