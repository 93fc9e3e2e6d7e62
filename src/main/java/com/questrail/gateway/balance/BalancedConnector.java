package com.questrail.gateway.balance;

import com.questrail.gateway.adapter.Connection;
import com.questrail.gateway.adapter.ProtocolAdapter;
import com.questrail.gateway.adapter.TransportUnavailableException;
import com.questrail.gateway.api.ProtocolKind;
import com.questrail.gateway.registry.Endpoint;
import com.questrail.gateway.registry.EndpointRegistry;
import com.questrail.gateway.session.SessionBinding;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Opens a backend connection for a protocol through the load balancer.
 *
 * <p>An endpoint that refuses the connection is not retried; the next one the
 * balancer selects among the remaining endpoints is tried instead, until none
 * is left. The load acquired for the chosen endpoint is held by the returned
 * binding and given back by {@link #release(SessionBinding)}.</p>
 */
public final class BalancedConnector
{
    private static final Logger log = LoggerFactory.getLogger(BalancedConnector.class);

    private final LoadBalancer balancer;
    private final EndpointRegistry registry;
    private final Function<ProtocolKind, ProtocolAdapter> adapters;

    public BalancedConnector(LoadBalancer balancer,
                             EndpointRegistry registry,
                             Function<ProtocolKind, ProtocolAdapter> adapters)
    {
        this.balancer = Objects.requireNonNull(balancer, "balancer");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.adapters = Objects.requireNonNull(adapters, "adapters");
    }

    /**
     * @throws NoHealthyEndpointException    if no healthy endpoint with capacity exists
     * @throws TransportUnavailableException if every candidate refused; carries the last failure
     */
    public SessionBinding connect(ProtocolKind protocol, Duration timeout)
            throws NoHealthyEndpointException, TransportUnavailableException
    {
        Objects.requireNonNull(protocol, "protocol");
        Objects.requireNonNull(timeout, "timeout");

        ProtocolAdapter adapter = adapters.apply(protocol);
        Set<Endpoint> tried = new HashSet<>();
        TransportUnavailableException last = null;

        while (true) {
            List<Endpoint> remaining = new ArrayList<>(registry.endpointsFor(protocol));
            remaining.removeAll(tried);

            Endpoint endpoint = balancer.selectEndpoint(protocol, remaining);
            if (endpoint == null) {
                if (last == null) {
                    throw new NoHealthyEndpointException(protocol);
                }
                throw last;
            }
            tried.add(endpoint);
            if (!balancer.acquire(endpoint)) {
                continue;
            }

            try {
                Connection connection = adapter.connect(endpoint, timeout);
                return new SessionBinding(connection, endpoint, adapter);
            } catch (TransportUnavailableException e) {
                balancer.release(endpoint);
                log.debug("Endpoint {} unavailable, trying another: {}", endpoint.id(), e.getMessage());
                if (last != null) {
                    e.addSuppressed(last);
                }
                last = e;
            }
        }
    }

    /**
     * Close the binding's connection and give its load back. Call once per binding.
     */
    public void release(SessionBinding binding)
    {
        Objects.requireNonNull(binding, "binding");
        try {
            binding.adapter().disconnect(binding.connection());
        } finally {
            balancer.release(binding.endpoint());
        }
    }
}
