package com.questrail.gateway.balance;

import com.questrail.gateway.api.ProtocolKind;
import com.questrail.gateway.registry.Endpoint;
import com.questrail.gateway.registry.EndpointRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * LoadBalancer
 * -----------------------------------------------------------------------------
 * Selects a backend endpoint for a protocol and accounts for its load.
 *
 * <p>Only healthy endpoints of the requested protocol are ever offered to the
 * strategy. When there are none, {@link #selectEndpoint} returns {@code null}:
 * callers MUST treat that as a hard failure of the dispatch. There is no
 * fallback to an unhealthy endpoint.</p>
 */
public final class LoadBalancer
{
    private final LoadBalancingStrategy strategy;
    private final EndpointRegistry registry;

    public LoadBalancer(LoadBalancingStrategy strategy, EndpointRegistry registry)
    {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public Endpoint selectEndpoint(ProtocolKind protocol, List<Endpoint> endpoints)
    {
        Objects.requireNonNull(protocol, "protocol");
        Objects.requireNonNull(endpoints, "endpoints");

        List<Endpoint> healthy = new ArrayList<>(endpoints.size());
        for (Endpoint e : endpoints) {
            if (e.protocol() == protocol && e.isHealthy()) {
                healthy.add(e);
            }
        }
        return healthy.isEmpty() ? null : strategy.choose(protocol, healthy);
    }

    /**
     * Select among the endpoints currently registered for {@code protocol}.
     */
    public Endpoint selectEndpoint(ProtocolKind protocol)
    {
        return selectEndpoint(protocol, registry.endpointsFor(protocol));
    }

    /**
     * Count a dispatch against {@code endpoint}.
     *
     * @return {@code false} if the endpoint is at capacity
     */
    public boolean acquire(Endpoint endpoint)
    {
        return registry.acquire(endpoint);
    }

    public void release(Endpoint endpoint)
    {
        registry.release(endpoint);
    }

    public LoadBalancingStrategy strategy()
    {
        return strategy;
    }
}
