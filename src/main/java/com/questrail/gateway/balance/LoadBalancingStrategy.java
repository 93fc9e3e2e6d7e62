package com.questrail.gateway.balance;

import com.questrail.gateway.api.ProtocolKind;
import com.questrail.gateway.registry.Endpoint;

import java.util.List;

/**
 * Picks one endpoint among candidates that are already known to be healthy and
 * of the requested protocol, in registration order.
 */
public interface LoadBalancingStrategy
{
    /**
     * @param candidates non-empty, healthy, same protocol, registration order
     * @return the chosen endpoint, or {@code null} if none is acceptable
     */
    Endpoint choose(ProtocolKind protocol, List<Endpoint> candidates);
}
