package com.questrail.gateway.balance;

import com.questrail.gateway.api.ProtocolKind;
import com.questrail.gateway.registry.Endpoint;

import java.util.List;

/**
 * Picks the candidate with the smallest current load that is still below its
 * {@code maxLoad}. Ties go to the earliest registered.
 */
public final class LeastConnectionsStrategy implements LoadBalancingStrategy
{
    @Override
    public Endpoint choose(ProtocolKind protocol, List<Endpoint> candidates)
    {
        Endpoint best = null;
        for (Endpoint e : candidates) {
            if (!e.hasCapacity()) {
                continue;
            }
            if (best == null || e.currentLoad() < best.currentLoad()) {
                best = e;
            }
        }
        return best;
    }
}
