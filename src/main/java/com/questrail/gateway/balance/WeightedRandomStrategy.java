package com.questrail.gateway.balance;

import com.questrail.gateway.api.ProtocolKind;
import com.questrail.gateway.registry.Endpoint;

import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Draws an endpoint with probability proportional to its weight. The random
 * source is injected so tests can seed it.
 */
public final class WeightedRandomStrategy implements LoadBalancingStrategy
{
    private final Random random;

    public WeightedRandomStrategy()
    {
        this(new Random());
    }

    public WeightedRandomStrategy(Random random)
    {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public Endpoint choose(ProtocolKind protocol, List<Endpoint> candidates)
    {
        if (candidates.isEmpty()) {
            return null;
        }
        long total = 0;
        for (Endpoint e : candidates) {
            total += e.weight();
        }

        double pick;
        synchronized (random) {
            pick = random.nextDouble() * total;
        }
        double cumulative = 0;
        for (Endpoint e : candidates) {
            cumulative += e.weight();
            if (pick < cumulative) {
                return e;
            }
        }
        // Rounding at the top edge.
        return candidates.get(candidates.size() - 1);
    }
}
