package com.questrail.gateway.balance;

import com.questrail.gateway.api.ProtocolKind;
import com.questrail.gateway.registry.Endpoint;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cycles through the candidates in registration order with one counter per
 * protocol. Over {@code N x k} calls with a stable set of {@code N} healthy
 * endpoints, each is chosen exactly {@code k} times.
 */
public final class RoundRobinStrategy implements LoadBalancingStrategy
{
    private final Map<ProtocolKind, AtomicLong> counters = new ConcurrentHashMap<>();

    @Override
    public Endpoint choose(ProtocolKind protocol, List<Endpoint> candidates)
    {
        if (candidates.isEmpty()) {
            return null;
        }
        long tick = counters.computeIfAbsent(protocol, k -> new AtomicLong()).getAndIncrement();
        return candidates.get((int) Math.floorMod(tick, (long) candidates.size()));
    }
}
