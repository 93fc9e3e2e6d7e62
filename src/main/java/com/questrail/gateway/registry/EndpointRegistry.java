package com.questrail.gateway.registry;

import com.questrail.gateway.api.ProtocolKind;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * EndpointRegistry
 * =============================================================================
 * Backend endpoints per protocol, in registration order.
 *
 * <h2>Concurrency</h2>
 * The health checker and every dispatching worker touch this structure
 * concurrently. A single monitor guards membership and the mutable
 * {@code healthy} / {@code currentLoad} fields of every endpoint. It is held
 * only for the read or update itself, never across a network call.
 *
 * <h2>Writers</h2>
 * {@code healthy} is written only by {@link HealthChecker} (through
 * {@link #updateHealth}); {@code currentLoad} only through {@link #acquire} and
 * {@link #release}, which the load balancer calls around each dispatch.
 */
public final class EndpointRegistry
{
    private final Object lock = new Object();
    private final Map<ProtocolKind, List<Endpoint>> byProtocol = new EnumMap<>(ProtocolKind.class);

    /**
     * @return {@code false} if an equal endpoint is already registered
     */
    public boolean register(Endpoint endpoint)
    {
        Objects.requireNonNull(endpoint, "endpoint");
        synchronized (lock) {
            List<Endpoint> list = byProtocol.computeIfAbsent(endpoint.protocol(), k -> new ArrayList<>());
            if (list.contains(endpoint)) {
                return false;
            }
            list.add(endpoint);
            return true;
        }
    }

    /**
     * Remove an endpoint. Connections already bound to it keep working and
     * still release their load against it.
     *
     * @return {@code false} if it was not registered
     */
    public boolean deregister(Endpoint endpoint)
    {
        Objects.requireNonNull(endpoint, "endpoint");
        synchronized (lock) {
            List<Endpoint> list = byProtocol.get(endpoint.protocol());
            return list != null && list.remove(endpoint);
        }
    }

    /**
     * Snapshot of the endpoints registered for {@code protocol}, healthy or not,
     * in registration order.
     */
    public List<Endpoint> endpointsFor(ProtocolKind protocol)
    {
        synchronized (lock) {
            List<Endpoint> list = byProtocol.get(protocol);
            return list == null ? List.of() : List.copyOf(list);
        }
    }

    public List<Endpoint> all()
    {
        synchronized (lock) {
            List<Endpoint> out = new ArrayList<>();
            byProtocol.values().forEach(out::addAll);
            return List.copyOf(out);
        }
    }

    public boolean isRegistered(Endpoint endpoint)
    {
        synchronized (lock) {
            List<Endpoint> list = byProtocol.get(endpoint.protocol());
            return list != null && list.contains(endpoint);
        }
    }

    // -------------------------------------------------------------------------
    // Load accounting
    // -------------------------------------------------------------------------

    /**
     * Count one more dispatch against {@code endpoint} if it has capacity.
     *
     * @return {@code false} if the endpoint is already at {@code maxLoad}
     */
    public boolean acquire(Endpoint endpoint)
    {
        synchronized (lock) {
            if (!endpoint.hasCapacity()) {
                return false;
            }
            endpoint.setCurrentLoad(endpoint.currentLoad() + 1);
            return true;
        }
    }

    /**
     * Count one dispatch less. Never drives the load below zero.
     */
    public void release(Endpoint endpoint)
    {
        synchronized (lock) {
            if (endpoint.currentLoad() > 0) {
                endpoint.setCurrentLoad(endpoint.currentLoad() - 1);
            }
        }
    }

    // -------------------------------------------------------------------------
    // Health (health checker only)
    // -------------------------------------------------------------------------

    /**
     * @return {@code true} if the health flag changed
     */
    boolean updateHealth(Endpoint endpoint, boolean healthy)
    {
        synchronized (lock) {
            boolean changed = endpoint.isHealthy() != healthy;
            endpoint.setHealthy(healthy);
            return changed;
        }
    }
}
