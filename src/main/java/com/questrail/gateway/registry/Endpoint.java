package com.questrail.gateway.registry;

import com.questrail.gateway.api.ProtocolKind;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Endpoint
 * -----------------------------------------------------------------------------
 * One backend target a session can be dispatched to.
 *
 * <h2>Ownership of mutable fields</h2>
 * Identity ({@code protocol, address, port}) and sizing ({@code weight,
 * maxLoad}) are fixed at registration. The two mutable fields have exactly one
 * writer each, and both writes happen under the {@link EndpointRegistry} lock:
 * <ul>
 *   <li>{@code healthy} is written only by the {@link HealthChecker}</li>
 *   <li>{@code currentLoad} is written only through
 *       {@link EndpointRegistry#acquire(Endpoint)} / {@link EndpointRegistry#release(Endpoint)}
 *       on behalf of the load balancer</li>
 * </ul>
 * Reads are lock-free via volatile fields.
 *
 * <p>A new endpoint starts healthy so it can take traffic before the first
 * health-check round completes.</p>
 */
public final class Endpoint
{
    private final ProtocolKind protocol;
    private final String address;
    private final int port;
    private final int weight;
    private final int maxLoad;

    private volatile boolean healthy = true;
    private volatile int currentLoad;

    public Endpoint(ProtocolKind protocol, String address, int port, int weight, int maxLoad)
    {
        this.protocol = Objects.requireNonNull(protocol, "protocol");
        this.address = Objects.requireNonNull(address, "address");
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (weight <= 0) {
            throw new IllegalArgumentException("weight must be > 0");
        }
        if (maxLoad <= 0) {
            throw new IllegalArgumentException("maxLoad must be > 0");
        }
        this.port = port;
        this.weight = weight;
        this.maxLoad = maxLoad;
    }

    /**
     * Endpoint with an effectively unbounded capacity.
     */
    public static Endpoint of(ProtocolKind protocol, String address, int port, int weight)
    {
        return new Endpoint(protocol, address, port, weight, Integer.MAX_VALUE);
    }

    public ProtocolKind protocol()
    {
        return protocol;
    }

    public String address()
    {
        return address;
    }

    public int port()
    {
        return port;
    }

    public int weight()
    {
        return weight;
    }

    public int maxLoad()
    {
        return maxLoad;
    }

    public boolean isHealthy()
    {
        return healthy;
    }

    public int currentLoad()
    {
        return currentLoad;
    }

    public boolean hasCapacity()
    {
        return currentLoad < maxLoad;
    }

    public InetSocketAddress socketAddress()
    {
        return new InetSocketAddress(address, port);
    }

    /**
     * Stable identity: {@code protocol://address:port}.
     */
    public String id()
    {
        return protocol.wireName() + "://" + address + ":" + port;
    }

    // Mutators are reachable only from this package and only under the registry lock.

    void setHealthy(boolean healthy)
    {
        this.healthy = healthy;
    }

    void setCurrentLoad(int currentLoad)
    {
        this.currentLoad = currentLoad;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Endpoint other)) {
            return false;
        }
        return protocol == other.protocol && port == other.port && address.equals(other.address);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(protocol, address, port);
    }

    @Override
    public String toString()
    {
        return id() + "{weight=" + weight + ", load=" + currentLoad + "/"
                + (maxLoad == Integer.MAX_VALUE ? "unbounded" : maxLoad)
                + ", healthy=" + healthy + "}";
    }
}
