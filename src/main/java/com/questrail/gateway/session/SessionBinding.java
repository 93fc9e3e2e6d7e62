package com.questrail.gateway.session;

import com.questrail.gateway.adapter.Connection;
import com.questrail.gateway.adapter.ProtocolAdapter;
import com.questrail.gateway.api.ProtocolKind;
import com.questrail.gateway.registry.Endpoint;

import java.util.Objects;

/**
 * A session's hold on one backend connection: the connection, the endpoint
 * whose load it accounts for, and the adapter that drives it.
 */
public record SessionBinding(Connection connection, Endpoint endpoint, ProtocolAdapter adapter)
{
    public SessionBinding {
        Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(adapter, "adapter");
        if (adapter.kind() != connection.protocol()) {
            throw new IllegalArgumentException("Adapter " + adapter.kind() + " does not drive " + connection.protocol());
        }
    }

    public ProtocolKind protocol()
    {
        return connection.protocol();
    }

    public boolean isConnected()
    {
        return adapter.isConnected(connection);
    }

    @Override
    public String toString()
    {
        return "SessionBinding{" + connection.id() + " -> " + endpoint.id() + "}";
    }
}
