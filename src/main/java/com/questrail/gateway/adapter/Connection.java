package com.questrail.gateway.adapter;

import com.questrail.gateway.api.ProtocolKind;
import com.questrail.gateway.registry.Endpoint;

/**
 * Opaque handle to one transport-level connection opened by a
 * {@link ProtocolAdapter}. Only the adapter that created a connection may
 * operate on it.
 */
public interface Connection
{
    /**
     * Unique id, stable for the lifetime of the connection.
     */
    String id();

    ProtocolKind protocol();

    /**
     * Backend endpoint this connection targets.
     */
    Endpoint endpoint();
}
