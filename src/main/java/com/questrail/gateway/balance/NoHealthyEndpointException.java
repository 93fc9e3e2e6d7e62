package com.questrail.gateway.balance;

import com.questrail.gateway.api.ErrorKind;
import com.questrail.gateway.api.GatewayException;
import com.questrail.gateway.api.ProtocolKind;

/**
 * No healthy endpoint with spare capacity exists for a protocol.
 */
public final class NoHealthyEndpointException extends GatewayException
{
    private final ProtocolKind protocol;

    public NoHealthyEndpointException(ProtocolKind protocol)
    {
        super("No healthy endpoint available for " + protocol);
        this.protocol = protocol;
    }

    public ProtocolKind protocol()
    {
        return protocol;
    }

    @Override
    public ErrorKind errorKind()
    {
        return ErrorKind.NO_HEALTHY_ENDPOINT;
    }
}
