package com.questrail.gateway.adapter;

import com.questrail.gateway.api.ErrorKind;

/**
 * The target endpoint could not be reached within the connect deadline, refused
 * the connection, or (for datagram transports) is not addressable. The load
 * balancer reacts by trying a different endpoint, never the same one again.
 */
public final class TransportUnavailableException extends TransportException
{
    public TransportUnavailableException(String message)
    {
        super(message);
    }

    public TransportUnavailableException(String message, Throwable cause)
    {
        super(message, cause);
    }

    @Override
    public ErrorKind errorKind()
    {
        return ErrorKind.TRANSPORT_UNAVAILABLE;
    }
}
