package com.questrail.gateway.adapter;

import com.questrail.gateway.api.ErrorKind;

/**
 * The connection closed while a caller was waiting to receive and nothing was
 * buffered. Reported as a receive failure so callers handle it like a timeout
 * that fired early.
 */
public final class ConnectionClosedException extends TransportException
{
    public ConnectionClosedException(String message)
    {
        super(message);
    }

    public ConnectionClosedException(String message, Throwable cause)
    {
        super(message, cause);
    }

    @Override
    public ErrorKind errorKind()
    {
        return ErrorKind.RECEIVE_TIMEOUT;
    }
}
