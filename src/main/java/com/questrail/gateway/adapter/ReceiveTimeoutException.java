package com.questrail.gateway.adapter;

import com.questrail.gateway.api.ErrorKind;

/**
 * No complete message arrived before the caller's deadline.
 */
public final class ReceiveTimeoutException extends TransportException
{
    public ReceiveTimeoutException(String message)
    {
        super(message);
    }

    public ReceiveTimeoutException(String message, Throwable cause)
    {
        super(message, cause);
    }

    @Override
    public ErrorKind errorKind()
    {
        return ErrorKind.RECEIVE_TIMEOUT;
    }
}
