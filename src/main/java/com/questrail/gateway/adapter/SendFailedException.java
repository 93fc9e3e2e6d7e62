package com.questrail.gateway.adapter;

import com.questrail.gateway.api.ErrorKind;

/**
 * The transport rejected a write or did not complete it within the write timeout.
 */
public final class SendFailedException extends TransportException
{
    public SendFailedException(String message)
    {
        super(message);
    }

    public SendFailedException(String message, Throwable cause)
    {
        super(message, cause);
    }

    @Override
    public ErrorKind errorKind()
    {
        return ErrorKind.SEND_FAILED;
    }
}
