package com.questrail.gateway.runtime;

import com.questrail.gateway.api.ErrorKind;
import com.questrail.gateway.api.GatewayException;

/**
 * Thrown by a {@link RequestHandler} that could not produce a reply.
 */
public class RequestHandlerException extends GatewayException
{
    public RequestHandlerException(String message)
    {
        super(message);
    }

    public RequestHandlerException(String message, Throwable cause)
    {
        super(message, cause);
    }

    @Override
    public ErrorKind errorKind()
    {
        return ErrorKind.HANDLER_FAILED;
    }
}
