package com.questrail.gateway.adapter;

import com.questrail.gateway.api.GatewayException;

/**
 * Base type for every failure a {@link ProtocolAdapter} can report.
 *
 * <p>Adapter failures are checked: callers (the session lifecycle, the migrator,
 * the health checker) must decide explicitly whether a failure becomes a state
 * machine event, a retry against another endpoint, or a health flip.</p>
 */
public abstract class TransportException extends GatewayException
{
    protected TransportException(String message)
    {
        super(message);
    }

    protected TransportException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
