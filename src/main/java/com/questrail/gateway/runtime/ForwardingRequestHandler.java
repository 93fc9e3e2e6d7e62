package com.questrail.gateway.runtime;

import com.questrail.gateway.api.GatewayError;
import com.questrail.gateway.api.GatewayResult;
import com.questrail.gateway.api.Message;
import com.questrail.gateway.session.Session;

import java.time.Duration;
import java.util.Objects;

/**
 * Default handler: forwards the inbound payload unchanged over the session's
 * backend connection and returns the backend's reply unchanged.
 */
public final class ForwardingRequestHandler implements RequestHandler
{
    private final Duration replyTimeout;

    public ForwardingRequestHandler(Duration replyTimeout)
    {
        this.replyTimeout = Objects.requireNonNull(replyTimeout, "replyTimeout");
    }

    @Override
    public byte[] handle(Message message, Session session, BackendExchange backend) throws RequestHandlerException
    {
        GatewayResult<byte[]> reply = backend.exchange(message.payload(), replyTimeout);
        if (reply.isFailure()) {
            GatewayError error = reply.error();
            throw new RequestHandlerException("backend exchange failed: " + error, error.cause());
        }
        return reply.value();
    }
}
