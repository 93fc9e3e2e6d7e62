package com.questrail.gateway.runtime;

import com.questrail.gateway.api.Message;
import com.questrail.gateway.session.Session;

/**
 * Business logic invoked once per inbound message.
 *
 * <p>The gateway does not interpret handler failures: any exception becomes a
 * {@code HANDLER_FAILED} error, is logged, and is reported to the client with
 * the listener's protocol-specific error reply.</p>
 */
@FunctionalInterface
public interface RequestHandler
{
    /**
     * @param message decoded inbound message
     * @param session the session the message belongs to, connected on the
     *                routed protocol
     * @param backend exchange over the session's backend binding
     * @return reply payload, or {@code null} for no reply
     */
    byte[] handle(Message message, Session session, BackendExchange backend) throws RequestHandlerException;
}
