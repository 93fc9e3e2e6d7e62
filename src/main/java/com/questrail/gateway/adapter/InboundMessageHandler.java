package com.questrail.gateway.adapter;

import com.questrail.gateway.api.Message;

/**
 * Receives every message a {@link ProtocolListener} decodes.
 *
 * <p>Invoked on the accepting connection's own worker, never on an I/O event
 * loop, so implementations may block (e.g. on a backend exchange).
 * Implementations must not throw; failures are expressed as
 * {@link InboundReply#failed(String)}.</p>
 */
@FunctionalInterface
public interface InboundMessageHandler
{
    InboundReply onMessage(Message message);
}
