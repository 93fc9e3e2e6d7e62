package com.questrail.gateway.runtime;

import com.questrail.gateway.adapter.InboundMessageHandler;
import com.questrail.gateway.adapter.InboundReply;
import com.questrail.gateway.api.ErrorKind;
import com.questrail.gateway.api.GatewayError;
import com.questrail.gateway.api.GatewayResult;
import com.questrail.gateway.api.Message;
import com.questrail.gateway.api.ProtocolKind;
import com.questrail.gateway.api.RoutingContext;
import com.questrail.gateway.migration.MigrationResult;
import com.questrail.gateway.migration.MigrationStrategy;
import com.questrail.gateway.session.Session;
import com.questrail.gateway.state.GatewayState;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * InboundDispatcher
 * =============================================================================
 * Handles every message decoded by a protocol listener.
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li>route the message, with the session's current protocol in the context</li>
 *   <li>no session yet: open one on the routed protocol</li>
 *   <li>session connected on another protocol: switch it, using the configured
 *       default strategy. A failed switch that rolled back leaves the session on
 *       its old protocol and the message is still handled there.</li>
 *   <li>session in {@code ERROR}: retry it (subject to the backoff)</li>
 *   <li>invoke the {@link RequestHandler} and reply with its payload</li>
 * </ol>
 *
 * Any failure becomes a failed {@link InboundReply}, which the listener writes
 * back in its own protocol's error form.
 */
final class InboundDispatcher implements InboundMessageHandler
{
    private static final Logger log = LoggerFactory.getLogger(InboundDispatcher.class);

    private final ProtocolGateway gateway;
    private final RequestHandler handler;
    private final Function<Message, RoutingContext> contextResolver;
    private final MigrationStrategy defaultStrategy;

    InboundDispatcher(ProtocolGateway gateway,
                      RequestHandler handler,
                      Function<Message, RoutingContext> contextResolver,
                      MigrationStrategy defaultStrategy)
    {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.contextResolver = Objects.requireNonNull(contextResolver, "contextResolver");
        this.defaultStrategy = Objects.requireNonNull(defaultStrategy, "defaultStrategy");
    }

    @Override
    public InboundReply onMessage(Message message)
    {
        if (gateway.isShutDown()) {
            return InboundReply.failed("gateway is shutting down");
        }

        String sessionId = message.sessionId();
        GatewayResult<Session> found = gateway.session(sessionId);
        Optional<Session> existing = found.isSuccess() ? Optional.of(found.value()) : Optional.empty();

        RoutingContext resolved = contextResolver.apply(message);
        RoutingContext context = new RoutingContext(resolved.identity(),
                existing.map(Session::currentProtocol), resolved.attributes());
        GatewayResult<ProtocolKind> routed = gateway.route(message, context);
        if (routed.isFailure()) {
            return reject(routed.error());
        }

        GatewayResult<Session> ready = existing.isPresent()
                ? prepare(existing.get(), routed.value())
                : open(sessionId, routed.value());
        if (ready.isFailure()) {
            return reject(ready.error());
        }
        return handle(message, ready.value());
    }

    // -------------------------------------------------------------------------
    // Session preparation
    // -------------------------------------------------------------------------

    private GatewayResult<Session> open(String sessionId, ProtocolKind target)
    {
        GatewayResult<Session> opened = gateway.openSession(sessionId, target, Map.of());
        if (opened.isFailure() && opened.hasError(ErrorKind.INVALID_TRANSITION)) {
            // Another connection carrying the same session id got there first.
            GatewayResult<Session> raced = gateway.session(sessionId);
            if (raced.isSuccess()) {
                return prepare(raced.value(), target);
            }
        }
        return opened;
    }

    private GatewayResult<Session> prepare(Session session, ProtocolKind target)
    {
        GatewayState state = session.state();
        switch (state) {
            case IDLE:
                return gateway.openSession(session.id(), target, Map.of());
            case ERROR:
                return gateway.retry(session);
            case SWITCHING:
                return GatewayResult.success(session);
            case CONNECTED:
                if (session.currentProtocol() == target) {
                    return GatewayResult.success(session);
                }
                GatewayResult<MigrationResult> switched = gateway.switchProtocol(session, target, defaultStrategy);
                if (switched.isFailure() && session.state() != GatewayState.CONNECTED
                        && session.state() != GatewayState.SWITCHING) {
                    return GatewayResult.failure(switched.error());
                }
                if (switched.isFailure()) {
                    log.debug("Session {}: staying on {} after failed switch to {}",
                            session.id(), session.currentProtocol(), target);
                }
                return GatewayResult.success(session);
            default:
                return GatewayResult.failure(ErrorKind.INVALID_TRANSITION,
                        "Session " + session.id() + " is " + state);
        }
    }

    // -------------------------------------------------------------------------
    // Handler
    // -------------------------------------------------------------------------

    private InboundReply handle(Message message, Session session)
    {
        byte[] reply;
        try {
            reply = handler.handle(message, session,
                    (payload, timeout) -> gateway.exchange(session, payload, timeout));
        } catch (RequestHandlerException | RuntimeException e) {
            GatewayError error = new GatewayError(ErrorKind.HANDLER_FAILED,
                    "handler failed: " + (e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage()), e);
            gateway.fail(session.id(), error);
            return InboundReply.failed(error.message());
        }
        gateway.touch(session);
        return reply == null ? InboundReply.none() : InboundReply.ok(reply);
    }

    private static InboundReply reject(GatewayError error)
    {
        return InboundReply.failed(error.kind() + ": " + error.message());
    }
}
