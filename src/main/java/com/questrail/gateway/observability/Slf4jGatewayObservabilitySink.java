package com.questrail.gateway.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of GatewayObservabilitySink that emits logs via SLF4J.
 *
 * <p>Routing decisions and health results that confirm the status quo are
 * frequent, so they go to DEBUG; switches, migrations and entries into
 * {@code ERROR} go to INFO.</p>
 */
public final class Slf4jGatewayObservabilitySink implements GatewayObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jGatewayObservabilitySink.class);

    @Override
    public void onGatewayEvent(GatewayEvent event) {
        switch (event.type()) {
            case PROTOCOL_SWITCH, MIGRATION_COMPLETE -> log.info("Gateway {}: {}", event.name(), event.attributes());
            case HEALTH_CHECK_RESULT -> {
                if ("true".equals(event.attribute("changed"))) {
                    log.info("Gateway {}: {}", event.name(), event.attributes());
                } else {
                    log.debug("Gateway {}: {}", event.name(), event.attributes());
                }
            }
            case ROUTING_DECISION -> log.debug("Gateway {}: {}", event.name(), event.attributes());
        }
    }

    @Override
    public void onStateTransition(SessionStateTransitionEvent event) {
        if (event.isFailure()) {
            log.info("Session {}: {} -> {} on {}",
                event.sessionId(), event.oldState(), event.newState(), event.triggeringEvent());
        } else {
            log.debug("Session {}: {} -> {} on {}",
                event.sessionId(), event.oldState(), event.newState(), event.triggeringEvent().type());
        }
    }

    @Override
    public void onError(GatewayErrorEvent event) {
        if (event.sessionId() == null) {
            log.warn("Gateway error {}: {}", event.kind(), event.message(), event.cause());
        } else {
            log.warn("Gateway error {} on session {}: {}", event.kind(), event.sessionId(), event.message(), event.cause());
        }
    }
}
