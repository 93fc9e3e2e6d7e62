package com.questrail.gateway.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Objects;

/**
 * Counts gateway events and errors on a caller-supplied {@link MeterRegistry}.
 *
 * <ul>
 *   <li>{@code gateway.events} tagged {@code event} (and {@code result} for
 *       health checks, {@code target} for routing decisions and switches)</li>
 *   <li>{@code gateway.transitions} tagged {@code from}/{@code to}</li>
 *   <li>{@code gateway.errors} tagged {@code kind}</li>
 * </ul>
 */
public final class MicrometerGatewayObservabilitySink implements GatewayObservabilitySink {
    public static final String EVENTS = "gateway.events";
    public static final String TRANSITIONS = "gateway.transitions";
    public static final String ERRORS = "gateway.errors";

    private final MeterRegistry registry;

    public MicrometerGatewayObservabilitySink(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public void onGatewayEvent(GatewayEvent event) {
        Counter.Builder counter = Counter.builder(EVENTS)
                .description("Structured gateway events")
                .tag("event", event.name());
        switch (event.type()) {
            case HEALTH_CHECK_RESULT -> counter.tag("result", tagValue(event.attribute("healthy")));
            case ROUTING_DECISION, PROTOCOL_SWITCH -> counter.tag("target", tagValue(event.attribute("to")));
            case MIGRATION_COMPLETE -> counter.tag("strategy", tagValue(event.attribute("strategy")));
        }
        counter.register(registry).increment();
    }

    @Override
    public void onStateTransition(SessionStateTransitionEvent event) {
        Counter.builder(TRANSITIONS)
                .description("Session state transitions")
                .tag("from", event.oldState().name())
                .tag("to", event.newState().name())
                .register(registry)
                .increment();
    }

    @Override
    public void onError(GatewayErrorEvent event) {
        Counter.builder(ERRORS)
                .description("Errors surfaced by the gateway")
                .tag("kind", event.kind().name())
                .register(registry)
                .increment();
    }

    private static String tagValue(String value) {
        return value == null ? "none" : value;
    }
}
