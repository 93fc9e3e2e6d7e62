package com.questrail.gateway.observability;

import com.questrail.gateway.api.ErrorKind;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records everything it receives for assertions.
 */
public final class RecordingObservabilitySink implements GatewayObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onGatewayEvent(GatewayEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onStateTransition(SessionStateTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(GatewayErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<GatewayEvent> gatewayEvents(GatewayEvent.Type type) {
        return events.stream()
            .filter(e -> e instanceof GatewayEvent g && g.type() == type)
            .map(e -> (GatewayEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized List<SessionStateTransitionEvent> getStateTransitions() {
        return events.stream()
            .filter(e -> e instanceof SessionStateTransitionEvent)
            .map(e -> (SessionStateTransitionEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized List<GatewayErrorEvent> errors(ErrorKind kind) {
        return events.stream()
            .filter(e -> e instanceof GatewayErrorEvent err && err.kind() == kind)
            .map(e -> (GatewayErrorEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized void clear() {
        events.clear();
    }
}
