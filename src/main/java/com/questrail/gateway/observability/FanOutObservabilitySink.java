package com.questrail.gateway.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;

/**
 * Delivers every event to each delegate in order. A delegate that throws is
 * logged and skipped so the others still see the event.
 */
public final class FanOutObservabilitySink implements GatewayObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(FanOutObservabilitySink.class);

    private final List<GatewayObservabilitySink> delegates;

    public FanOutObservabilitySink(List<GatewayObservabilitySink> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    public static FanOutObservabilitySink of(GatewayObservabilitySink... delegates) {
        return new FanOutObservabilitySink(List.of(delegates));
    }

    @Override
    public void onGatewayEvent(GatewayEvent event) {
        each(sink -> sink.onGatewayEvent(event));
    }

    @Override
    public void onStateTransition(SessionStateTransitionEvent event) {
        each(sink -> sink.onStateTransition(event));
    }

    @Override
    public void onError(GatewayErrorEvent event) {
        each(sink -> sink.onError(event));
    }

    private void each(Consumer<GatewayObservabilitySink> delivery) {
        for (GatewayObservabilitySink sink : delegates) {
            try {
                delivery.accept(sink);
            } catch (RuntimeException e) {
                log.warn("Observability sink {} failed", sink.getClass().getSimpleName(), e);
            }
        }
    }
}
