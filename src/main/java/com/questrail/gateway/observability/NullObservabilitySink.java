package com.questrail.gateway.observability;

/**
 * No-op implementation of GatewayObservabilitySink.
 */
public final class NullObservabilitySink implements GatewayObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onGatewayEvent(GatewayEvent event) {}

    @Override
    public void onStateTransition(SessionStateTransitionEvent event) {}

    @Override
    public void onError(GatewayErrorEvent event) {}
}
