package com.questrail.bamboo.observability;

/**
 * No-op implementation of BridgeObservabilitySink.
 */
public final class NullObservabilitySink implements BridgeObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onProtocolEvent(BridgeProtocolEvent event) {}

    @Override
    public void onStyleApplied(StyleAppliedEvent event) {}

    @Override
    public void onTransportEvent(BridgeTransportEvent event) {}

    @Override
    public void onError(BridgeErrorEvent event) {}
}
