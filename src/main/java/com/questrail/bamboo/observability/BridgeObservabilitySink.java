package com.questrail.bamboo.observability;

/**
 * Receives observability events from the bridge and the style reconciler.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks arrive on the window's owner thread, except for transport
 * events which arrive on the transport's own I/O thread.</p>
 */
public interface BridgeObservabilitySink {
    /**
     * Called for protocol-level anomalies that are recovered locally
     * (dropped messages, timeouts, late replies, unsupported operations).
     * @param event the protocol event
     */
    void onProtocolEvent(BridgeProtocolEvent event);

    /**
     * Called after the reconciler converged the native window onto a new style.
     * @param event which operations were actually issued
     */
    void onStyleApplied(StyleAppliedEvent event);

    /**
     * Called when a script endpoint goes up or down.
     * @param event the transport event
     */
    void onTransportEvent(BridgeTransportEvent event);

    /**
     * Called when an error occurs that was contained without terminating the owner.
     * @param event the error event
     */
    void onError(BridgeErrorEvent event);
}
