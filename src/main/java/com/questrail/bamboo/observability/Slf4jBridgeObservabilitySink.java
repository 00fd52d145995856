package com.questrail.bamboo.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of BridgeObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jBridgeObservabilitySink implements BridgeObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jBridgeObservabilitySink.class);

    @Override
    public void onProtocolEvent(BridgeProtocolEvent event) {
        if (event instanceof BridgeProtocolEvent.MessageDropped dropped) {
            log.warn("Bridge message dropped: {}", dropped.reason(), dropped.cause());
        }
        else if (event instanceof BridgeProtocolEvent.CallTimedOut timedOut) {
            log.warn("Bridge call {} timed out: {}", timedOut.callId(), timedOut.description());
        }
        else if (event instanceof BridgeProtocolEvent.UnknownFunction unknown) {
            log.warn("Bridge call {} named unbound function '{}'", unknown.callId(), unknown.name());
        }
        else if (event instanceof BridgeProtocolEvent.ChannelClosed closed) {
            log.info("Bridge channel closed, {} pending call(s) rejected", closed.rejectedCalls());
        }
        else {
            log.debug("Bridge Protocol Event: {}", event);
        }
    }

    @Override
    public void onStyleApplied(StyleAppliedEvent event) {
        if (!event.isNoOp()) {
            log.debug("Style applied: {}", event.invoked());
        }
    }

    @Override
    public void onTransportEvent(BridgeTransportEvent event) {
        if (event.cause() != null) {
            log.info("Bridge Transport Event: {}", event.kind(), event.cause());
        }
        else {
            log.info("Bridge Transport Event: {}", event.kind());
        }
    }

    @Override
    public void onError(BridgeErrorEvent event) {
        log.error("Bridge Error: {}", event.message(), event.cause());
    }
}
