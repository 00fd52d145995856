package com.questrail.bamboo.observability;

import java.time.Instant;

/**
 * BridgeProtocolEvent
 * =============================================================================
 * Locally recovered protocol anomalies.
 *
 * <p>None of these is fatal. They exist so that a host can see traffic the
 * bridge chose to discard.</p>
 */
public sealed interface BridgeProtocolEvent {

    Instant timestamp();

    /** An inbound payload could not be decoded. */
    record MessageDropped(Instant timestamp, String reason, Throwable cause) implements BridgeProtocolEvent {}

    /** A script call named a function that is not bound. */
    record UnknownFunction(Instant timestamp, String callId, String name) implements BridgeProtocolEvent {}

    /** A pending call expired before its reply arrived. */
    record CallTimedOut(Instant timestamp, String callId, String description) implements BridgeProtocolEvent {}

    /** A reply arrived for an id that is not pending (already resolved, timed out, or never issued). */
    record LateReplyDropped(Instant timestamp, String callId) implements BridgeProtocolEvent {}

    /** A window command outside the fixed vocabulary was received. */
    record UnknownWindowOp(Instant timestamp, String op) implements BridgeProtocolEvent {}

    /** The capability provider reported an operation as unavailable on this platform. */
    record OperationUnsupported(Instant timestamp, String operation, String reason) implements BridgeProtocolEvent {}

    /** The channel was torn down; {@code rejectedCalls} pending entries were rejected. */
    record ChannelClosed(Instant timestamp, int rejectedCalls) implements BridgeProtocolEvent {}
}
