package com.questrail.bamboo.observability;

import java.time.Instant;

/**
 * Lifecycle change of a script endpoint.
 *
 * @param cause failure cause for {@link Kind#DOWN}; {@code null} for orderly shutdown
 */
public record BridgeTransportEvent(
    Instant timestamp,
    Kind kind,
    Throwable cause
) {
    public enum Kind { UP, DOWN }
}
