package com.questrail.bamboo.observability;

import java.time.Instant;

/**
 * Record representing an error contained by the bridge runtime.
 */
public record BridgeErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
