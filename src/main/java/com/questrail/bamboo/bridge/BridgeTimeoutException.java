package com.questrail.bamboo.bridge;

import java.time.Duration;

/**
 * A pending call received no reply within its timeout window.
 */
public final class BridgeTimeoutException extends RuntimeException
{
    private final String callId;
    private final Duration timeout;

    public BridgeTimeoutException(String callId, String description, Duration timeout) {
        super(description + " timed out after " + timeout.toMillis() + " ms (id " + callId + ")");
        this.callId = callId;
        this.timeout = timeout;
    }

    public String callId() {
        return callId;
    }

    public Duration timeout() {
        return timeout;
    }
}
