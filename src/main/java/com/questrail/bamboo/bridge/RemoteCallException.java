package com.questrail.bamboo.bridge;

/**
 * The other side of the bridge answered a call with an error.
 */
public final class RemoteCallException extends RuntimeException
{
    private final String callId;

    public RemoteCallException(String callId, String message) {
        super(message);
        this.callId = callId;
    }

    public String callId() {
        return callId;
    }
}
