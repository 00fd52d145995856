package com.questrail.bamboo.bridge;

/**
 * The bridge channel was torn down before a pending call was answered, or a
 * call was issued on a closed channel.
 */
public final class BridgeClosedException extends RuntimeException
{
    public BridgeClosedException(String message) {
        super(message);
    }
}
