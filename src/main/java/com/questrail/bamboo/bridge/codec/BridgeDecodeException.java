package com.questrail.bamboo.bridge.codec;

/**
 * Indicates that a payload could not be decoded into a bridge message.
 *
 * This typically reflects:
 * <ul>
 *   <li>Text that is not a JSON object</li>
 *   <li>An unknown {@code type} discriminator</li>
 *   <li>A missing or mistyped required field</li>
 * </ul>
 */
public final class BridgeDecodeException extends RuntimeException
{
    public BridgeDecodeException(String message) {
        super(message);
    }

    public BridgeDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
