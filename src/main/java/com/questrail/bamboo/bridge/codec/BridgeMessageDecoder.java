package com.questrail.bamboo.bridge.codec;

import com.questrail.bamboo.bridge.model.BridgeMessage;

/**
 * BridgeMessageDecoder
 * -----------------------------------------------------------------------------
 * Decodes exactly one bridge message from a complete payload.
 *
 * <p>The decoder checks structure only: required fields, field types and the
 * message discriminator. Whether a call id is known, or a function is bound,
 * is decided by the channel.</p>
 */
public interface BridgeMessageDecoder
{
    /**
     * @param payload one complete message as UTF-8 text
     * @return the decoded message
     * @throws BridgeDecodeException if the payload is not a well-formed bridge message
     */
    BridgeMessage decode(byte[] payload);
}
