package com.questrail.bamboo.bridge.codec;

import com.questrail.bamboo.bridge.model.BridgeMessage;

/**
 * Encodes one bridge message into the payload carried by a script endpoint.
 */
public interface BridgeMessageEncoder
{
    byte[] encode(BridgeMessage message);
}
