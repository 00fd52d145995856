package com.questrail.bamboo.transport;

/**
 * Callback sink for {@link ScriptEndpoint}.
 *
 * <p>Callbacks may arrive on any thread. Implementations that touch
 * owner-thread state must post to the owner before doing so.</p>
 */
public interface ScriptEndpointListener
{
    void onTransportUp();

    /**
     * @param cause diagnostic cause; {@code null} for an orderly shutdown
     */
    void onTransportDown(Throwable cause);

    /**
     * Called with one complete payload exactly as the script side sent it.
     */
    void onPayload(byte[] payload);
}
