package com.questrail.bamboo.transport;

/**
 * ScriptEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for the connection to one page's script context.
 */
public interface ScriptEndpoint
{
    /**
     * Start the endpoint and begin receiving payloads.
     *
     * <p>On activation the endpoint notifies its listener via
     * {@link ScriptEndpointListener#onTransportUp()}.</p>
     */
    void start();

    /**
     * Stop the endpoint and release its resources.
     *
     * <p>The listener is notified via
     * {@link ScriptEndpointListener#onTransportDown(Throwable)} at most once per
     * transition.</p>
     */
    void stop();

    /**
     * Deliver one payload to the script side. Payloads sent from one thread
     * arrive in the order they were sent.
     */
    void send(byte[] payload);

    /**
     * Register the listener for inbound payloads and lifecycle events. Must be
     * called before {@link #start()}.
     */
    void setListener(ScriptEndpointListener listener);
}
