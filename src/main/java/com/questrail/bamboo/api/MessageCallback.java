package com.questrail.bamboo.api;

/**
 * Receives user-domain events sent from the page with {@code bamboo.send}.
 *
 * @see BrowserWindow#onMessage(MessageCallback)
 */
@FunctionalInterface
public interface MessageCallback
{
    /**
     * @param event   event name, never one of the reserved internal names
     * @param payload the event data exactly as received, as JSON text
     */
    void onMessage(String event, String payload);
}
