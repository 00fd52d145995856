package com.questrail.bamboo.script;

/**
 * Subscriber for one named event.
 */
@FunctionalInterface
public interface EventHandler
{
    /**
     * @param payload event data as JSON text
     */
    void handle(String payload) throws Exception;
}
