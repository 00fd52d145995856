package com.questrail.bamboo.script;

/**
 * Handle returned by {@link EventBus#subscribe}. Unsubscribing twice is harmless.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable
{
    void unsubscribe();

    @Override
    default void close() {
        unsubscribe();
    }
}
