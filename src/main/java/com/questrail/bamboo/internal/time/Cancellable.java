package com.questrail.bamboo.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle for a scheduled task, returned by {@link MonotonicScheduler}.
 *
 * <p>
 * The bridge uses this to disarm a call timeout once the matching reply has
 * resolved the pending entry. Implementations include:
 * <ul>
 *   <li>a deterministic test scheduler</li>
 *   <li>a JVM {@code ScheduledExecutorService}-backed scheduler</li>
 * </ul>
 * </p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was cancelled before.
     */
    boolean cancel();
}
