package com.questrail.bamboo.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for call deadlines.
 *
 * <h2>Binding invariant</h2>
 * Every bridge deadline is computed from a monotonic source. Wall-clock time
 * ({@code Instant.now()}) appears only in observability records.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
