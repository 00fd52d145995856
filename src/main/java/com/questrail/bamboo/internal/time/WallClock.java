package com.questrail.bamboo.internal.time;

import java.time.Instant;

/**
 * Wall-clock source used strictly for observability timestamps.
 * It must not drive deadlines.
 */
public interface WallClock
{
    Instant now();
}
