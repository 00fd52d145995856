package com.questrail.bamboo.api;

/**
 * Progress report for an in-page text search.
 *
 * @param finalUpdate {@code true} on the last report for this search
 */
public record FindResult(int identifier, int count, boolean finalUpdate)
{
}
