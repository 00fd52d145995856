package com.questrail.bamboo.api;

/**
 * Failure categories surfaced by a browser window.
 */
public enum BrowserError
{
    CREATE_FAILED,
    INVALID_STATE,
    SCRIPT_EXCEPTION,
    NAVIGATION_BLOCKED
}
