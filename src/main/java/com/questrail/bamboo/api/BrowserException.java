package com.questrail.bamboo.api;

import java.util.Objects;

/**
 * Raised (or used to complete a future exceptionally) when a window
 * operation fails.
 */
public final class BrowserException extends RuntimeException
{
    private final BrowserError error;

    public BrowserException(BrowserError error, String message) {
        super(message);
        this.error = Objects.requireNonNull(error, "error");
    }

    public BrowserException(BrowserError error, String message, Throwable cause) {
        super(message, cause);
        this.error = Objects.requireNonNull(error, "error");
    }

    public BrowserError error() {
        return error;
    }
}
