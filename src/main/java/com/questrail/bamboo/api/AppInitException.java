package com.questrail.bamboo.api;

import java.util.Objects;

/**
 * Thrown by application bootstrap. The host decides whether to exit.
 */
public final class AppInitException extends Exception
{
    private final AppError error;

    public AppInitException(AppError error, String message) {
        super(message);
        this.error = Objects.requireNonNull(error, "error");
    }

    public AppInitException(AppError error, String message, Throwable cause) {
        super(message, cause);
        this.error = Objects.requireNonNull(error, "error");
    }

    public AppError error() {
        return error;
    }
}
