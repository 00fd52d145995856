package com.questrail.bamboo.api;

/**
 * Application bootstrap failures. Each maps to a distinct process exit code
 * so a launcher can tell them apart.
 */
public enum AppError
{
    INIT_FAILED(1),
    INVALID_ARGUMENTS(2),
    ALREADY_RUNNING(3),
    VERSION_MISMATCH(4);

    private final int exitCode;

    AppError(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
