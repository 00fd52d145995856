package com.questrail.bamboo.platform;

import java.util.Objects;

/**
 * Signals that a style operation has no meaning on the current platform.
 *
 * <p>This is a feature gap, not a failure. The style reconciler treats it as
 * a silent no-op.</p>
 */
public final class UnsupportedPlatformOperationException extends UnsupportedOperationException
{
    private final String operation;
    private final PlatformFamily family;

    public UnsupportedPlatformOperationException(String operation, PlatformFamily family) {
        super(operation + " is not supported on " + family.wireName());
        this.operation = Objects.requireNonNull(operation, "operation");
        this.family = family;
    }

    public String operation() {
        return operation;
    }

    public PlatformFamily family() {
        return family;
    }
}
