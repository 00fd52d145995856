package com.questrail.bamboo.platform;

/**
 * Opaque reference to a native top-level window (HWND, NSWindow, GtkWindow).
 *
 * <p>The windowing system owns the window. Capability providers keep only a
 * weak reference to this handle and stop issuing calls once it is gone or
 * reports itself invalid.</p>
 */
public interface NativeWindowHandle
{
    /**
     * @return the platform pointer or id, for diagnostics and native bindings
     */
    long rawHandle();

    /**
     * @return {@code false} once the native window has been destroyed
     */
    boolean isValid();
}
