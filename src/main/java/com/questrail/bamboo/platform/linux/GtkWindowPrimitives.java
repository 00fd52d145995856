package com.questrail.bamboo.platform.linux;

import com.questrail.bamboo.platform.NativeWindowHandle;

/**
 * Port onto the GTK 3 / X11 calls {@link LinuxCapabilityProvider} drives.
 * Bound by the rendering engine integration.
 */
public interface GtkWindowPrimitives
{
    void setDecorated(NativeWindowHandle window, boolean decorated);

    /**
     * Switch the widget to the screen's RGBA visual.
     *
     * @return {@code false} when no compositor provides one
     */
    boolean useRgbaVisual(NativeWindowHandle window);

    void setAppPaintable(NativeWindowHandle window, boolean paintable);

    void setOpacity(NativeWindowHandle window, double opacity);

    void setKeepAbove(NativeWindowHandle window, boolean above);

    void setSkipTaskbarHint(NativeWindowHandle window, boolean skip);

    void setResizable(NativeWindowHandle window, boolean resizable);

    /** Components in 0..1. */
    void overrideBackgroundColor(NativeWindowHandle window, double r, double g, double b, double a);

    /** Attach an application-priority CSS provider to the window's style context. */
    void addCss(NativeWindowHandle window, String css);

    /** Write {@code _MOTIF_WM_HINTS} with the given decorations field. */
    void setMotifDecorations(NativeWindowHandle window, long decorations);

    void queueDraw(NativeWindowHandle window);
}
