package com.questrail.bamboo.platform.macos;

import com.questrail.bamboo.platform.NativeWindowHandle;

/**
 * CocoaWindowPrimitives
 * -----------------------------------------------------------------------------
 * Port onto the AppKit {@code NSWindow} properties {@link MacOSCapabilityProvider}
 * drives. Bound by the rendering engine integration.
 */
public interface CocoaWindowPrimitives
{
    enum StandardButton { CLOSE, MINIATURIZE, ZOOM }

    long styleMask(NativeWindowHandle window);

    void setStyleMask(NativeWindowHandle window, long mask);

    void setTitlebarAppearsTransparent(NativeWindowHandle window, boolean transparent);

    void setTitleVisible(NativeWindowHandle window, boolean visible);

    void setMovableByWindowBackground(NativeWindowHandle window, boolean movable);

    void setOpaque(NativeWindowHandle window, boolean opaque);

    void setAlphaValue(NativeWindowHandle window, double alpha);

    /** Components in 0..1. */
    void setBackgroundColor(NativeWindowHandle window, double r, double g, double b, double a);

    void setClearBackground(NativeWindowHandle window);

    /** Remove every {@code NSVisualEffectView} under the content view. */
    void removeVisualEffectViews(NativeWindowHandle window);

    /**
     * Add a behind-window {@code NSVisualEffectView} filling the content view.
     *
     * @param material an {@code NSVisualEffectMaterial} value
     */
    void addVisualEffectView(NativeWindowHandle window, int material);

    void setHasShadow(NativeWindowHandle window, boolean hasShadow);

    void invalidateShadow(NativeWindowHandle window);

    /** {@code NSWindowLevel}: 0 normal, 3 floating. */
    void setLevel(NativeWindowHandle window, int level);

    void setStandardButtonEnabled(NativeWindowHandle window, StandardButton button, boolean enabled);

    /** @return {@code false} when the window has no such button */
    boolean moveStandardButton(NativeWindowHandle window, StandardButton button, int x, int y);

    /** Layer-backed content view with {@code cornerRadius} and {@code masksToBounds}. */
    void setContentCornerRadius(NativeWindowHandle window, double radius);

    /** Ask the engine host to re-query draggable regions. */
    void notifyDraggableRegionsChanged(NativeWindowHandle window);
}
