package com.questrail.bamboo.platform.linux;

import com.questrail.bamboo.platform.AbstractPlatformCapabilityProvider;
import com.questrail.bamboo.platform.NativeWindowHandle;
import com.questrail.bamboo.platform.PlatformFamily;
import com.questrail.bamboo.style.ChromeMode;
import com.questrail.bamboo.style.Color;
import com.questrail.bamboo.style.Shadow;
import com.questrail.bamboo.style.TitlebarStyle;

import java.util.Objects;

/**
 * Maps style operations onto GTK window properties and X11 hints.
 *
 * <p>Platform materials, traffic-light positioning and per-button control
 * are unsupported. Drag regions are handled by the engine's drag handler,
 * so there is nothing to do at the GTK level.</p>
 */
public final class LinuxCapabilityProvider extends AbstractPlatformCapabilityProvider
{
    private final GtkWindowPrimitives gtk;

    public LinuxCapabilityProvider(NativeWindowHandle window, GtkWindowPrimitives gtk)
    {
        super(window);
        this.gtk = Objects.requireNonNull(gtk, "gtk");
    }

    @Override
    public PlatformFamily family() {
        return PlatformFamily.LINUX;
    }

    @Override
    public void setChromeMode(ChromeMode mode, TitlebarStyle titlebar, boolean resizable)
    {
        NativeWindowHandle w = window();
        if (w == null) {
            return;
        }
        gtk.setDecorated(w, mode.hasNativeFrame());
        gtk.queueDraw(w);
    }

    @Override
    public void setTransparent(boolean transparent, double opacity)
    {
        NativeWindowHandle w = window();
        if (w == null) {
            return;
        }
        if (transparent || opacity < 1.0) {
            gtk.useRgbaVisual(w);
            gtk.setAppPaintable(w, true);
        }
        // Only honoured on composited desktops.
        gtk.setOpacity(w, opacity);
    }

    @Override
    public void setBackgroundColor(Color color)
    {
        NativeWindowHandle w = window();
        if (w != null) {
            gtk.overrideBackgroundColor(w, color.r() / 255.0, color.g() / 255.0, color.b() / 255.0, color.a() / 255.0);
        }
    }

    @Override
    public void setShadow(Shadow shadow)
    {
        NativeWindowHandle w = window();
        if (w != null) {
            gtk.setMotifDecorations(w, shadow.enabled() ? 1L : 0L);
        }
    }

    @Override
    public void setCornerRadius(int radius)
    {
        NativeWindowHandle w = window();
        if (w != null) {
            gtk.addCss(w, "window { border-radius: " + radius + "px; }");
        }
    }

    @Override
    public void setResizable(boolean resizable)
    {
        NativeWindowHandle w = window();
        if (w != null) {
            gtk.setResizable(w, resizable);
        }
    }

    @Override
    public void setAlwaysOnTop(boolean alwaysOnTop)
    {
        NativeWindowHandle w = window();
        if (w != null) {
            gtk.setKeepAbove(w, alwaysOnTop);
        }
    }

    @Override
    public void setSkipTaskbar(boolean skipTaskbar)
    {
        NativeWindowHandle w = window();
        if (w != null) {
            gtk.setSkipTaskbarHint(w, skipTaskbar);
        }
    }
}
