package com.questrail.bamboo.platform.macos;

import com.questrail.bamboo.platform.AbstractPlatformCapabilityProvider;
import com.questrail.bamboo.platform.NativeWindowHandle;
import com.questrail.bamboo.platform.PlatformFamily;
import com.questrail.bamboo.platform.macos.CocoaWindowPrimitives.StandardButton;
import com.questrail.bamboo.style.ChromeMode;
import com.questrail.bamboo.style.Color;
import com.questrail.bamboo.style.DragRegion;
import com.questrail.bamboo.style.MacOSVibrancy;
import com.questrail.bamboo.style.Shadow;
import com.questrail.bamboo.style.TitlebarButtonPosition;
import com.questrail.bamboo.style.TitlebarStyle;

import java.util.List;
import java.util.Objects;

/**
 * MacOSCapabilityProvider
 * =============================================================================
 * Maps style operations onto {@code NSWindow} style masks, visual-effect
 * views and window levels.
 *
 * <p>Windows materials and taskbar visibility are unsupported; macOS has no
 * per-window taskbar entry.</p>
 */
public final class MacOSCapabilityProvider extends AbstractPlatformCapabilityProvider
{
    static final long MASK_BORDERLESS = 0L;
    static final long MASK_TITLED = 1L;
    static final long MASK_CLOSABLE = 1L << 1;
    static final long MASK_MINIATURIZABLE = 1L << 2;
    static final long MASK_RESIZABLE = 1L << 3;
    static final long MASK_FULL_SIZE_CONTENT_VIEW = 1L << 15;

    static final int LEVEL_NORMAL = 0;
    static final int LEVEL_FLOATING = 3;

    /** Horizontal spacing between traffic-light buttons, in points. */
    static final int BUTTON_SPACING = 20;

    private final CocoaWindowPrimitives cocoa;

    public MacOSCapabilityProvider(NativeWindowHandle window, CocoaWindowPrimitives cocoa)
    {
        super(window);
        this.cocoa = Objects.requireNonNull(cocoa, "cocoa");
    }

    @Override
    public PlatformFamily family() {
        return PlatformFamily.MACOS;
    }

    @Override
    public void setChromeMode(ChromeMode mode, TitlebarStyle titlebar, boolean resizable)
    {
        NativeWindowHandle w = window();
        if (w == null) {
            return;
        }

        switch (mode) {
            case FULL -> {
                // Engine browser frame; nothing to strip.
            }
            case NATIVE_TITLEBAR -> {
                cocoa.setTitlebarAppearsTransparent(w, false);
                cocoa.setTitleVisible(w, true);
                long mask = cocoa.styleMask(w) | MASK_TITLED | MASK_CLOSABLE;
                cocoa.setStyleMask(w, mask & ~MASK_FULL_SIZE_CONTENT_VIEW);
            }
            case FRAMELESS -> {
                cocoa.setStyleMask(w, MASK_BORDERLESS | (resizable ? MASK_RESIZABLE : 0L));
                cocoa.setMovableByWindowBackground(w, false);
            }
            case CUSTOM_TITLEBAR -> {
                if (titlebar.macosHidden()) {
                    cocoa.setTitlebarAppearsTransparent(w, true);
                    cocoa.setTitleVisible(w, false);
                    cocoa.setStyleMask(w, cocoa.styleMask(w) | MASK_TITLED | MASK_FULL_SIZE_CONTENT_VIEW);
                }
                else {
                    cocoa.setTitlebarAppearsTransparent(w, titlebar.transparentWhenInactive());
                }
            }
        }
    }

    @Override
    public void setTitlebarButtonPosition(TitlebarButtonPosition position)
    {
        NativeWindowHandle w = window();
        if (w == null || position == null) {
            return;
        }
        // Close at x, the others follow at fixed spacing.
        if (cocoa.moveStandardButton(w, StandardButton.CLOSE, position.x(), position.y())) {
            cocoa.moveStandardButton(w, StandardButton.MINIATURIZE, position.x() + BUTTON_SPACING, position.y());
            cocoa.moveStandardButton(w, StandardButton.ZOOM, position.x() + 2 * BUTTON_SPACING, position.y());
        }
    }

    @Override
    public void setTransparent(boolean transparent, double opacity)
    {
        NativeWindowHandle w = window();
        if (w == null) {
            return;
        }
        cocoa.setOpaque(w, !transparent && opacity >= 1.0);
        cocoa.setAlphaValue(w, opacity);
    }

    @Override
    public void setBackgroundColor(Color color)
    {
        NativeWindowHandle w = window();
        if (w != null) {
            cocoa.setBackgroundColor(w, color.r() / 255.0, color.g() / 255.0, color.b() / 255.0, color.a() / 255.0);
        }
    }

    @Override
    public void setMacOSVibrancy(MacOSVibrancy vibrancy)
    {
        NativeWindowHandle w = window();
        if (w == null) {
            return;
        }
        cocoa.removeVisualEffectViews(w);
        if (vibrancy != MacOSVibrancy.NONE) {
            cocoa.addVisualEffectView(w, material(vibrancy));
        }
    }

    /**
     * @return the {@code NSVisualEffectMaterial} raw value
     */
    static int material(MacOSVibrancy vibrancy)
    {
        return switch (vibrancy) {
            case TITLEBAR -> 3;
            case MENU -> 5;
            case POPOVER -> 6;
            case SIDEBAR -> 7;
            case HEADER_VIEW -> 10;
            case SHEET -> 11;
            case WINDOW_BACKGROUND, NONE -> 12;
            case HUD_WINDOW -> 13;
            case FULL_SCREEN_UI -> 15;
            case CONTENT_BACKGROUND -> 18;
            case UNDER_WINDOW_BACKGROUND -> 21;
            case UNDER_PAGE_BACKGROUND -> 22;
        };
    }

    @Override
    public void setShadow(Shadow shadow)
    {
        NativeWindowHandle w = window();
        if (w == null) {
            return;
        }
        cocoa.setHasShadow(w, shadow.enabled());
        cocoa.invalidateShadow(w);
    }

    @Override
    public void setCornerRadius(int radius)
    {
        NativeWindowHandle w = window();
        if (w == null) {
            return;
        }
        cocoa.setContentCornerRadius(w, radius);
        // A borderless window only looks rounded over a clear background.
        if (radius > 0 && (cocoa.styleMask(w) & MASK_TITLED) == 0) {
            cocoa.setClearBackground(w);
            cocoa.setOpaque(w, false);
        }
    }

    @Override
    public void setResizable(boolean resizable)
    {
        NativeWindowHandle w = window();
        if (w == null) {
            return;
        }
        long mask = cocoa.styleMask(w);
        cocoa.setStyleMask(w, resizable ? (mask | MASK_RESIZABLE) : (mask & ~MASK_RESIZABLE));
    }

    @Override
    public void setWindowButtons(boolean minimizable, boolean maximizable)
    {
        NativeWindowHandle w = window();
        if (w == null) {
            return;
        }
        long mask = cocoa.styleMask(w);
        cocoa.setStyleMask(w, minimizable ? (mask | MASK_MINIATURIZABLE) : (mask & ~MASK_MINIATURIZABLE));
        cocoa.setStandardButtonEnabled(w, StandardButton.ZOOM, maximizable);
    }

    @Override
    public void setAlwaysOnTop(boolean alwaysOnTop)
    {
        NativeWindowHandle w = window();
        if (w != null) {
            cocoa.setLevel(w, alwaysOnTop ? LEVEL_FLOATING : LEVEL_NORMAL);
        }
    }

    @Override
    public void setDragRegions(List<DragRegion> regions)
    {
        NativeWindowHandle w = window();
        if (w != null) {
            cocoa.notifyDraggableRegionsChanged(w);
        }
    }
}
