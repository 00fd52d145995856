package com.questrail.bamboo.platform;

import com.questrail.bamboo.style.ChromeMode;
import com.questrail.bamboo.style.Color;
import com.questrail.bamboo.style.DragRegion;
import com.questrail.bamboo.style.MacOSVibrancy;
import com.questrail.bamboo.style.Shadow;
import com.questrail.bamboo.style.TitlebarButtonPosition;
import com.questrail.bamboo.style.TitlebarStyle;
import com.questrail.bamboo.style.WindowsMaterial;

import java.util.List;

/**
 * PlatformCapabilityProvider
 * =============================================================================
 * The set of window-appearance operations the style reconciler can issue.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>One implementation per OS family. The reconciler is written once
 *       against this interface and never inspects the platform.</li>
 *   <li>Every operation is side-effect-only and must tolerate being called
 *       again with an unchanged value.</li>
 *   <li>An operation that has no meaning on the platform throws
 *       {@link UnsupportedPlatformOperationException}.</li>
 *   <li>Implementations hold no state beyond a weak reference to the native
 *       window. Once that window is gone every call is a no-op.</li>
 * </ul>
 *
 * <p>All methods are called on the window's owner thread.</p>
 */
public interface PlatformCapabilityProvider
{
    PlatformFamily family();

    /**
     * Structural frame change. {@code titlebar} and {@code resizable} are
     * passed because the style bits for a frame depend on them.
     */
    void setChromeMode(ChromeMode mode, TitlebarStyle titlebar, boolean resizable);

    void setTitlebarButtonPosition(TitlebarButtonPosition position);

    void setTransparent(boolean transparent, double opacity);

    void setBackgroundColor(Color color);

    void setMacOSVibrancy(MacOSVibrancy vibrancy);

    void setWindowsMaterial(WindowsMaterial material);

    void setShadow(Shadow shadow);

    /**
     * @param radius pixels; {@code 0} means the OS default
     */
    void setCornerRadius(int radius);

    void setResizable(boolean resizable);

    void setWindowButtons(boolean minimizable, boolean maximizable);

    void setAlwaysOnTop(boolean alwaysOnTop);

    void setSkipTaskbar(boolean skipTaskbar);

    /**
     * Replace the full set of drag regions. Never merged with the previous set.
     */
    void setDragRegions(List<DragRegion> regions);
}
