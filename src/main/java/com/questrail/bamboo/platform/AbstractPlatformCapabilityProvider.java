package com.questrail.bamboo.platform;

import com.questrail.bamboo.style.ChromeMode;
import com.questrail.bamboo.style.Color;
import com.questrail.bamboo.style.DragRegion;
import com.questrail.bamboo.style.MacOSVibrancy;
import com.questrail.bamboo.style.Shadow;
import com.questrail.bamboo.style.TitlebarButtonPosition;
import com.questrail.bamboo.style.TitlebarStyle;
import com.questrail.bamboo.style.WindowsMaterial;

import java.lang.ref.WeakReference;
import java.util.List;
import java.util.Objects;

/**
 * Base class for OS capability providers.
 *
 * <p>Holds the native window weakly. Every operation defaults to
 * {@link UnsupportedPlatformOperationException}; subclasses override exactly
 * the operations their platform supports.</p>
 */
public abstract class AbstractPlatformCapabilityProvider implements PlatformCapabilityProvider
{
    private final WeakReference<NativeWindowHandle> window;

    protected AbstractPlatformCapabilityProvider(NativeWindowHandle window)
    {
        this.window = new WeakReference<>(Objects.requireNonNull(window, "window"));
    }

    /**
     * @return the live native window, or {@code null} once it has been
     *         collected or destroyed
     */
    protected final NativeWindowHandle window()
    {
        NativeWindowHandle w = window.get();
        return (w != null && w.isValid()) ? w : null;
    }

    public final boolean isAttached()
    {
        return window() != null;
    }

    protected final UnsupportedPlatformOperationException unsupported(String operation)
    {
        return new UnsupportedPlatformOperationException(operation, family());
    }

    @Override
    public void setChromeMode(ChromeMode mode, TitlebarStyle titlebar, boolean resizable) {
        throw unsupported("setChromeMode");
    }

    @Override
    public void setTitlebarButtonPosition(TitlebarButtonPosition position) {
        throw unsupported("setTitlebarButtonPosition");
    }

    @Override
    public void setTransparent(boolean transparent, double opacity) {
        throw unsupported("setTransparent");
    }

    @Override
    public void setBackgroundColor(Color color) {
        throw unsupported("setBackgroundColor");
    }

    @Override
    public void setMacOSVibrancy(MacOSVibrancy vibrancy) {
        throw unsupported("setMacOSVibrancy");
    }

    @Override
    public void setWindowsMaterial(WindowsMaterial material) {
        throw unsupported("setWindowsMaterial");
    }

    @Override
    public void setShadow(Shadow shadow) {
        throw unsupported("setShadow");
    }

    @Override
    public void setCornerRadius(int radius) {
        throw unsupported("setCornerRadius");
    }

    @Override
    public void setResizable(boolean resizable) {
        throw unsupported("setResizable");
    }

    @Override
    public void setWindowButtons(boolean minimizable, boolean maximizable) {
        throw unsupported("setWindowButtons");
    }

    @Override
    public void setAlwaysOnTop(boolean alwaysOnTop) {
        throw unsupported("setAlwaysOnTop");
    }

    @Override
    public void setSkipTaskbar(boolean skipTaskbar) {
        throw unsupported("setSkipTaskbar");
    }

    @Override
    public void setDragRegions(List<DragRegion> regions) {
        throw unsupported("setDragRegions");
    }
}
