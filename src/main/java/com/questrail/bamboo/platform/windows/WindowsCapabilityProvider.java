package com.questrail.bamboo.platform.windows;

import com.questrail.bamboo.platform.AbstractPlatformCapabilityProvider;
import com.questrail.bamboo.platform.NativeWindowHandle;
import com.questrail.bamboo.platform.PlatformFamily;
import com.questrail.bamboo.style.ChromeMode;
import com.questrail.bamboo.style.Color;
import com.questrail.bamboo.style.DragRegion;
import com.questrail.bamboo.style.Shadow;
import com.questrail.bamboo.style.TitlebarStyle;
import com.questrail.bamboo.style.WindowsMaterial;

import java.util.List;
import java.util.Objects;

import static com.questrail.bamboo.platform.windows.Win32Constants.*;

/**
 * WindowsCapabilityProvider
 * =============================================================================
 * Maps style operations onto window style bits and DWM attributes.
 *
 * <h2>Version gates</h2>
 * <ul>
 *   <li>Corner preference exists only on Windows 11 (build 22000+); on older
 *       builds {@link #setCornerRadius(int)} does nothing.</li>
 *   <li>Mica needs Windows 11; older builds fall back to Acrylic.</li>
 *   <li>Builds without {@code DWMWA_SYSTEMBACKDROP_TYPE} get the legacy
 *       {@code DWMWA_MICA_EFFECT} toggle instead.</li>
 * </ul>
 *
 * <p>macOS vibrancy and traffic-light positioning are unsupported.</p>
 */
public final class WindowsCapabilityProvider extends AbstractPlatformCapabilityProvider
{
    private final Win32WindowPrimitives win32;

    public WindowsCapabilityProvider(NativeWindowHandle window, Win32WindowPrimitives win32)
    {
        super(window);
        this.win32 = Objects.requireNonNull(win32, "win32");
    }

    @Override
    public PlatformFamily family() {
        return PlatformFamily.WINDOWS;
    }

    private boolean isWindows11() {
        return win32.osBuildNumber() >= WINDOWS_11_BUILD;
    }

    @Override
    public void setChromeMode(ChromeMode mode, TitlebarStyle titlebar, boolean resizable)
    {
        NativeWindowHandle hwnd = window();
        if (hwnd == null) {
            return;
        }

        int style = win32.getStyle(hwnd);
        switch (mode) {
            case FULL -> {
                // The engine's own browser frame draws everything.
                return;
            }
            case NATIVE_TITLEBAR -> {
                style |= WS_CAPTION | WS_SYSMENU | WS_THICKFRAME;
                style &= ~WS_POPUP;
            }
            case FRAMELESS -> {
                style &= ~(WS_CAPTION | WS_THICKFRAME);
                style |= WS_POPUP;
                if (resizable) {
                    style |= WS_SIZEBOX;
                }
            }
            case CUSTOM_TITLEBAR -> {
                style |= WS_CAPTION | WS_SYSMENU;
                style &= ~(WS_THICKFRAME | WS_POPUP);
                win32.extendFrameIntoClientArea(hwnd, -1, -1, -1, -1);
            }
        }
        win32.setStyle(hwnd, style);
        win32.refreshFrame(hwnd);
    }

    @Override
    public void setTransparent(boolean transparent, double opacity)
    {
        NativeWindowHandle hwnd = window();
        if (hwnd == null) {
            return;
        }

        int exStyle = win32.getExStyle(hwnd);
        if (transparent || opacity < 1.0) {
            win32.setExStyle(hwnd, exStyle | WS_EX_LAYERED);
            win32.setLayeredAlpha(hwnd, (int) (opacity * 255));
        }
        else {
            win32.setExStyle(hwnd, exStyle & ~WS_EX_LAYERED);
        }
    }

    @Override
    public void setBackgroundColor(Color color)
    {
        NativeWindowHandle hwnd = window();
        if (hwnd == null) {
            return;
        }
        win32.setClassBackground(hwnd, color.toColorRef());
        win32.invalidate(hwnd);
    }

    @Override
    public void setWindowsMaterial(WindowsMaterial material)
    {
        NativeWindowHandle hwnd = window();
        if (hwnd == null) {
            return;
        }

        WindowsMaterial effective = material;
        if (effective == WindowsMaterial.MICA && !isWindows11()) {
            effective = WindowsMaterial.ACRYLIC;
        }

        win32.setDwmAttribute(hwnd, DWMWA_USE_IMMERSIVE_DARK_MODE, 1);

        int backdrop = backdropType(effective);
        if (win32.setDwmAttribute(hwnd, DWMWA_SYSTEMBACKDROP_TYPE, backdrop) != S_OK) {
            boolean micaOn = effective == WindowsMaterial.MICA || effective == WindowsMaterial.MICA_ALT;
            win32.setDwmAttribute(hwnd, DWMWA_MICA_EFFECT, micaOn ? 1 : 0);
        }

        if (backdrop != DWMSBT_NONE) {
            win32.extendFrameIntoClientArea(hwnd, -1, -1, -1, -1);
        }
    }

    static int backdropType(WindowsMaterial material)
    {
        return switch (material) {
            case MICA, MICA_ALT -> DWMSBT_MAINWINDOW;
            case ACRYLIC -> DWMSBT_TRANSIENT;
            case TABBED -> DWMSBT_TABBEDWINDOW;
            case NONE -> DWMSBT_NONE;
        };
    }

    @Override
    public void setShadow(Shadow shadow)
    {
        NativeWindowHandle hwnd = window();
        if (hwnd == null) {
            return;
        }
        win32.setDwmAttribute(hwnd, DWMWA_NCRENDERING_POLICY,
                shadow.enabled() ? DWMNCRP_ENABLED : DWMNCRP_DISABLED);
        win32.extendFrameIntoClientArea(hwnd, 0, 0, 0, shadow.enabled() ? 1 : 0);
    }

    @Override
    public void setCornerRadius(int radius)
    {
        NativeWindowHandle hwnd = window();
        if (hwnd == null || !isWindows11()) {
            return;
        }
        win32.setDwmAttribute(hwnd, DWMWA_WINDOW_CORNER_PREFERENCE, cornerPreference(radius));
    }

    static int cornerPreference(int radius)
    {
        if (radius <= 0) {
            return DWMWCP_DONOTROUND;
        }
        return radius <= 4 ? DWMWCP_ROUNDSMALL : DWMWCP_ROUND;
    }

    @Override
    public void setResizable(boolean resizable)
    {
        NativeWindowHandle hwnd = window();
        if (hwnd == null) {
            return;
        }
        int style = win32.getStyle(hwnd);
        style = resizable ? (style | WS_SIZEBOX) : (style & ~WS_SIZEBOX);
        win32.setStyle(hwnd, style);
        win32.refreshFrame(hwnd);
    }

    @Override
    public void setWindowButtons(boolean minimizable, boolean maximizable)
    {
        NativeWindowHandle hwnd = window();
        if (hwnd == null) {
            return;
        }
        int style = win32.getStyle(hwnd);
        style = minimizable ? (style | WS_MINIMIZEBOX) : (style & ~WS_MINIMIZEBOX);
        style = maximizable ? (style | WS_MAXIMIZEBOX) : (style & ~WS_MAXIMIZEBOX);
        win32.setStyle(hwnd, style);
        win32.refreshFrame(hwnd);
    }

    @Override
    public void setAlwaysOnTop(boolean alwaysOnTop)
    {
        NativeWindowHandle hwnd = window();
        if (hwnd != null) {
            win32.setTopmost(hwnd, alwaysOnTop);
        }
    }

    @Override
    public void setSkipTaskbar(boolean skipTaskbar)
    {
        NativeWindowHandle hwnd = window();
        if (hwnd == null) {
            return;
        }
        int exStyle = win32.getExStyle(hwnd);
        if (skipTaskbar) {
            exStyle = (exStyle | WS_EX_TOOLWINDOW) & ~WS_EX_APPWINDOW;
        }
        else {
            exStyle = (exStyle & ~WS_EX_TOOLWINDOW) | WS_EX_APPWINDOW;
        }
        win32.setExStyle(hwnd, exStyle);
        win32.refreshFrame(hwnd);
    }

    /**
     * Hit testing reads the regions back from the window; this only forces
     * a repaint so the engine refreshes them.
     */
    @Override
    public void setDragRegions(List<DragRegion> regions)
    {
        NativeWindowHandle hwnd = window();
        if (hwnd != null) {
            win32.invalidate(hwnd);
        }
    }
}
