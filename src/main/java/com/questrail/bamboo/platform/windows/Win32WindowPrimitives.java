package com.questrail.bamboo.platform.windows;

import com.questrail.bamboo.platform.NativeWindowHandle;

/**
 * Win32WindowPrimitives
 * -----------------------------------------------------------------------------
 * Port onto the user32 and dwmapi calls {@link WindowsCapabilityProvider} needs.
 *
 * <p>The binding itself (JNA, JNI or the engine's own host API) lives with
 * the rendering engine integration. This interface exists so the mapping from
 * style intent to window bits stays in pure Java and can be tested.</p>
 */
public interface Win32WindowPrimitives
{
    /** Windows build number; 22000 and later is Windows 11. */
    int osBuildNumber();

    /** {@code GetWindowLong(GWL_STYLE)} */
    int getStyle(NativeWindowHandle hwnd);

    /** {@code SetWindowLong(GWL_STYLE)} */
    void setStyle(NativeWindowHandle hwnd, int style);

    /** {@code GetWindowLong(GWL_EXSTYLE)} */
    int getExStyle(NativeWindowHandle hwnd);

    /** {@code SetWindowLong(GWL_EXSTYLE)} */
    void setExStyle(NativeWindowHandle hwnd, int exStyle);

    /** {@code SetWindowPos(SWP_NOMOVE | SWP_NOSIZE | SWP_NOZORDER | SWP_FRAMECHANGED)} */
    void refreshFrame(NativeWindowHandle hwnd);

    /** {@code SetWindowPos(HWND_TOPMOST | HWND_NOTOPMOST)} */
    void setTopmost(NativeWindowHandle hwnd, boolean topmost);

    /** {@code SetLayeredWindowAttributes(LWA_ALPHA)} */
    void setLayeredAlpha(NativeWindowHandle hwnd, int alpha);

    /**
     * {@code DwmSetWindowAttribute} with a 32-bit value.
     *
     * @return the HRESULT; {@link Win32Constants#S_OK} on success
     */
    int setDwmAttribute(NativeWindowHandle hwnd, int attribute, int value);

    /** {@code DwmExtendFrameIntoClientArea} */
    void extendFrameIntoClientArea(NativeWindowHandle hwnd, int left, int right, int top, int bottom);

    /** Replace the class background brush with a solid COLORREF brush. */
    void setClassBackground(NativeWindowHandle hwnd, int colorRef);

    /** {@code InvalidateRect(NULL)} */
    void invalidate(NativeWindowHandle hwnd);
}
