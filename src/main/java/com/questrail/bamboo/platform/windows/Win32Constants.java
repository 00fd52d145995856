package com.questrail.bamboo.platform.windows;

/**
 * Window style bits and DWM attribute ids, as defined by the Windows SDK.
 * Some of the DWM values are missing from older SDK headers.
 */
final class Win32Constants
{
    private Win32Constants() {}

    static final int S_OK = 0;

    static final int WS_POPUP       = 0x80000000;
    static final int WS_CAPTION     = 0x00C00000;
    static final int WS_SYSMENU     = 0x00080000;
    static final int WS_THICKFRAME  = 0x00040000;
    static final int WS_SIZEBOX     = WS_THICKFRAME;
    static final int WS_MINIMIZEBOX = 0x00020000;
    static final int WS_MAXIMIZEBOX = 0x00010000;

    static final int WS_EX_TOOLWINDOW = 0x00000080;
    static final int WS_EX_APPWINDOW  = 0x00040000;
    static final int WS_EX_LAYERED    = 0x00080000;

    static final int DWMWA_NCRENDERING_POLICY       = 2;
    static final int DWMWA_USE_IMMERSIVE_DARK_MODE  = 20;
    static final int DWMWA_WINDOW_CORNER_PREFERENCE = 33;
    static final int DWMWA_SYSTEMBACKDROP_TYPE      = 38;
    static final int DWMWA_MICA_EFFECT              = 1029;

    static final int DWMNCRP_DISABLED = 1;
    static final int DWMNCRP_ENABLED  = 2;

    static final int DWMSBT_NONE         = 1;
    static final int DWMSBT_MAINWINDOW   = 2;
    static final int DWMSBT_TRANSIENT    = 3;
    static final int DWMSBT_TABBEDWINDOW = 4;

    static final int DWMWCP_DEFAULT    = 0;
    static final int DWMWCP_DONOTROUND = 1;
    static final int DWMWCP_ROUND      = 2;
    static final int DWMWCP_ROUNDSMALL = 3;

    static final int WINDOWS_11_BUILD = 22000;
}
