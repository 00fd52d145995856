package com.questrail.bamboo.bridge.window;

/**
 * The native operations behind the window-command vocabulary.
 *
 * <p>Implementations are invoked on the owner thread. Operations should be
 * idempotent where that makes sense: maximizing a maximized window changes
 * nothing observable.</p>
 */
public interface WindowControl
{
    void minimize();

    void maximize();

    void restore();

    void close();

    void setTitle(String title);

    void setAlwaysOnTop(boolean alwaysOnTop);

    void setFullscreen(boolean fullscreen);

    void setZoom(double factor);

    void openDevTools(boolean docked);

    void print();
}
