package com.questrail.bamboo.api;

import com.questrail.bamboo.config.WindowConfig;
import com.questrail.bamboo.style.ChromeMode;
import com.questrail.bamboo.style.Color;
import com.questrail.bamboo.style.DragRegion;
import com.questrail.bamboo.style.MacOSVibrancy;
import com.questrail.bamboo.style.Shadow;
import com.questrail.bamboo.style.TitlebarStyle;
import com.questrail.bamboo.style.WindowStyle;
import com.questrail.bamboo.style.WindowsMaterial;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * BrowserWindow
 * =============================================================================
 * A native window hosting one page, as seen by the host application.
 *
 * <h2>Threading</h2>
 * Every method may be called from any thread. Mutations are marshaled onto the
 * UI thread and run in call order. Callbacks are delivered on the UI thread.
 *
 * <h2>Callbacks</h2>
 * Each {@code onXxx} registration replaces the previous one for that
 * notification.
 */
public interface BrowserWindow
{
    WindowConfig config();

    boolean isClosed();

    // -------------------------------------------------------------------------
    // Bridge
    // -------------------------------------------------------------------------

    /**
     * Publish an event to the page's {@code bamboo.on(event, ...)} subscribers.
     *
     * @param jsonPayload JSON text
     */
    void sendMessage(String event, String jsonPayload);

    /**
     * Evaluate script in the page. Fails with {@code BridgeTimeoutException}
     * when no reply arrives within the call timeout, and with
     * {@link BrowserException} ({@link BrowserError#SCRIPT_EXCEPTION}) if the
     * script throws.
     */
    CompletableFuture<ScriptValue> evalRemote(String script);

    /** Run script in the page without waiting for a result. */
    void executeScript(String script);

    /**
     * Make {@code function} callable from the page as {@code bamboo.call(name, ...)}.
     * The function runs on the UI thread and must not block.
     */
    void bindFunction(String name, NativeFunction function);

    void unbindFunction(String name);

    // -------------------------------------------------------------------------
    // Style
    // -------------------------------------------------------------------------

    WindowStyle style();

    void setStyle(WindowStyle style);

    void setChromeMode(ChromeMode mode);

    void setTitlebarStyle(TitlebarStyle titlebar);

    void setCornerRadius(int radius);

    void setMacOSVibrancy(MacOSVibrancy vibrancy);

    void setWindowsMaterial(WindowsMaterial material);

    void setBackgroundColor(Color color);

    void setShadow(Shadow shadow);

    void setResizable(boolean resizable);

    void setAlwaysOnTop(boolean alwaysOnTop);

    void setDragRegions(List<DragRegion> regions);

    // -------------------------------------------------------------------------
    // Zoom
    // -------------------------------------------------------------------------

    /** Ignored while the style disallows zoom. */
    void setZoom(double factor);

    void zoomIn();

    void zoomOut();

    void resetZoom();

    double zoomFactor();

    // -------------------------------------------------------------------------
    // Navigation
    // -------------------------------------------------------------------------

    void navigate(String url);

    void reload(boolean ignoreCache);

    void goBack();

    void goForward();

    void stop();

    String currentUrl();

    boolean isLoading();

    boolean canGoBack();

    boolean canGoForward();

    // -------------------------------------------------------------------------
    // Window
    // -------------------------------------------------------------------------

    void show();

    void hide();

    void focus();

    void center();

    void resize(int width, int height);

    void move(int x, int y);

    void setMinSize(int width, int height);

    void setMaxSize(int width, int height);

    void minimize();

    void maximize();

    void restore();

    void setTitle(String title);

    void setFullscreen(boolean fullscreen);

    void close();

    // -------------------------------------------------------------------------
    // Page tools
    // -------------------------------------------------------------------------

    void findText(String text, boolean forward, boolean caseSensitive);

    void clearFind();

    void print();

    CompletableFuture<Boolean> printToPdf(Path path);

    /** PNG bytes of the current page. */
    CompletableFuture<byte[]> captureScreenshot();

    void openDevTools(boolean docked);

    void closeDevTools();

    // -------------------------------------------------------------------------
    // Notifications
    // -------------------------------------------------------------------------

    void onLoad(Consumer<LoadEvent> callback);

    void onTitleChange(Consumer<String> callback);

    void onClose(Runnable callback);

    void onConsole(Consumer<ConsoleEvent> callback);

    /** Receives every non-reserved event the page sends. */
    void onMessage(MessageCallback callback);

    /** Receives each navigation before it happens; call {@link NavigationRequest#deny()} to block it. */
    void onNavigation(Consumer<NavigationRequest> callback);

    void onFind(Consumer<FindResult> callback);

    void onFocusChange(Consumer<Boolean> callback);

    /** Fires after every style application with the new model. */
    void onStyleChange(Consumer<WindowStyle> callback);
}
