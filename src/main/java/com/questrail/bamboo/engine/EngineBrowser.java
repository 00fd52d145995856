package com.questrail.bamboo.engine;

import com.questrail.bamboo.platform.NativeWindowHandle;
import com.questrail.bamboo.transport.ScriptEndpoint;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

/**
 * One engine browser: a page plus the native window hosting it.
 *
 * <p>Operations are invoked on the owner thread. Query methods may be called
 * from any thread.</p>
 */
public interface EngineBrowser
{
    NativeWindowHandle windowHandle();

    /** Carries bridge payloads to and from this browser's page. */
    ScriptEndpoint scriptEndpoint();

    // navigation

    void loadUrl(String url);

    void reload(boolean ignoreCache);

    void goBack();

    void goForward();

    void stopLoad();

    String url();

    boolean isLoading();

    boolean canGoBack();

    boolean canGoForward();

    /** Run script in the main frame without waiting for a result. */
    void executeScript(String script);

    // window

    void setVisible(boolean visible);

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

    /** Request close; the engine answers with {@link EngineBrowserClient#onClosed()}. */
    void close();

    // page

    void setZoomLevel(double level);

    void find(String text, boolean forward, boolean matchCase);

    void stopFinding(boolean clearSelection);

    void print();

    CompletableFuture<Boolean> printToPdf(Path path);

    CompletableFuture<byte[]> capturePng();

    void showDevTools(boolean docked);

    void closeDevTools();
}
