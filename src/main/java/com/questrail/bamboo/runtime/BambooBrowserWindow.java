package com.questrail.bamboo.runtime;

import com.questrail.bamboo.api.BrowserError;
import com.questrail.bamboo.api.BrowserException;
import com.questrail.bamboo.api.BrowserWindow;
import com.questrail.bamboo.api.ConsoleEvent;
import com.questrail.bamboo.api.FindResult;
import com.questrail.bamboo.api.LoadEvent;
import com.questrail.bamboo.api.MessageCallback;
import com.questrail.bamboo.api.NativeFunction;
import com.questrail.bamboo.api.NavigationRequest;
import com.questrail.bamboo.api.ScriptValue;
import com.questrail.bamboo.bridge.BridgeChannel;
import com.questrail.bamboo.bridge.model.ReservedNames;
import com.questrail.bamboo.bridge.window.WindowControl;
import com.questrail.bamboo.config.BridgeTimingPolicy;
import com.questrail.bamboo.config.WindowConfig;
import com.questrail.bamboo.engine.EngineBrowser;
import com.questrail.bamboo.engine.EngineBrowserClient;
import com.questrail.bamboo.engine.EngineException;
import com.questrail.bamboo.engine.RenderingEngine;
import com.questrail.bamboo.internal.exec.OwnerThread;
import com.questrail.bamboo.internal.time.MonotonicClock;
import com.questrail.bamboo.internal.time.MonotonicScheduler;
import com.questrail.bamboo.internal.time.SystemWallClock;
import com.questrail.bamboo.observability.BridgeErrorEvent;
import com.questrail.bamboo.observability.BridgeObservabilitySink;
import com.questrail.bamboo.style.ChromeMode;
import com.questrail.bamboo.style.Color;
import com.questrail.bamboo.style.DragRegion;
import com.questrail.bamboo.style.MacOSVibrancy;
import com.questrail.bamboo.style.Shadow;
import com.questrail.bamboo.style.TitlebarStyle;
import com.questrail.bamboo.style.WindowStyle;
import com.questrail.bamboo.style.WindowsMaterial;
import com.questrail.bamboo.style.reconcile.StyleReconciler;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * BambooBrowserWindow
 * =============================================================================
 * Composition root for one window: engine browser, style reconciler and bridge
 * channel, all owned by the UI thread.
 *
 * <h2>Wiring</h2>
 * <pre>
 *   EngineBrowser.scriptEndpoint() ⇄ BridgeChannel
 *                                      ├─ StyleReconciler → PlatformCapabilityProvider
 *                                      └─ WindowControl   → EngineBrowser / StyleReconciler
 * </pre>
 *
 * <h2>Lifecycle</h2>
 * The window is torn down when the engine reports the browser closed: the
 * channel rejects outstanding calls, the close callback fires, and the owning
 * app forgets the window.
 */
public final class BambooBrowserWindow implements BrowserWindow
{
    static final double ZOOM_STEP = 1.2;

    private final WindowConfig config;
    private final EngineBrowser browser;
    private final OwnerThread ownerThread;
    private final BridgeObservabilitySink observabilitySink;
    private final StyleReconciler reconciler;
    private final BridgeChannel channel;
    private final Runnable onTeardown;

    private volatile boolean closed;

    /** Zoom factor the engine currently shows. Owner thread only. */
    private double engineZoomFactor = 1.0;

    private volatile Consumer<LoadEvent> loadCallback;
    private volatile Consumer<String> titleCallback;
    private volatile Runnable closeCallback;
    private volatile Consumer<ConsoleEvent> consoleCallback;
    private volatile Consumer<NavigationRequest> navigationCallback;
    private volatile Consumer<FindResult> findCallback;
    private volatile Consumer<Boolean> focusCallback;
    private volatile Consumer<WindowStyle> styleCallback;

    private BambooBrowserWindow(WindowConfig config,
                                EngineBrowser browser,
                                RenderingEngine engine,
                                OwnerThread ownerThread,
                                MonotonicClock clock,
                                MonotonicScheduler scheduler,
                                BridgeTimingPolicy timingPolicy,
                                BridgeObservabilitySink observabilitySink,
                                Runnable onTeardown)
    {
        this.config = config;
        this.browser = browser;
        this.ownerThread = ownerThread;
        this.observabilitySink = observabilitySink;
        this.onTeardown = onTeardown;

        this.reconciler = new StyleReconciler(
                engine.capabilityProvider(browser.windowHandle()),
                config.style(),
                observabilitySink);

        this.channel = BridgeChannel.builder()
                .withEndpoint(browser.scriptEndpoint())
                .withOwnerThread(ownerThread)
                .withClock(clock)
                .withScheduler(scheduler)
                .withTimingPolicy(timingPolicy)
                .withObservabilitySink(observabilitySink)
                .withStyleReconciler(reconciler)
                .withWindowControl(new ScriptWindowControl())
                .withScreenshotSource(browser::capturePng)
                .build();
    }

    /**
     * Create the engine browser and wire the window. Must run on the UI thread.
     *
     * @param onTeardown run on the UI thread once the window has closed
     * @throws BrowserException with {@link BrowserError#CREATE_FAILED} if the engine refuses
     */
    static BambooBrowserWindow create(WindowConfig config,
                                      RenderingEngine engine,
                                      OwnerThread ownerThread,
                                      MonotonicClock clock,
                                      MonotonicScheduler scheduler,
                                      BridgeTimingPolicy timingPolicy,
                                      BridgeObservabilitySink observabilitySink,
                                      Runnable onTeardown)
    {
        Objects.requireNonNull(config, "config");

        ClientRelay relay = new ClientRelay();
        EngineBrowser browser;
        try {
            browser = engine.createBrowser(config, BridgeScript.source(), relay);
        } catch (EngineException e) {
            throw new BrowserException(BrowserError.CREATE_FAILED, "Engine refused to create browser: " + e.getMessage(), e);
        }
        if (browser == null) {
            throw new BrowserException(BrowserError.CREATE_FAILED, "Engine returned no browser");
        }

        BambooBrowserWindow window = new BambooBrowserWindow(
                config, browser, engine, ownerThread, clock, scheduler, timingPolicy, observabilitySink, onTeardown);
        window.attach();
        relay.window = window;
        return window;
    }

    private void attach() {
        reconciler.applyInitial();
        reconciler.addStyleListener(this::onStyleApplied);

        WindowStyle style = reconciler.current();
        if (style.zoomFactor() != engineZoomFactor) {
            browser.setZoomLevel(zoomLevel(style.zoomFactor()));
            engineZoomFactor = style.zoomFactor();
        }
        channel.start();
    }

    /** Engine zoom level for a zoom factor: each level step is a factor of 1.2. */
    static double zoomLevel(double factor) {
        return Math.log(factor) / Math.log(ZOOM_STEP);
    }

    @Override
    public WindowConfig config() {
        return config;
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    BridgeChannel channel() {
        return channel;
    }

    // -------------------------------------------------------------------------
    // Bridge
    // -------------------------------------------------------------------------

    @Override
    public void sendMessage(String event, String jsonPayload) {
        channel.sendEvent(event, jsonPayload);
    }

    @Override
    public CompletableFuture<ScriptValue> evalRemote(String script) {
        return channel.invokeRemoteEval(script);
    }

    @Override
    public void executeScript(String script) {
        Objects.requireNonNull(script, "script");
        onOwner(() -> browser.executeScript(script));
    }

    @Override
    public void bindFunction(String name, NativeFunction function) {
        Objects.requireNonNull(name, "name");
        if (name.startsWith("__")) {
            throw new IllegalArgumentException("Names starting with '__' are reserved: " + name);
        }
        channel.bindFunction(name, function);
    }

    @Override
    public void unbindFunction(String name) {
        channel.unbindFunction(name);
    }

    // -------------------------------------------------------------------------
    // Style
    // -------------------------------------------------------------------------

    @Override
    public WindowStyle style() {
        return reconciler.current();
    }

    @Override
    public void setStyle(WindowStyle style) {
        Objects.requireNonNull(style, "style");
        onOwner(() -> reconciler.apply(style));
    }

    @Override
    public void setChromeMode(ChromeMode mode) {
        Objects.requireNonNull(mode, "mode");
        onOwner(() -> reconciler.setChromeMode(mode));
    }

    @Override
    public void setTitlebarStyle(TitlebarStyle titlebar) {
        Objects.requireNonNull(titlebar, "titlebar");
        onOwner(() -> reconciler.setTitlebarStyle(titlebar));
    }

    @Override
    public void setCornerRadius(int radius) {
        if (radius < 0) {
            throw new IllegalArgumentException("radius must be >= 0");
        }
        onOwner(() -> reconciler.setCornerRadius(radius));
    }

    @Override
    public void setMacOSVibrancy(MacOSVibrancy vibrancy) {
        Objects.requireNonNull(vibrancy, "vibrancy");
        onOwner(() -> reconciler.setMacOSVibrancy(vibrancy));
    }

    @Override
    public void setWindowsMaterial(WindowsMaterial material) {
        Objects.requireNonNull(material, "material");
        onOwner(() -> reconciler.setWindowsMaterial(material));
    }

    @Override
    public void setBackgroundColor(Color color) {
        Objects.requireNonNull(color, "color");
        onOwner(() -> reconciler.setBackgroundColor(color));
    }

    @Override
    public void setShadow(Shadow shadow) {
        Objects.requireNonNull(shadow, "shadow");
        onOwner(() -> reconciler.setShadow(shadow));
    }

    @Override
    public void setResizable(boolean resizable) {
        onOwner(() -> reconciler.setResizable(resizable));
    }

    @Override
    public void setAlwaysOnTop(boolean alwaysOnTop) {
        onOwner(() -> reconciler.setAlwaysOnTop(alwaysOnTop));
    }

    @Override
    public void setDragRegions(List<DragRegion> regions) {
        List<DragRegion> copy = List.copyOf(regions);
        onOwner(() -> reconciler.setDragRegions(copy));
    }

    private void onStyleApplied(WindowStyle style) {
        syncZoom(style);
        browser.executeScript(BridgeStyleSheet.injectionScript(BridgeStyleSheet.css(style)));
        Consumer<WindowStyle> cb = styleCallback;
        if (cb != null) {
            cb.accept(style);
        }
    }

    // -------------------------------------------------------------------------
    // Zoom
    // -------------------------------------------------------------------------

    @Override
    public void setZoom(double factor) {
        requireZoomFactor(factor);
        onOwner(() -> applyZoom(factor));
    }

    @Override
    public void zoomIn() {
        onOwner(() -> applyZoom(zoomFactor() * ZOOM_STEP));
    }

    @Override
    public void zoomOut() {
        onOwner(() -> applyZoom(zoomFactor() / ZOOM_STEP));
    }

    @Override
    public void resetZoom() {
        onOwner(() -> applyZoom(1.0));
    }

    @Override
    public double zoomFactor() {
        return reconciler.current().zoomFactor();
    }

    private void applyZoom(double factor) {
        WindowStyle current = reconciler.current();
        if (!current.allowZoom()) {
            return;
        }
        reconciler.apply(current.toBuilder().withZoomFactor(factor).build());
    }

    /**
     * Bring the engine to the model's zoom factor, whichever path changed it.
     * While {@code allowZoom} is off the engine keeps its current level.
     */
    private void syncZoom(WindowStyle style) {
        if (!style.allowZoom() || style.zoomFactor() == engineZoomFactor) {
            return;
        }
        browser.setZoomLevel(zoomLevel(style.zoomFactor()));
        engineZoomFactor = style.zoomFactor();
    }

    private static void requireZoomFactor(double factor) {
        if (!(factor > 0) || Double.isInfinite(factor)) {
            throw new IllegalArgumentException("zoom factor must be positive and finite: " + factor);
        }
    }

    // -------------------------------------------------------------------------
    // Navigation
    // -------------------------------------------------------------------------

    @Override
    public void navigate(String url) {
        Objects.requireNonNull(url, "url");
        onOwner(() -> browser.loadUrl(url));
    }

    @Override
    public void reload(boolean ignoreCache) {
        onOwner(() -> browser.reload(ignoreCache));
    }

    @Override
    public void goBack() {
        onOwner(() -> {
            if (browser.canGoBack()) {
                browser.goBack();
            }
        });
    }

    @Override
    public void goForward() {
        onOwner(() -> {
            if (browser.canGoForward()) {
                browser.goForward();
            }
        });
    }

    @Override
    public void stop() {
        onOwner(browser::stopLoad);
    }

    @Override
    public String currentUrl() {
        return closed ? "" : browser.url();
    }

    @Override
    public boolean isLoading() {
        return !closed && browser.isLoading();
    }

    @Override
    public boolean canGoBack() {
        return !closed && browser.canGoBack();
    }

    @Override
    public boolean canGoForward() {
        return !closed && browser.canGoForward();
    }

    // -------------------------------------------------------------------------
    // Window
    // -------------------------------------------------------------------------

    @Override
    public void show() {
        onOwner(() -> browser.setVisible(true));
    }

    @Override
    public void hide() {
        onOwner(() -> browser.setVisible(false));
    }

    @Override
    public void focus() {
        onOwner(browser::focus);
    }

    @Override
    public void center() {
        onOwner(browser::center);
    }

    @Override
    public void resize(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("width and height must be positive");
        }
        onOwner(() -> browser.resize(width, height));
    }

    @Override
    public void move(int x, int y) {
        onOwner(() -> browser.move(x, y));
    }

    @Override
    public void setMinSize(int width, int height) {
        requireNonNegative(width, height);
        onOwner(() -> browser.setMinSize(width, height));
    }

    @Override
    public void setMaxSize(int width, int height) {
        requireNonNegative(width, height);
        onOwner(() -> browser.setMaxSize(width, height));
    }

    @Override
    public void minimize() {
        onOwner(browser::minimize);
    }

    @Override
    public void maximize() {
        onOwner(browser::maximize);
    }

    @Override
    public void restore() {
        onOwner(browser::restore);
    }

    @Override
    public void setTitle(String title) {
        Objects.requireNonNull(title, "title");
        onOwner(() -> browser.setTitle(title));
    }

    @Override
    public void setFullscreen(boolean fullscreen) {
        onOwner(() -> browser.setFullscreen(fullscreen));
    }

    @Override
    public void close() {
        onOwner(browser::close);
    }

    private static void requireNonNegative(int width, int height) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("size limits must be non-negative");
        }
    }

    // -------------------------------------------------------------------------
    // Page tools
    // -------------------------------------------------------------------------

    @Override
    public void findText(String text, boolean forward, boolean caseSensitive) {
        Objects.requireNonNull(text, "text");
        onOwner(() -> browser.find(text, forward, caseSensitive));
    }

    @Override
    public void clearFind() {
        onOwner(() -> browser.stopFinding(true));
    }

    @Override
    public void print() {
        onOwner(browser::print);
    }

    @Override
    public CompletableFuture<Boolean> printToPdf(Path path) {
        Objects.requireNonNull(path, "path");
        if (closed) {
            return CompletableFuture.failedFuture(
                    new BrowserException(BrowserError.INVALID_STATE, "Window is closed"));
        }
        return browser.printToPdf(path);
    }

    @Override
    public CompletableFuture<byte[]> captureScreenshot() {
        if (closed) {
            return CompletableFuture.failedFuture(
                    new BrowserException(BrowserError.INVALID_STATE, "Window is closed"));
        }
        return browser.capturePng();
    }

    @Override
    public void openDevTools(boolean docked) {
        onOwner(() -> {
            if (reconciler.current().devTools()) {
                browser.showDevTools(docked);
            }
        });
    }

    @Override
    public void closeDevTools() {
        onOwner(browser::closeDevTools);
    }

    // -------------------------------------------------------------------------
    // Notifications
    // -------------------------------------------------------------------------

    @Override
    public void onLoad(Consumer<LoadEvent> callback) {
        this.loadCallback = callback;
    }

    @Override
    public void onTitleChange(Consumer<String> callback) {
        this.titleCallback = callback;
    }

    @Override
    public void onClose(Runnable callback) {
        this.closeCallback = callback;
    }

    @Override
    public void onConsole(Consumer<ConsoleEvent> callback) {
        this.consoleCallback = callback;
    }

    @Override
    public void onMessage(MessageCallback callback) {
        channel.setMessageCallback(callback);
    }

    @Override
    public void onNavigation(Consumer<NavigationRequest> callback) {
        this.navigationCallback = callback;
    }

    @Override
    public void onFind(Consumer<FindResult> callback) {
        this.findCallback = callback;
    }

    @Override
    public void onFocusChange(Consumer<Boolean> callback) {
        this.focusCallback = callback;
    }

    @Override
    public void onStyleChange(Consumer<WindowStyle> callback) {
        this.styleCallback = callback;
    }

    // -------------------------------------------------------------------------
    // Engine notifications
    // -------------------------------------------------------------------------

    private void handleLoad(LoadEvent event) {
        if (!event.error()) {
            String css = BridgeStyleSheet.css(reconciler.current());
            if (!css.isEmpty()) {
                browser.executeScript(BridgeStyleSheet.injectionScript(css));
            }
        }
        deliver("load", loadCallback, event);
    }

    private boolean handleNavigation(NavigationRequest request) {
        Consumer<NavigationRequest> cb = navigationCallback;
        if (cb != null) {
            try {
                cb.accept(request);
            } catch (RuntimeException e) {
                reportCallbackFailure("navigation", e);
            }
        }
        return request.isAllowed();
    }

    private boolean handleContextMenu() {
        switch (reconciler.current().contextMenu()) {
            case DISABLED:
                return false;
            case CUSTOM:
                channel.sendEvent(ReservedNames.CONTEXT_MENU, "null");
                return false;
            default:
                return true;
        }
    }

    /**
     * Close the browser and tear down immediately, without waiting for the
     * engine's close notification. Used at application shutdown, when the UI
     * loop may no longer be running.
     */
    void closeNow() {
        if (closed) {
            return;
        }
        browser.close();
        teardown();
    }

    private void teardown() {
        if (closed) {
            return;
        }
        closed = true;
        channel.close();

        Runnable cb = closeCallback;
        if (cb != null) {
            try {
                cb.run();
            } catch (RuntimeException e) {
                reportCallbackFailure("close", e);
            }
        }
        onTeardown.run();
    }

    private <T> void deliver(String what, Consumer<T> callback, T value) {
        if (callback == null) {
            return;
        }
        try {
            callback.accept(value);
        } catch (RuntimeException e) {
            reportCallbackFailure(what, e);
        }
    }

    private void reportCallbackFailure(String what, RuntimeException e) {
        observabilitySink.onError(new BridgeErrorEvent(
                SystemWallClock.INSTANCE.now(), "Host " + what + " callback failed", e));
    }

    private void onOwner(Runnable task) {
        ownerThread.execute(() -> {
            if (!closed) {
                task.run();
            }
        });
    }

    /**
     * Window commands arriving from page script.
     */
    private final class ScriptWindowControl implements WindowControl
    {
        @Override
        public void minimize() {
            browser.minimize();
        }

        @Override
        public void maximize() {
            browser.maximize();
        }

        @Override
        public void restore() {
            browser.restore();
        }

        @Override
        public void close() {
            browser.close();
        }

        @Override
        public void setTitle(String title) {
            browser.setTitle(title);
        }

        @Override
        public void setAlwaysOnTop(boolean alwaysOnTop) {
            reconciler.setAlwaysOnTop(alwaysOnTop);
        }

        @Override
        public void setFullscreen(boolean fullscreen) {
            browser.setFullscreen(fullscreen);
        }

        @Override
        public void setZoom(double factor) {
            if (factor > 0 && !Double.isInfinite(factor)) {
                applyZoom(factor);
            }
        }

        @Override
        public void openDevTools(boolean docked) {
            if (reconciler.current().devTools()) {
                browser.showDevTools(docked);
            }
        }

        @Override
        public void print() {
            browser.print();
        }
    }

    /**
     * Forwards engine notifications once the window is wired. Notifications
     * that arrive during creation fall back to the defaults.
     */
    private static final class ClientRelay implements EngineBrowserClient
    {
        private volatile BambooBrowserWindow window;

        @Override
        public void onLoad(LoadEvent event) {
            BambooBrowserWindow w = window;
            if (w != null) {
                w.onOwner(() -> w.handleLoad(event));
            }
        }

        @Override
        public void onTitleChange(String title) {
            BambooBrowserWindow w = window;
            if (w != null) {
                w.onOwner(() -> w.deliver("title", w.titleCallback, title));
            }
        }

        @Override
        public void onConsole(ConsoleEvent event) {
            BambooBrowserWindow w = window;
            if (w != null) {
                w.onOwner(() -> w.deliver("console", w.consoleCallback, event));
            }
        }

        @Override
        public void onFocusChange(boolean focused) {
            BambooBrowserWindow w = window;
            if (w != null) {
                w.onOwner(() -> w.deliver("focus", w.focusCallback, focused));
            }
        }

        @Override
        public void onFind(FindResult result) {
            BambooBrowserWindow w = window;
            if (w != null) {
                w.onOwner(() -> w.deliver("find", w.findCallback, result));
            }
        }

        @Override
        public boolean onBeforeNavigation(NavigationRequest request) {
            BambooBrowserWindow w = window;
            return w == null || w.handleNavigation(request);
        }

        @Override
        public boolean onContextMenu() {
            BambooBrowserWindow w = window;
            return w == null || w.handleContextMenu();
        }

        @Override
        public void onClosed() {
            BambooBrowserWindow w = window;
            if (w != null) {
                w.ownerThread.execute(w::teardown);
            }
        }
    }
}
