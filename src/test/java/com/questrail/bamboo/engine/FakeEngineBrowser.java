package com.questrail.bamboo.engine;

import com.questrail.bamboo.config.WindowConfig;
import com.questrail.bamboo.platform.FakeWindowHandle;
import com.questrail.bamboo.platform.NativeWindowHandle;
import com.questrail.bamboo.transport.FakeScriptEndpoint;
import com.questrail.bamboo.transport.ScriptEndpoint;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * FakeEngineBrowser
 * -----------------------------------------------------------------------------
 * Engine browser that records every command as a string and answers queries
 * from plain fields. Closing reports back through the client synchronously.
 */
public final class FakeEngineBrowser implements EngineBrowser {

    private final WindowConfig config;
    private final String bootstrapScript;
    private final EngineBrowserClient client;
    private final FakeWindowHandle handle = new FakeWindowHandle();
    private final FakeScriptEndpoint endpoint = new FakeScriptEndpoint();

    private final List<String> commands = new ArrayList<>();
    private final List<String> scripts = new ArrayList<>();

    private String url;
    private boolean loading;
    private boolean canGoBack;
    private boolean canGoForward;
    private double zoomLevel;
    private CompletableFuture<byte[]> screenshot = CompletableFuture.completedFuture(new byte[] { 1, 2, 3 });
    private boolean closed;

    FakeEngineBrowser(WindowConfig config, String bootstrapScript, EngineBrowserClient client) {
        this.config = config;
        this.bootstrapScript = bootstrapScript;
        this.client = client;
        this.url = config.url();
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public WindowConfig config() {
        return config;
    }

    public String bootstrapScript() {
        return bootstrapScript;
    }

    public EngineBrowserClient client() {
        return client;
    }

    public FakeScriptEndpoint endpoint() {
        return endpoint;
    }

    public FakeWindowHandle handle() {
        return handle;
    }

    public List<String> commands() {
        return List.copyOf(commands);
    }

    public List<String> scripts() {
        return List.copyOf(scripts);
    }

    public double zoomLevel() {
        return zoomLevel;
    }

    public boolean isClosed() {
        return closed;
    }

    public void setHistory(boolean back, boolean forward) {
        this.canGoBack = back;
        this.canGoForward = forward;
    }

    public void setScreenshot(CompletableFuture<byte[]> screenshot) {
        this.screenshot = screenshot;
    }

    // ---------------------------------------------------------------------
    // EngineBrowser
    // ---------------------------------------------------------------------

    @Override
    public NativeWindowHandle windowHandle() {
        return handle;
    }

    @Override
    public ScriptEndpoint scriptEndpoint() {
        return endpoint;
    }

    @Override
    public void loadUrl(String url) {
        commands.add("loadUrl " + url);
        this.url = url;
        this.loading = true;
    }

    @Override
    public void reload(boolean ignoreCache) {
        commands.add("reload " + ignoreCache);
    }

    @Override
    public void goBack() {
        commands.add("goBack");
    }

    @Override
    public void goForward() {
        commands.add("goForward");
    }

    @Override
    public void stopLoad() {
        commands.add("stopLoad");
        loading = false;
    }

    @Override
    public String url() {
        return url;
    }

    @Override
    public boolean isLoading() {
        return loading;
    }

    @Override
    public boolean canGoBack() {
        return canGoBack;
    }

    @Override
    public boolean canGoForward() {
        return canGoForward;
    }

    @Override
    public void executeScript(String script) {
        scripts.add(script);
    }

    @Override
    public void setVisible(boolean visible) {
        commands.add("setVisible " + visible);
    }

    @Override
    public void focus() {
        commands.add("focus");
    }

    @Override
    public void center() {
        commands.add("center");
    }

    @Override
    public void resize(int width, int height) {
        commands.add("resize " + width + "x" + height);
    }

    @Override
    public void move(int x, int y) {
        commands.add("move " + x + "," + y);
    }

    @Override
    public void setMinSize(int width, int height) {
        commands.add("setMinSize " + width + "x" + height);
    }

    @Override
    public void setMaxSize(int width, int height) {
        commands.add("setMaxSize " + width + "x" + height);
    }

    @Override
    public void minimize() {
        commands.add("minimize");
    }

    @Override
    public void maximize() {
        commands.add("maximize");
    }

    @Override
    public void restore() {
        commands.add("restore");
    }

    @Override
    public void setTitle(String title) {
        commands.add("setTitle " + title);
    }

    @Override
    public void setFullscreen(boolean fullscreen) {
        commands.add("setFullscreen " + fullscreen);
    }

    @Override
    public void close() {
        commands.add("close");
        if (!closed) {
            closed = true;
            handle.destroy();
            client.onClosed();
        }
    }

    @Override
    public void setZoomLevel(double level) {
        commands.add("setZoomLevel");
        this.zoomLevel = level;
    }

    @Override
    public void find(String text, boolean forward, boolean matchCase) {
        commands.add("find " + text + " " + forward + " " + matchCase);
    }

    @Override
    public void stopFinding(boolean clearSelection) {
        commands.add("stopFinding " + clearSelection);
    }

    @Override
    public void print() {
        commands.add("print");
    }

    @Override
    public CompletableFuture<Boolean> printToPdf(Path path) {
        commands.add("printToPdf " + path);
        return CompletableFuture.completedFuture(true);
    }

    @Override
    public CompletableFuture<byte[]> capturePng() {
        commands.add("capturePng");
        return screenshot;
    }

    @Override
    public void showDevTools(boolean docked) {
        commands.add("showDevTools " + docked);
    }

    @Override
    public void closeDevTools() {
        commands.add("closeDevTools");
    }
}
