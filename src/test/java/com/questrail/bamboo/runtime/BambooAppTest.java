package com.questrail.bamboo.runtime;

import com.questrail.bamboo.api.AppError;
import com.questrail.bamboo.api.AppInitException;
import com.questrail.bamboo.api.BrowserError;
import com.questrail.bamboo.api.BrowserException;
import com.questrail.bamboo.api.BrowserWindow;
import com.questrail.bamboo.config.AppConfig;
import com.questrail.bamboo.config.WindowConfig;
import com.questrail.bamboo.engine.FakeRenderingEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BambooAppTest
 * -----------------------------------------------------------------------------
 * Startup validation, the one-instance rule and shutdown against a fake engine.
 */
final class BambooAppTest
{
    private static final String[] NO_ARGS = new String[0];

    private final FakeRenderingEngine engine = new FakeRenderingEngine();
    private BambooApp app;

    @AfterEach
    void tearDown() {
        if (app != null) {
            app.close();
        }
        assertNull(BambooApp.current());
    }

    private static AppError failure(String[] args, AppConfig config, FakeRenderingEngine engine) {
        AppInitException e = assertThrows(AppInitException.class, () -> BambooApp.create(args, config, engine));
        return e.error();
    }

    @Test
    void invalidArgumentsAreRejected() {
        assertEquals(AppError.INVALID_ARGUMENTS, failure(null, AppConfig.defaults(), engine));
        assertEquals(AppError.INVALID_ARGUMENTS, failure(new String[] { null }, AppConfig.defaults(), engine));
        assertEquals(AppError.INVALID_ARGUMENTS, failure(NO_ARGS, null, engine));
        assertEquals(AppError.INVALID_ARGUMENTS, failure(NO_ARGS, AppConfig.defaults(), null));
        assertEquals(AppError.INVALID_ARGUMENTS,
                failure(NO_ARGS, AppConfig.builder().withName("  ").build(), engine));
        assertEquals(AppError.INVALID_ARGUMENTS,
                failure(NO_ARGS, AppConfig.builder().withRemoteDebugging(true, 70000).build(), engine));
    }

    @Test
    void engineVersionMustMatch() {
        assertEquals(AppError.VERSION_MISMATCH,
                failure(NO_ARGS, AppConfig.defaults(), new FakeRenderingEngine().withApiVersion(-1)));
    }

    @Test
    void onlyOneInstancePerProcess() throws Exception {
        app = BambooApp.create(NO_ARGS, AppConfig.defaults(), engine);

        assertEquals(AppError.ALREADY_RUNNING, failure(NO_ARGS, AppConfig.defaults(), new FakeRenderingEngine()));
        assertSame(app, BambooApp.current());
    }

    @Test
    void engineFailureReleasesInstance() throws Exception {
        assertEquals(AppError.INIT_FAILED,
                failure(NO_ARGS, AppConfig.defaults(), new FakeRenderingEngine().failingInitialize("no sandbox")));

        app = BambooApp.create(NO_ARGS, AppConfig.defaults(), engine);
        assertNotNull(app);
    }

    @Test
    void engineReceivesSettings() throws Exception {
        app = BambooApp.create(NO_ARGS, AppConfig.builder().withName("Notes").withVersion("3.0").build(), engine);

        assertEquals("Notes/3.0 Bamboo/" + BambooApp.VERSION, engine.settings().userAgent());
        assertEquals(BambooApp.VERSION, app.version());
    }

    @Test
    void closeShutsDownWindowsAndEngine() throws Exception {
        app = BambooApp.create(NO_ARGS, AppConfig.defaults(), engine);
        BrowserWindow window = app.createWindow(WindowConfig.defaults());
        boolean[] closed = new boolean[1];
        window.onClose(() -> closed[0] = true);
        assertEquals(1, app.openWindows());

        app.close();

        assertTrue(app.isClosed());
        assertTrue(window.isClosed());
        assertTrue(closed[0]);
        assertTrue(engine.lastBrowser().isClosed());
        assertTrue(engine.isShutdown());
        assertEquals(0, app.openWindows());
        assertNull(BambooApp.current());
    }

    @Test
    void noWindowsAfterClose() throws Exception {
        app = BambooApp.create(NO_ARGS, AppConfig.defaults(), engine);
        app.close();

        BrowserException e = assertThrows(BrowserException.class, () -> app.createWindow(WindowConfig.defaults()));
        assertEquals(BrowserError.INVALID_STATE, e.error());
        assertThrows(IllegalStateException.class, app::run);
    }

    @Test
    void engineRefusalSurfacesAsCreateFailed() throws Exception {
        app = BambooApp.create(NO_ARGS, AppConfig.defaults(), engine.failingCreate("out of memory"));

        BrowserException e = assertThrows(BrowserException.class, () -> app.createWindow(WindowConfig.defaults()));
        assertEquals(BrowserError.CREATE_FAILED, e.error());
        assertEquals(0, app.openWindows());
    }

    @Test
    void runAdoptsCallingThreadUntilQuit() throws Exception {
        app = BambooApp.create(NO_ARGS, AppConfig.defaults(), engine);
        Thread ui = new Thread(app::run, "test-ui");
        ui.start();

        CompletableFuture<Boolean> onUiThread = new CompletableFuture<>();
        app.postUITask(() -> onUiThread.complete(app.isUIThread()));
        assertTrue(onUiThread.get(5, TimeUnit.SECONDS));
        assertFalse(app.isUIThread());

        BrowserException e = assertThrows(BrowserException.class, () -> app.createWindow(WindowConfig.defaults()));
        assertEquals(BrowserError.INVALID_STATE, e.error());

        CompletableFuture<BrowserWindow> created = new CompletableFuture<>();
        app.postUITask(() -> created.complete(app.createWindow(WindowConfig.defaults())));
        assertFalse(created.get(5, TimeUnit.SECONDS).isClosed());

        app.quit();
        ui.join(5000);
        assertFalse(ui.isAlive());
    }
}
