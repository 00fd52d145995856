package com.questrail.bamboo.runtime;

import com.questrail.bamboo.api.AppError;
import com.questrail.bamboo.api.AppInitException;
import com.questrail.bamboo.api.BrowserError;
import com.questrail.bamboo.api.BrowserException;
import com.questrail.bamboo.api.BrowserWindow;
import com.questrail.bamboo.config.AppConfig;
import com.questrail.bamboo.config.BridgeTimingPolicy;
import com.questrail.bamboo.config.WindowConfig;
import com.questrail.bamboo.engine.EngineException;
import com.questrail.bamboo.engine.EngineSettings;
import com.questrail.bamboo.engine.RenderingEngine;
import com.questrail.bamboo.internal.exec.EventLoopOwnerThread;
import com.questrail.bamboo.internal.time.MonotonicClock;
import com.questrail.bamboo.internal.time.ScheduledExecutorScheduler;
import com.questrail.bamboo.internal.time.SystemMonotonicClock;
import com.questrail.bamboo.observability.BridgeObservabilitySink;
import com.questrail.bamboo.observability.Slf4jBridgeObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * BambooApp
 * =============================================================================
 * Process-level runtime: engine initialization, the UI loop and window
 * creation.
 *
 * <h2>Usage</h2>
 * <pre>
 *   try (BambooApp app = BambooApp.create(args, config, engine)) {
 *       BrowserWindow win = app.createWindow(windowConfig);
 *       win.onClose(app::quit);
 *       app.run();
 *   }
 * </pre>
 *
 * <h2>Threading</h2>
 * {@link #run()} turns the calling thread into the UI thread. Windows are
 * created on the thread that calls {@link #run()}: either before the loop
 * starts, or from a task running on it.
 *
 * <p>Only one instance may be live per process.</p>
 */
public final class BambooApp implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(BambooApp.class);

    public static final String VERSION = "1.0.0";

    private static final AtomicReference<BambooApp> INSTANCE = new AtomicReference<>();

    private final AppConfig config;
    private final RenderingEngine engine;
    private final BridgeObservabilitySink observabilitySink;
    private final BridgeTimingPolicy timingPolicy;
    private final MonotonicClock clock;
    private final EventLoopOwnerThread uiThread;
    private final ScheduledExecutorService timerExecutor;
    private final ScheduledExecutorScheduler scheduler;
    private final List<BambooBrowserWindow> windows = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private BambooApp(AppConfig config, RenderingEngine engine, BridgeTimingPolicy timingPolicy) {
        this.config = config;
        this.engine = engine;
        this.timingPolicy = timingPolicy;
        this.observabilitySink = new Slf4jBridgeObservabilitySink();
        this.clock = SystemMonotonicClock.INSTANCE;
        this.uiThread = new EventLoopOwnerThread("bamboo-ui", observabilitySink);
        this.timerExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "bamboo-timer");
            t.setDaemon(true);
            return t;
        });
        this.scheduler = new ScheduledExecutorScheduler(timerExecutor, clock);
    }

    public static BambooApp create(String[] args, AppConfig config, RenderingEngine engine) throws AppInitException {
        return create(args, config, engine, BridgeTimingPolicy.defaults());
    }

    /**
     * Validate the arguments, claim the process-wide instance and initialize
     * the engine.
     *
     * @throws AppInitException with the {@link AppError} describing the failure
     */
    public static BambooApp create(String[] args,
                                   AppConfig config,
                                   RenderingEngine engine,
                                   BridgeTimingPolicy timingPolicy) throws AppInitException
    {
        validate(args, config, engine);
        Objects.requireNonNull(timingPolicy, "timingPolicy");

        if (engine.apiVersion() != RenderingEngine.API_VERSION) {
            throw new AppInitException(AppError.VERSION_MISMATCH,
                    "Engine API version " + engine.apiVersion()
                            + " does not match runtime API version " + RenderingEngine.API_VERSION);
        }

        BambooApp app = new BambooApp(config, engine, timingPolicy);
        if (!INSTANCE.compareAndSet(null, app)) {
            app.releaseThreads();
            throw new AppInitException(AppError.ALREADY_RUNNING, "Another BambooApp is already running");
        }

        try {
            engine.initialize(EngineSettings.from(config, VERSION));
        } catch (EngineException | RuntimeException e) {
            app.releaseThreads();
            INSTANCE.compareAndSet(app, null);
            throw new AppInitException(AppError.INIT_FAILED, "Engine initialization failed: " + e.getMessage(), e);
        }

        log.info("Bamboo {} started for {} {} (engine {})", VERSION, config.name(), config.version(), engine.version());
        return app;
    }

    private static void validate(String[] args, AppConfig config, RenderingEngine engine) throws AppInitException {
        if (args == null) {
            throw new AppInitException(AppError.INVALID_ARGUMENTS, "args must not be null");
        }
        for (String arg : args) {
            if (arg == null) {
                throw new AppInitException(AppError.INVALID_ARGUMENTS, "args must not contain null");
            }
        }
        if (config == null) {
            throw new AppInitException(AppError.INVALID_ARGUMENTS, "config must not be null");
        }
        if (engine == null) {
            throw new AppInitException(AppError.INVALID_ARGUMENTS, "engine must not be null");
        }
        if (config.name().isBlank()) {
            throw new AppInitException(AppError.INVALID_ARGUMENTS, "Application name must not be blank");
        }
        if (config.remoteDebugging() && (config.remoteDebugPort() < 1 || config.remoteDebugPort() > 65535)) {
            throw new AppInitException(AppError.INVALID_ARGUMENTS,
                    "Remote debug port out of range: " + config.remoteDebugPort());
        }
    }

    /** The live instance, if any. */
    static BambooApp current() {
        return INSTANCE.get();
    }

    public AppConfig config() {
        return config;
    }

    public String version() {
        return VERSION;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Run the UI loop on the calling thread until {@link #quit()}.
     */
    public void run() {
        if (closed.get()) {
            throw new IllegalStateException("application is closed");
        }
        log.debug("Entering UI loop");
        uiThread.runOnCurrentThread();
        log.debug("UI loop exited");
    }

    /** Leave the UI loop. Safe from any thread. */
    public void quit() {
        log.debug("Quit requested");
        uiThread.stop();
    }

    /** Run {@code task} on the UI thread. */
    public void postUITask(Runnable task) {
        uiThread.post(task);
    }

    public boolean isUIThread() {
        return uiThread.isOwnerThread();
    }

    /**
     * Create a window.
     *
     * @throws BrowserException {@link BrowserError#INVALID_STATE} when the app is
     *         closed or the call comes from a thread other than the running UI
     *         thread; {@link BrowserError#CREATE_FAILED} when the engine fails
     */
    public BrowserWindow createWindow(WindowConfig windowConfig) {
        Objects.requireNonNull(windowConfig, "windowConfig");
        if (closed.get()) {
            throw new BrowserException(BrowserError.INVALID_STATE, "Application is closed");
        }
        if (uiThread.isRunning() && !uiThread.isOwnerThread()) {
            throw new BrowserException(BrowserError.INVALID_STATE, "Windows must be created on the UI thread");
        }

        BambooBrowserWindow[] self = new BambooBrowserWindow[1];
        BambooBrowserWindow window = BambooBrowserWindow.create(
                windowConfig, engine, uiThread, clock, scheduler, timingPolicy, observabilitySink,
                () -> windows.remove(self[0]));
        self[0] = window;
        windows.add(window);

        log.info("Created window '{}' ({}x{})", windowConfig.title(), windowConfig.width(), windowConfig.height());
        return window;
    }

    int openWindows() {
        return windows.size();
    }

    /**
     * Close all windows, shut the engine down and release the process-wide
     * instance. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        closeWindows();

        try {
            engine.shutdown();
        } catch (RuntimeException e) {
            log.warn("Engine shutdown failed", e);
        }
        releaseThreads();
        INSTANCE.compareAndSet(this, null);
        log.info("Bamboo stopped");
    }

    private void closeWindows() {
        if (uiThread.isOwnerThread()) {
            closeWindowsOnOwner();
        } else if (uiThread.isRunning()) {
            CountDownLatch done = new CountDownLatch(1);
            uiThread.post(() -> {
                try {
                    closeWindowsOnOwner();
                } finally {
                    done.countDown();
                }
            });
            try {
                if (!done.await(5, TimeUnit.SECONDS)) {
                    log.warn("Timed out closing {} window(s) on the UI thread", windows.size());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        } else {
            uiThread.runAsOwner(this::closeWindowsOnOwner);
        }
    }

    private void closeWindowsOnOwner() {
        for (BambooBrowserWindow window : windows) {
            window.closeNow();
        }
        windows.clear();
    }

    private void releaseThreads() {
        uiThread.stop();
        timerExecutor.shutdownNow();
    }
}
