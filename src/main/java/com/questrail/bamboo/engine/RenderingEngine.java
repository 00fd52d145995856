package com.questrail.bamboo.engine;

import com.questrail.bamboo.config.WindowConfig;
import com.questrail.bamboo.platform.NativeWindowHandle;
import com.questrail.bamboo.platform.PlatformCapabilityProvider;

/**
 * RenderingEngine
 * -----------------------------------------------------------------------------
 * Process-wide entry point of the embedded browser engine.
 *
 * <p>{@link #initialize} is called once before any browser is created and
 * {@link #shutdown} once after the last browser has closed.</p>
 */
public interface RenderingEngine
{
    /** Binding API revision this runtime is written against. */
    int API_VERSION = 1;

    /** Binding API revision the engine implements; must equal {@link #API_VERSION}. */
    int apiVersion();

    /** Engine version for diagnostics, {@code major.minor.patch}. */
    String version();

    void initialize(EngineSettings settings) throws EngineException;

    /**
     * Create a browser and its native window.
     *
     * <p>The bootstrap script talks to the browser's
     * {@link EngineBrowser#scriptEndpoint()} through page globals the engine
     * provides in every frame before the script runs:</p>
     * <ul>
     *   <li>{@code window.__bambooPost(text)} hands one outbound message to
     *       the endpoint's receiver. The engine must install it.</li>
     *   <li>{@code window.__bambooReceive(text)} is defined by the script;
     *       the engine calls it once for every message the endpoint sends.</li>
     *   <li>{@code window.__bambooPlatform} may name the host platform
     *       ({@code windows}, {@code macos} or {@code linux}). When it is
     *       absent the script derives the name from the user agent.</li>
     * </ul>
     *
     * @param bootstrapScript script the engine must run in every frame before page script
     * @param client          receives the browser's notifications
     */
    EngineBrowser createBrowser(WindowConfig config,
                                String bootstrapScript,
                                EngineBrowserClient client) throws EngineException;

    /**
     * The capability provider for a window this engine created, bound to the
     * native primitives of the running OS.
     */
    PlatformCapabilityProvider capabilityProvider(NativeWindowHandle window);

    void shutdown();
}
