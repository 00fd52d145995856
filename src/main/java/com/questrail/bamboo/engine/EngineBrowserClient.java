package com.questrail.bamboo.engine;

import com.questrail.bamboo.api.ConsoleEvent;
import com.questrail.bamboo.api.FindResult;
import com.questrail.bamboo.api.LoadEvent;
import com.questrail.bamboo.api.NavigationRequest;

/**
 * Notifications from an {@link EngineBrowser}.
 *
 * <p>{@link #onBeforeNavigation} and {@link #onContextMenu} need an answer
 * before the engine proceeds and are invoked on the owner thread. The other
 * notifications may arrive on any thread.</p>
 */
public interface EngineBrowserClient
{
    void onLoad(LoadEvent event);

    void onTitleChange(String title);

    void onConsole(ConsoleEvent event);

    void onFocusChange(boolean focused);

    void onFind(FindResult result);

    /**
     * @return {@code true} to let the navigation proceed
     */
    boolean onBeforeNavigation(NavigationRequest request);

    /**
     * @return {@code true} to show the engine's native context menu
     */
    boolean onContextMenu();

    void onClosed();
}
