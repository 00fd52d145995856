package com.questrail.bamboo.api;

import java.util.Objects;

/**
 * A pending navigation handed to the host before it happens.
 *
 * <p>The request is mutable on purpose: the navigation hook calls
 * {@link #deny()} to block it. Navigations are allowed unless denied.</p>
 */
public final class NavigationRequest
{
    private final String url;
    private final boolean redirect;
    private final boolean mainFrame;
    private boolean allow = true;

    public NavigationRequest(String url, boolean redirect, boolean mainFrame) {
        this.url = Objects.requireNonNull(url, "url");
        this.redirect = redirect;
        this.mainFrame = mainFrame;
    }

    public String url() {
        return url;
    }

    public boolean isRedirect() {
        return redirect;
    }

    public boolean isMainFrame() {
        return mainFrame;
    }

    public boolean isAllowed() {
        return allow;
    }

    public void setAllowed(boolean allow) {
        this.allow = allow;
    }

    public void deny() {
        this.allow = false;
    }

    @Override
    public String toString() {
        return "NavigationRequest[url=" + url + ", redirect=" + redirect
                + ", mainFrame=" + mainFrame + ", allow=" + allow + "]";
    }
}
