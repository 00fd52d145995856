package com.questrail.bamboo.style;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * NSVisualEffectView materials. Ignored by non-macOS providers.
 */
public enum MacOSVibrancy
{
    NONE,
    SIDEBAR,
    MENU,
    POPOVER,
    HUD_WINDOW,
    UNDER_WINDOW_BACKGROUND,
    UNDER_PAGE_BACKGROUND,
    TITLEBAR,
    HEADER_VIEW,
    SHEET,
    WINDOW_BACKGROUND,
    CONTENT_BACKGROUND,
    /** macOS 14 and later. */
    FULL_SCREEN_UI;

    @JsonValue
    public String wireName() {
        return WireNames.of(this);
    }

    @JsonCreator
    public static MacOSVibrancy fromWire(String name) {
        return WireNames.parse(MacOSVibrancy.class, name);
    }
}
