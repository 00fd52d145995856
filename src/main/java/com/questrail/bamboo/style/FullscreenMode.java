package com.questrail.bamboo.style;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fullscreen behaviour permitted for the window.
 */
public enum FullscreenMode
{
    DISABLED,
    /** OS-level fullscreen. */
    NATIVE,
    /** Hides taskbar, dock and menu bar. */
    KIOSK;

    @JsonValue
    public String wireName() {
        return WireNames.of(this);
    }

    @JsonCreator
    public static FullscreenMode fromWire(String name) {
        return WireNames.parse(FullscreenMode.class, name);
    }
}
