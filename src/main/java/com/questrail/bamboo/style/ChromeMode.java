package com.questrail.bamboo.style;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * ChromeMode
 * =============================================================================
 * Structural frame of the native window.
 *
 * <p>A chrome-mode transition changes the window's style bits, which other
 * style operations (corner radius in particular) depend on. It is therefore
 * always the first operation the reconciler runs.</p>
 */
public enum ChromeMode
{
    /** Full engine browser UI (address bar, tabs, toolbar). */
    FULL,
    /** System titlebar and borders only; the page supplies the rest. */
    NATIVE_TITLEBAR,
    /** No OS chrome at all. Needs drag regions to be movable. */
    FRAMELESS,
    /** OS window buttons over page content; no visible titlebar. */
    CUSTOM_TITLEBAR;

    /**
     * @return {@code true} when the OS draws a titlebar and frame
     */
    public boolean hasNativeFrame() {
        return this == FULL || this == NATIVE_TITLEBAR;
    }

    @JsonValue
    public String wireName() {
        return WireNames.of(this);
    }

    @JsonCreator
    public static ChromeMode fromWire(String name) {
        return WireNames.parse(ChromeMode.class, name);
    }
}
