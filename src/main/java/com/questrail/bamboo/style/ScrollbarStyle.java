package com.questrail.bamboo.style;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Page scrollbar rendering, applied through the injected content style sheet.
 */
public enum ScrollbarStyle
{
    DEFAULT,
    HIDDEN,
    /** Thin overlay scrollbars. */
    OVERLAY;

    @JsonValue
    public String wireName() {
        return WireNames.of(this);
    }

    @JsonCreator
    public static ScrollbarStyle fromWire(String name) {
        return WireNames.parse(ScrollbarStyle.class, name);
    }
}
