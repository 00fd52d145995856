package com.questrail.bamboo.style;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What happens on a right click inside page content.
 */
public enum ContextMenuStyle
{
    /** Native menu supplied by the engine. */
    DEFAULT,
    /** Native menu suppressed; the page receives a {@code __contextMenu} event. */
    CUSTOM,
    /** No menu at all. */
    DISABLED;

    @JsonValue
    public String wireName() {
        return WireNames.of(this);
    }

    @JsonCreator
    public static ContextMenuStyle fromWire(String name) {
        return WireNames.parse(ContextMenuStyle.class, name);
    }
}
