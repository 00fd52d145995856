package com.questrail.bamboo.style;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * DWM system backdrops. Ignored by non-Windows providers.
 */
public enum WindowsMaterial
{
    NONE,
    /** Windows 11: blurs the desktop behind the window. */
    MICA,
    /** Windows 11: darker Mica variant. */
    MICA_ALT,
    /** Windows 10 and later: stronger blur with tint. */
    ACRYLIC,
    /** Windows 11: Mica for tabbed windows. */
    TABBED;

    @JsonValue
    public String wireName() {
        return WireNames.of(this);
    }

    @JsonCreator
    public static WindowsMaterial fromWire(String name) {
        return WireNames.parse(WindowsMaterial.class, name);
    }
}
