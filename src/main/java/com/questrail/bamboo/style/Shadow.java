package com.questrail.bamboo.style;

import java.util.Objects;

/**
 * Drop shadow around the window.
 *
 * <p>Native shadows are all-or-nothing on every supported OS; the geometry
 * fields are carried for custom-drawn frames.</p>
 */
public record Shadow(boolean enabled, Color color, int blur, int spread, int offsetX, int offsetY)
{
    public static final Shadow DEFAULT = new Shadow(true, Color.rgba(0, 0, 0, 80), 20, 0, 0, 4);
    public static final Shadow NONE = DEFAULT.withEnabled(false);

    public Shadow {
        Objects.requireNonNull(color, "color");
        if (blur < 0) {
            throw new IllegalArgumentException("blur must be >= 0");
        }
    }

    public Shadow withEnabled(boolean enabled) {
        return new Shadow(enabled, color, blur, spread, offsetX, offsetY);
    }

    public Shadow withBlur(int blur) {
        return new Shadow(enabled, color, blur, spread, offsetX, offsetY);
    }
}
