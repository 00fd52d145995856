package com.questrail.bamboo.style;

import java.util.Objects;
import java.util.Optional;

/**
 * TitlebarStyle
 * -----------------------------------------------------------------------------
 * Titlebar appearance for {@link ChromeMode#NATIVE_TITLEBAR} and
 * {@link ChromeMode#CUSTOM_TITLEBAR} windows.
 *
 * @param title                   empty means "use the page title"
 * @param height                  titlebar height in pixels
 * @param macosHidden             traffic lights float above page content
 * @param macosButtonPosition     traffic-light origin; {@code null} keeps the OS default
 */
public record TitlebarStyle(
        boolean visible,
        String title,
        Color background,
        Color foreground,
        int height,
        boolean showTitle,
        boolean showIcon,
        String iconPath,
        boolean transparentWhenInactive,
        boolean macosHidden,
        TitlebarButtonPosition macosButtonPosition)
{
    public static final TitlebarStyle DEFAULT = new TitlebarStyle(
            true, "", Color.rgb(245, 245, 245), Color.BLACK, 38,
            true, false, "", false, false, null);

    public TitlebarStyle {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(background, "background");
        Objects.requireNonNull(foreground, "foreground");
        Objects.requireNonNull(iconPath, "iconPath");
        if (height < 0) {
            throw new IllegalArgumentException("height must be >= 0");
        }
    }

    public Optional<TitlebarButtonPosition> buttonPosition() {
        return Optional.ofNullable(macosButtonPosition);
    }

    public TitlebarStyle withMacosHidden(boolean hidden, int height) {
        return new TitlebarStyle(visible, title, background, foreground, height,
                showTitle, showIcon, iconPath, transparentWhenInactive, hidden, macosButtonPosition);
    }

    public TitlebarStyle withButtonPosition(TitlebarButtonPosition position) {
        return new TitlebarStyle(visible, title, background, foreground, height,
                showTitle, showIcon, iconPath, transparentWhenInactive, macosHidden, position);
    }

    public TitlebarStyle withTitle(String title) {
        return new TitlebarStyle(visible, title, background, foreground, height,
                showTitle, showIcon, iconPath, transparentWhenInactive, macosHidden, macosButtonPosition);
    }
}
