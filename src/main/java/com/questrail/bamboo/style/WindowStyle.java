package com.questrail.bamboo.style;

import java.util.List;
import java.util.Objects;

/**
 * WindowStyle
 * =============================================================================
 * Full declarative description of a window's appearance.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>Always fully populated. Partial updates are expressed as a
 *       {@link StylePatch} and merged into a copy, never applied in place.</li>
 *   <li>Immutable. The reconciler replaces the whole value atomically.</li>
 *   <li>Both platform material selectors are always present; each provider
 *       ignores the one that does not belong to its OS family.</li>
 *   <li>{@code dragRegions} is an ordered list that is replaced wholesale.</li>
 * </ul>
 *
 * <h2>Page-level fields</h2>
 * {@code scrollbar}, {@code contextMenu}, {@code allowTextSelection},
 * {@code zoomFactor} and the dev-tools flags are applied by the window itself
 * (content style sheet, menu policy, engine zoom), not by the platform
 * capability provider.
 */
public record WindowStyle(
        ChromeMode chromeMode,
        TitlebarStyle titlebar,
        Color backgroundColor,
        double backgroundOpacity,
        boolean transparent,
        MacOSVibrancy macosVibrancy,
        WindowsMaterial windowsMaterial,
        Shadow shadow,
        int cornerRadius,
        boolean resizable,
        boolean minimizable,
        boolean maximizable,
        boolean alwaysOnTop,
        boolean skipTaskbar,
        FullscreenMode fullscreen,
        List<DragRegion> dragRegions,
        ScrollbarStyle scrollbar,
        ContextMenuStyle contextMenu,
        boolean devTools,
        boolean devToolsDocked,
        double zoomFactor,
        boolean allowZoom,
        boolean allowTextSelection)
{
    public WindowStyle {
        Objects.requireNonNull(chromeMode, "chromeMode");
        Objects.requireNonNull(titlebar, "titlebar");
        Objects.requireNonNull(backgroundColor, "backgroundColor");
        Objects.requireNonNull(macosVibrancy, "macosVibrancy");
        Objects.requireNonNull(windowsMaterial, "windowsMaterial");
        Objects.requireNonNull(shadow, "shadow");
        Objects.requireNonNull(fullscreen, "fullscreen");
        Objects.requireNonNull(dragRegions, "dragRegions");
        Objects.requireNonNull(scrollbar, "scrollbar");
        Objects.requireNonNull(contextMenu, "contextMenu");

        if (!(backgroundOpacity >= 0.0 && backgroundOpacity <= 1.0)) {
            throw new IllegalArgumentException("backgroundOpacity must be in 0..1, was " + backgroundOpacity);
        }
        if (cornerRadius < 0) {
            throw new IllegalArgumentException("cornerRadius must be >= 0, was " + cornerRadius);
        }
        if (!(zoomFactor > 0.0) || Double.isInfinite(zoomFactor)) {
            throw new IllegalArgumentException("zoomFactor must be positive, was " + zoomFactor);
        }

        dragRegions = List.copyOf(dragRegions);
    }

    // ---------------------------------------------------------------------
    // Presets
    // ---------------------------------------------------------------------

    public static WindowStyle defaults() {
        return builder().build();
    }

    /** Full engine browser UI. */
    public static WindowStyle fullBrowser() {
        return builder().withChromeMode(ChromeMode.FULL).build();
    }

    /** Frameless, transparent window for a completely page-drawn UI. */
    public static WindowStyle fullCustom() {
        return builder()
                .withChromeMode(ChromeMode.FRAMELESS)
                .withTransparent(true)
                .withBackgroundOpacity(0.0)
                .withShadow(Shadow.NONE)
                .withScrollbar(ScrollbarStyle.HIDDEN)
                .withContextMenu(ContextMenuStyle.DISABLED)
                .build();
    }

    /** Hidden macOS titlebar: traffic lights over a full-bleed page. */
    public static WindowStyle macosModern(MacOSVibrancy vibrancy) {
        return builder()
                .withChromeMode(ChromeMode.CUSTOM_TITLEBAR)
                .withTitlebar(TitlebarStyle.DEFAULT.withMacosHidden(true, 0))
                .withMacosVibrancy(vibrancy)
                .withBackgroundOpacity(0.85)
                .withShadow(Shadow.DEFAULT.withBlur(30))
                .build();
    }

    public static WindowStyle macosModern() {
        return macosModern(MacOSVibrancy.WINDOW_BACKGROUND);
    }

    /** Windows 11 Mica backdrop. */
    public static WindowStyle windows11Mica() {
        return builder()
                .withWindowsMaterial(WindowsMaterial.MICA)
                .withBackgroundOpacity(0.0)
                .withTransparent(true)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static final class Builder {
        private ChromeMode chromeMode = ChromeMode.NATIVE_TITLEBAR;
        private TitlebarStyle titlebar = TitlebarStyle.DEFAULT;
        private Color backgroundColor = Color.WHITE;
        private double backgroundOpacity = 1.0;
        private boolean transparent = false;
        private MacOSVibrancy macosVibrancy = MacOSVibrancy.NONE;
        private WindowsMaterial windowsMaterial = WindowsMaterial.NONE;
        private Shadow shadow = Shadow.DEFAULT;
        private int cornerRadius = 0;
        private boolean resizable = true;
        private boolean minimizable = true;
        private boolean maximizable = true;
        private boolean alwaysOnTop = false;
        private boolean skipTaskbar = false;
        private FullscreenMode fullscreen = FullscreenMode.NATIVE;
        private List<DragRegion> dragRegions = List.of();
        private ScrollbarStyle scrollbar = ScrollbarStyle.DEFAULT;
        private ContextMenuStyle contextMenu = ContextMenuStyle.DEFAULT;
        private boolean devTools = false;
        private boolean devToolsDocked = false;
        private double zoomFactor = 1.0;
        private boolean allowZoom = true;
        private boolean allowTextSelection = true;

        private Builder() {}

        private Builder(WindowStyle s) {
            this.chromeMode = s.chromeMode;
            this.titlebar = s.titlebar;
            this.backgroundColor = s.backgroundColor;
            this.backgroundOpacity = s.backgroundOpacity;
            this.transparent = s.transparent;
            this.macosVibrancy = s.macosVibrancy;
            this.windowsMaterial = s.windowsMaterial;
            this.shadow = s.shadow;
            this.cornerRadius = s.cornerRadius;
            this.resizable = s.resizable;
            this.minimizable = s.minimizable;
            this.maximizable = s.maximizable;
            this.alwaysOnTop = s.alwaysOnTop;
            this.skipTaskbar = s.skipTaskbar;
            this.fullscreen = s.fullscreen;
            this.dragRegions = s.dragRegions;
            this.scrollbar = s.scrollbar;
            this.contextMenu = s.contextMenu;
            this.devTools = s.devTools;
            this.devToolsDocked = s.devToolsDocked;
            this.zoomFactor = s.zoomFactor;
            this.allowZoom = s.allowZoom;
            this.allowTextSelection = s.allowTextSelection;
        }

        public Builder withChromeMode(ChromeMode chromeMode) {
            this.chromeMode = chromeMode;
            return this;
        }

        public Builder withTitlebar(TitlebarStyle titlebar) {
            this.titlebar = titlebar;
            return this;
        }

        public Builder withBackgroundColor(Color backgroundColor) {
            this.backgroundColor = backgroundColor;
            return this;
        }

        public Builder withBackgroundOpacity(double backgroundOpacity) {
            this.backgroundOpacity = backgroundOpacity;
            return this;
        }

        public Builder withTransparent(boolean transparent) {
            this.transparent = transparent;
            return this;
        }

        public Builder withMacosVibrancy(MacOSVibrancy macosVibrancy) {
            this.macosVibrancy = macosVibrancy;
            return this;
        }

        public Builder withWindowsMaterial(WindowsMaterial windowsMaterial) {
            this.windowsMaterial = windowsMaterial;
            return this;
        }

        public Builder withShadow(Shadow shadow) {
            this.shadow = shadow;
            return this;
        }

        public Builder withCornerRadius(int cornerRadius) {
            this.cornerRadius = cornerRadius;
            return this;
        }

        public Builder withResizable(boolean resizable) {
            this.resizable = resizable;
            return this;
        }

        public Builder withMinimizable(boolean minimizable) {
            this.minimizable = minimizable;
            return this;
        }

        public Builder withMaximizable(boolean maximizable) {
            this.maximizable = maximizable;
            return this;
        }

        public Builder withAlwaysOnTop(boolean alwaysOnTop) {
            this.alwaysOnTop = alwaysOnTop;
            return this;
        }

        public Builder withSkipTaskbar(boolean skipTaskbar) {
            this.skipTaskbar = skipTaskbar;
            return this;
        }

        public Builder withFullscreen(FullscreenMode fullscreen) {
            this.fullscreen = fullscreen;
            return this;
        }

        public Builder withDragRegions(List<DragRegion> dragRegions) {
            this.dragRegions = dragRegions;
            return this;
        }

        public Builder withScrollbar(ScrollbarStyle scrollbar) {
            this.scrollbar = scrollbar;
            return this;
        }

        public Builder withContextMenu(ContextMenuStyle contextMenu) {
            this.contextMenu = contextMenu;
            return this;
        }

        public Builder withDevTools(boolean devTools, boolean docked) {
            this.devTools = devTools;
            this.devToolsDocked = docked;
            return this;
        }

        public Builder withZoomFactor(double zoomFactor) {
            this.zoomFactor = zoomFactor;
            return this;
        }

        public Builder withAllowZoom(boolean allowZoom) {
            this.allowZoom = allowZoom;
            return this;
        }

        public Builder withAllowTextSelection(boolean allowTextSelection) {
            this.allowTextSelection = allowTextSelection;
            return this;
        }

        public WindowStyle build() {
            return new WindowStyle(chromeMode, titlebar, backgroundColor, backgroundOpacity, transparent,
                    macosVibrancy, windowsMaterial, shadow, cornerRadius, resizable, minimizable,
                    maximizable, alwaysOnTop, skipTaskbar, fullscreen, dragRegions, scrollbar,
                    contextMenu, devTools, devToolsDocked, zoomFactor, allowZoom, allowTextSelection);
        }
    }
}
