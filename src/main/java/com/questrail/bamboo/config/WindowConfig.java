package com.questrail.bamboo.config;

import com.questrail.bamboo.style.WindowStyle;

import java.util.Objects;

/**
 * Creation parameters for a browser window.
 *
 * @param maxWidth  {@code 0} means unlimited
 * @param maxHeight {@code 0} means unlimited
 * @param x         {@code -1} centers the window horizontally
 * @param y         {@code -1} centers the window vertically
 */
public record WindowConfig(
    String title,
    String url,
    int width,
    int height,
    int minWidth,
    int minHeight,
    int maxWidth,
    int maxHeight,
    int x,
    int y,
    WindowStyle style
) {
    public static final int CENTERED = -1;
    public static final int UNLIMITED = 0;

    public WindowConfig {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(style, "style");
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("width and height must be positive");
        }
        if (minWidth < 0 || minHeight < 0 || maxWidth < 0 || maxHeight < 0) {
            throw new IllegalArgumentException("size limits must be non-negative");
        }
    }

    public static WindowConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String title = "Bamboo App";
        private String url = "about:blank";
        private int width = 1280;
        private int height = 800;
        private int minWidth = 400;
        private int minHeight = 300;
        private int maxWidth = UNLIMITED;
        private int maxHeight = UNLIMITED;
        private int x = CENTERED;
        private int y = CENTERED;
        private WindowStyle style = WindowStyle.defaults();

        public Builder withTitle(String title) {
            this.title = title;
            return this;
        }

        public Builder withUrl(String url) {
            this.url = url;
            return this;
        }

        public Builder withSize(int width, int height) {
            this.width = width;
            this.height = height;
            return this;
        }

        public Builder withMinSize(int minWidth, int minHeight) {
            this.minWidth = minWidth;
            this.minHeight = minHeight;
            return this;
        }

        public Builder withMaxSize(int maxWidth, int maxHeight) {
            this.maxWidth = maxWidth;
            this.maxHeight = maxHeight;
            return this;
        }

        public Builder withPosition(int x, int y) {
            this.x = x;
            this.y = y;
            return this;
        }

        public Builder withStyle(WindowStyle style) {
            this.style = style;
            return this;
        }

        public WindowConfig build() {
            return new WindowConfig(title, url, width, height, minWidth, minHeight,
                    maxWidth, maxHeight, x, y, style);
        }
    }
}
