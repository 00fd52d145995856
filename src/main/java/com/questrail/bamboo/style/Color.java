package com.questrail.bamboo.style;

/**
 * An 8-bit-per-channel RGBA color.
 */
public record Color(int r, int g, int b, int a)
{
    public static final Color TRANSPARENT = new Color(0, 0, 0, 0);
    public static final Color WHITE = new Color(255, 255, 255, 255);
    public static final Color BLACK = new Color(0, 0, 0, 255);

    public Color {
        checkChannel("r", r);
        checkChannel("g", g);
        checkChannel("b", b);
        checkChannel("a", a);
    }

    public static Color rgb(int r, int g, int b) {
        return new Color(r, g, b, 255);
    }

    public static Color rgba(int r, int g, int b, int a) {
        return new Color(r, g, b, a);
    }

    /**
     * @param argb packed {@code 0xAARRGGBB}
     */
    public static Color hex(int argb) {
        return new Color((argb >>> 16) & 0xFF, (argb >>> 8) & 0xFF, argb & 0xFF, (argb >>> 24) & 0xFF);
    }

    /**
     * @return packed {@code 0x00BBGGRR}, the layout Win32 COLORREF expects
     */
    public int toColorRef() {
        return (b << 16) | (g << 8) | r;
    }

    public String toCss() {
        return "rgba(" + r + "," + g + "," + b + "," + (a / 255.0) + ")";
    }

    private static void checkChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException(name + " must be in 0..255, was " + value);
        }
    }
}
