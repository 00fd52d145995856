package com.questrail.bamboo.style;

/**
 * Position of the macOS traffic-light buttons, in points from the top-left.
 */
public record TitlebarButtonPosition(int x, int y)
{
    public static final TitlebarButtonPosition DEFAULT = new TitlebarButtonPosition(20, 20);
}
