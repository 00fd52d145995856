package com.questrail.bamboo.platform;

import java.util.Locale;

/**
 * Operating-system families with a capability provider.
 */
public enum PlatformFamily
{
    WINDOWS("windows"),
    MACOS("macos"),
    LINUX("linux");

    private final String wireName;

    PlatformFamily(String wireName) {
        this.wireName = wireName;
    }

    /**
     * @return the name exposed to page script as {@code bamboo.platform}
     */
    public String wireName() {
        return wireName;
    }

    public static PlatformFamily current() {
        return fromOsName(System.getProperty("os.name", ""));
    }

    static PlatformFamily fromOsName(String osName) {
        String os = osName.toLowerCase(Locale.ROOT);
        // "darwin" contains "win"
        if (os.contains("mac") || os.contains("darwin")) {
            return MACOS;
        }
        if (os.contains("win")) {
            return WINDOWS;
        }
        return LINUX;
    }
}
