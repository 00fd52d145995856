package com.questrail.bamboo.api;

/**
 * A console message emitted by page script.
 */
public record ConsoleEvent(Level level, String message, String source, int line)
{
    public enum Level { DEBUG, INFO, WARNING, ERROR }
}
