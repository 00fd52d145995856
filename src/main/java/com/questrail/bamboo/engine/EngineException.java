package com.questrail.bamboo.engine;

/**
 * The rendering engine refused an initialization or creation request.
 */
public final class EngineException extends Exception
{
    public EngineException(String message) {
        super(message);
    }

    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
