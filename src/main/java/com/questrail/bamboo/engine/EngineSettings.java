package com.questrail.bamboo.engine;

import com.questrail.bamboo.config.AppConfig;

import java.util.List;
import java.util.Objects;

/**
 * Process-wide settings handed to {@link RenderingEngine#initialize}.
 *
 * @param remoteDebugPort {@code 0} when remote debugging is off
 * @param switches        engine command-line switches without leading dashes
 */
public record EngineSettings(
        String userAgent,
        String cachePath,
        String logPath,
        boolean logToConsole,
        int remoteDebugPort,
        List<String> switches)
{
    public EngineSettings {
        Objects.requireNonNull(userAgent, "userAgent");
        Objects.requireNonNull(cachePath, "cachePath");
        Objects.requireNonNull(logPath, "logPath");
        switches = List.copyOf(switches);
    }

    public static EngineSettings from(AppConfig config, String frameworkVersion) {
        return new EngineSettings(
                config.effectiveUserAgent(frameworkVersion),
                config.cachePath(),
                config.logPath(),
                config.logToConsole(),
                config.remoteDebugging() ? config.remoteDebugPort() : 0,
                config.engineSwitches());
    }
}
