package com.questrail.bamboo.engine;

import com.questrail.bamboo.config.AppConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class EngineSettingsTest
{
    @Test
    void debugPortIsZeroWhenRemoteDebuggingIsOff() {
        EngineSettings settings = EngineSettings.from(AppConfig.defaults(), "1.0.0");
        assertEquals(0, settings.remoteDebugPort());
        assertEquals("BambooApp/1.0.0 Bamboo/1.0.0", settings.userAgent());
        assertEquals("./bamboo_cache", settings.cachePath());
    }

    @Test
    void debugPortAndSwitchesCarryOver() {
        AppConfig config = AppConfig.builder()
                .withRemoteDebugging(true, 9333)
                .withWebGl(false)
                .withLogToConsole(false)
                .build();

        EngineSettings settings = EngineSettings.from(config, "1.0.0");

        assertEquals(9333, settings.remoteDebugPort());
        assertEquals(List.of("disable-webgl"), settings.switches());
        assertFalse(settings.logToConsole());
    }
}
