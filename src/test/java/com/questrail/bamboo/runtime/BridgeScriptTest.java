package com.questrail.bamboo.runtime;

import com.questrail.bamboo.bridge.model.ReservedNames;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class BridgeScriptTest
{
    @Test
    void bootstrapInstallsFrozenBridgeOnce() {
        String source = BridgeScript.source();

        assertTrue(source.contains("window.bamboo = Object.freeze("));
        assertTrue(source.contains("if (window.bamboo) return"));
        assertSame(source, BridgeScript.source());
    }

    @Test
    void bootstrapSpeaksWireMessageTypes() {
        String source = BridgeScript.source();

        assertTrue(source.contains(ReservedNames.CAPTURE_SCREENSHOT));
        assertTrue(source.contains("type: 'callResult'"));
        assertTrue(source.contains("type: 'windowOp'"));
        assertTrue(source.contains("type: 'setStyle'"));
    }

    @Test
    void platformFallsBackToUserAgent() {
        String source = BridgeScript.source();

        assertTrue(source.contains("window.__bambooPlatform || _detectPlatform()"));
        assertTrue(source.contains("navigator.userAgent"));
        for (String name : new String[] {"'windows'", "'macos'", "'linux'"}) {
            assertTrue(source.contains("return " + name), name);
        }
        assertFalse(source.contains("'unknown'"));
    }
}
