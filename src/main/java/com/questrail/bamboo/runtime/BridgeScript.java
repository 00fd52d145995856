package com.questrail.bamboo.runtime;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * The page-side bootstrap that installs {@code window.bamboo}.
 *
 * <p>Loaded once from the classpath resource {@code bamboo-bridge.js} next to
 * this class and handed to the engine for injection into every frame.</p>
 */
public final class BridgeScript
{
    static final String RESOURCE = "bamboo-bridge.js";

    private BridgeScript() {}

    public static String source() {
        return Holder.SOURCE;
    }

    private static String load() {
        try (InputStream in = BridgeScript.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }

    private static final class Holder
    {
        static final String SOURCE = load();
    }
}
