package com.questrail.bamboo.bridge;

import java.util.concurrent.CompletableFuture;

/**
 * Supplies PNG bytes of the current page for {@code captureScreenshot()}.
 */
@FunctionalInterface
public interface ScreenshotSource
{
    CompletableFuture<byte[]> capturePng();
}
