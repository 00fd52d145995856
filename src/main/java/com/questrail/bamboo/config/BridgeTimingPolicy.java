package com.questrail.bamboo.config;

import java.time.Duration;
import java.util.Objects;

/**
 * BridgeTimingPolicy
 * -----------------------------------------------------------------------------
 * Timing configuration for the bridge channel.
 *
 * <p>Operational only: it decides <em>when</em> a pending call gives up, not
 * whether a reply is legal.</p>
 *
 * <ul>
 *   <li><b>callTimeout</b> is how long a native-initiated evaluation waits for
 *       its reply before it is rejected. The page-side runtime uses the same
 *       window for {@code bamboo.call}.</li>
 * </ul>
 */
public record BridgeTimingPolicy(Duration callTimeout)
{
    public static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(30);

    public BridgeTimingPolicy {
        Objects.requireNonNull(callTimeout, "callTimeout");
        if (callTimeout.isNegative()) {
            throw new IllegalArgumentException("callTimeout must be non-negative");
        }
    }

    public static BridgeTimingPolicy defaults() {
        return new BridgeTimingPolicy(DEFAULT_CALL_TIMEOUT);
    }

    public static BridgeTimingPolicy withCallTimeout(Duration callTimeout) {
        return new BridgeTimingPolicy(callTimeout);
    }
}
