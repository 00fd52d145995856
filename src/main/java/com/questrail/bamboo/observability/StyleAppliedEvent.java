package com.questrail.bamboo.observability;

import com.questrail.bamboo.style.WindowStyle;
import com.questrail.bamboo.style.reconcile.StyleOperation;

import java.time.Instant;
import java.util.Set;

/**
 * Record describing one reconciler pass.
 *
 * @param invoked the operations that reached the capability provider; empty
 *                when the new style matched what was already applied
 */
public record StyleAppliedEvent(
    Instant timestamp,
    WindowStyle previous,
    WindowStyle current,
    Set<StyleOperation> invoked
) {
    public StyleAppliedEvent {
        invoked = Set.copyOf(invoked);
    }

    public boolean isNoOp() {
        return invoked.isEmpty();
    }
}
