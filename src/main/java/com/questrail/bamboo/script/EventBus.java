package com.questrail.bamboo.script;

import com.questrail.bamboo.internal.time.SystemWallClock;
import com.questrail.bamboo.observability.BridgeErrorEvent;
import com.questrail.bamboo.observability.BridgeObservabilitySink;
import com.questrail.bamboo.observability.NullObservabilitySink;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * EventBus
 * =============================================================================
 * Named-event fan-out on the script side.
 *
 * <h2>Ordering</h2>
 * {@link #publish} calls the handlers registered for an event in the order
 * they subscribed. A handler that throws is reported to the observability sink
 * and the remaining handlers still run.
 *
 * <h2>Identity</h2>
 * Handlers are keyed by identity. Subscribing the same handler twice to one
 * event keeps a single registration. Removal never depends on position.
 *
 * <p>Publishing works on a snapshot, so a handler may subscribe or unsubscribe
 * during delivery; the change applies from the next publish.</p>
 */
public final class EventBus
{
    private final Map<String, List<EventHandler>> handlers = new LinkedHashMap<>();
    private final BridgeObservabilitySink observabilitySink;

    public EventBus(BridgeObservabilitySink observabilitySink) {
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    public EventBus() {
        this(null);
    }

    public synchronized Subscription subscribe(String event, EventHandler handler) {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(handler, "handler");

        List<EventHandler> list = handlers.computeIfAbsent(event, k -> new ArrayList<>());
        if (indexOf(list, handler) < 0) {
            list.add(handler);
        }
        return () -> unsubscribe(event, handler);
    }

    /**
     * @return {@code true} if the handler was subscribed to {@code event}
     */
    public synchronized boolean unsubscribe(String event, EventHandler handler) {
        List<EventHandler> list = handlers.get(event);
        if (list == null) {
            return false;
        }
        int i = indexOf(list, handler);
        if (i < 0) {
            return false;
        }
        list.remove(i);
        if (list.isEmpty()) {
            handlers.remove(event);
        }
        return true;
    }

    public void publish(String event, String payload) {
        Objects.requireNonNull(event, "event");

        List<EventHandler> snapshot;
        synchronized (this) {
            List<EventHandler> list = handlers.get(event);
            if (list == null) {
                return;
            }
            snapshot = List.copyOf(list);
        }

        for (EventHandler h : snapshot) {
            try {
                h.handle(payload);
            } catch (Exception e) {
                observabilitySink.onError(new BridgeErrorEvent(
                        SystemWallClock.INSTANCE.now(),
                        "Handler for event '" + event + "' failed",
                        e));
            }
        }
    }

    public synchronized int subscriberCount(String event) {
        List<EventHandler> list = handlers.get(event);
        return list == null ? 0 : list.size();
    }

    /** Drop every subscription without notifying anyone. */
    public synchronized void clear() {
        handlers.clear();
    }

    private static int indexOf(List<EventHandler> list, EventHandler handler) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i) == handler) {
                return i;
            }
        }
        return -1;
    }
}
