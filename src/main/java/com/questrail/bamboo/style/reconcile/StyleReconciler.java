package com.questrail.bamboo.style.reconcile;

import com.questrail.bamboo.internal.time.SystemWallClock;
import com.questrail.bamboo.observability.BridgeErrorEvent;
import com.questrail.bamboo.observability.BridgeObservabilitySink;
import com.questrail.bamboo.observability.BridgeProtocolEvent;
import com.questrail.bamboo.observability.NullObservabilitySink;
import com.questrail.bamboo.observability.StyleAppliedEvent;
import com.questrail.bamboo.platform.PlatformCapabilityProvider;
import com.questrail.bamboo.platform.UnsupportedPlatformOperationException;
import com.questrail.bamboo.style.ChromeMode;
import com.questrail.bamboo.style.Color;
import com.questrail.bamboo.style.DragRegion;
import com.questrail.bamboo.style.MacOSVibrancy;
import com.questrail.bamboo.style.Shadow;
import com.questrail.bamboo.style.TitlebarStyle;
import com.questrail.bamboo.style.WindowStyle;
import com.questrail.bamboo.style.WindowsMaterial;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * StyleReconciler
 * =============================================================================
 * Converges a native window onto a {@link WindowStyle}.
 *
 * <h2>Contract</h2>
 * {@link #apply(WindowStyle)} always receives a complete model. It replaces
 * the stored model, then walks {@link StyleOperation} in declaration order and
 * issues each operation whose inputs differ from what was last applied.
 * Applying the same model twice therefore issues no platform calls the
 * second time.
 *
 * <h2>Direct mutators</h2>
 * {@link #setCornerRadius(int)} and friends derive a new model with one field
 * changed and delegate to {@link #apply(WindowStyle)}. Because unchanged
 * operations are skipped, a direct mutator issues only the operations its
 * field feeds, yet cross-field dependencies (a chrome-mode change re-issuing
 * corner radius) behave exactly as in a bulk apply.
 *
 * <h2>Failures</h2>
 * <ul>
 *   <li>{@link UnsupportedPlatformOperationException}: a silent no-op. The
 *       value counts as applied so it is not retried.</li>
 *   <li>Any other runtime failure is reported to the sink, the operation is
 *       left unrecorded (retried on the next apply) and the sequence
 *       continues.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * Owner-thread confined, like the rest of a window's state.
 */
public final class StyleReconciler
{
    private final PlatformCapabilityProvider provider;
    private final BridgeObservabilitySink observabilitySink;
    private final List<Consumer<WindowStyle>> listeners = new CopyOnWriteArrayList<>();
    private final Map<StyleOperation, Object> lastApplied = new EnumMap<>(StyleOperation.class);

    private volatile WindowStyle current;

    public StyleReconciler(PlatformCapabilityProvider provider,
                           WindowStyle initial,
                           BridgeObservabilitySink observabilitySink)
    {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.current = Objects.requireNonNull(initial, "initial");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    public WindowStyle current() {
        return current;
    }

    public PlatformCapabilityProvider provider() {
        return provider;
    }

    /**
     * Issue every operation for the current model, regardless of what was
     * applied before. Used once the native window exists, and again if it is
     * recreated.
     */
    public void applyInitial() {
        lastApplied.clear();
        apply(current);
    }

    public void apply(WindowStyle next) {
        Objects.requireNonNull(next, "next");

        WindowStyle previous = current;
        current = next;

        Set<StyleOperation> invoked = converge(next);

        observabilitySink.onStyleApplied(new StyleAppliedEvent(
                SystemWallClock.INSTANCE.now(), previous, next, invoked));

        for (Consumer<WindowStyle> listener : listeners) {
            try {
                listener.accept(next);
            } catch (RuntimeException e) {
                observabilitySink.onError(new BridgeErrorEvent(
                        SystemWallClock.INSTANCE.now(), "Style listener failed", e));
            }
        }
    }

    private Set<StyleOperation> converge(WindowStyle target) {
        Set<StyleOperation> invoked = EnumSet.noneOf(StyleOperation.class);
        boolean frameChanged = false;

        for (StyleOperation op : StyleOperation.values()) {
            Object key = op.key(target);
            boolean forced = frameChanged && op.dependsOnFrame();
            if (!forced && lastApplied.containsKey(op) && Objects.equals(lastApplied.get(op), key)) {
                continue;
            }

            try {
                op.invoke(provider, target);
                lastApplied.put(op, key);
                invoked.add(op);
                if (op == StyleOperation.CHROME_MODE) {
                    frameChanged = true;
                }
            } catch (UnsupportedPlatformOperationException e) {
                lastApplied.put(op, key);
                observabilitySink.onProtocolEvent(new BridgeProtocolEvent.OperationUnsupported(
                        SystemWallClock.INSTANCE.now(), op.name(), e.getMessage()));
            } catch (RuntimeException e) {
                lastApplied.remove(op);
                observabilitySink.onError(new BridgeErrorEvent(
                        SystemWallClock.INSTANCE.now(), "Style operation " + op + " failed", e));
            }
        }
        return invoked;
    }

    // ---------------------------------------------------------------------
    // Direct mutators
    // ---------------------------------------------------------------------

    public void setChromeMode(ChromeMode mode) {
        apply(current.toBuilder().withChromeMode(mode).build());
    }

    public void setTitlebarStyle(TitlebarStyle titlebar) {
        apply(current.toBuilder().withTitlebar(titlebar).build());
    }

    public void setCornerRadius(int radius) {
        apply(current.toBuilder().withCornerRadius(radius).build());
    }

    public void setMacOSVibrancy(MacOSVibrancy vibrancy) {
        apply(current.toBuilder().withMacosVibrancy(vibrancy).build());
    }

    public void setWindowsMaterial(WindowsMaterial material) {
        apply(current.toBuilder().withWindowsMaterial(material).build());
    }

    public void setBackgroundColor(Color color) {
        apply(current.toBuilder().withBackgroundColor(color).build());
    }

    public void setShadow(Shadow shadow) {
        apply(current.toBuilder().withShadow(shadow).build());
    }

    public void setResizable(boolean resizable) {
        apply(current.toBuilder().withResizable(resizable).build());
    }

    public void setAlwaysOnTop(boolean alwaysOnTop) {
        apply(current.toBuilder().withAlwaysOnTop(alwaysOnTop).build());
    }

    /**
     * Replace the drag regions wholesale.
     */
    public void setDragRegions(List<DragRegion> regions) {
        apply(current.toBuilder().withDragRegions(regions).build());
    }

    // ---------------------------------------------------------------------
    // Listeners
    // ---------------------------------------------------------------------

    /**
     * Register a listener called after every {@link #apply(WindowStyle)}
     * with the new model.
     */
    public void addStyleListener(Consumer<WindowStyle> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeStyleListener(Consumer<WindowStyle> listener) {
        listeners.remove(listener);
    }
}
