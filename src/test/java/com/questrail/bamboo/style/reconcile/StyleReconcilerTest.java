package com.questrail.bamboo.style.reconcile;

import com.questrail.bamboo.observability.BridgeErrorEvent;
import com.questrail.bamboo.observability.BridgeProtocolEvent;
import com.questrail.bamboo.observability.RecordingObservabilitySink;
import com.questrail.bamboo.observability.StyleAppliedEvent;
import com.questrail.bamboo.platform.RecordingCapabilityProvider;
import com.questrail.bamboo.style.ChromeMode;
import com.questrail.bamboo.style.Color;
import com.questrail.bamboo.style.DragRegion;
import com.questrail.bamboo.style.TitlebarButtonPosition;
import com.questrail.bamboo.style.TitlebarStyle;
import com.questrail.bamboo.style.WindowStyle;
import com.questrail.bamboo.style.WindowsMaterial;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StyleReconcilerTest
 * -----------------------------------------------------------------------------
 * The reconciler issues exactly the platform operations needed to move from
 * the applied style to the requested one, in a fixed order.
 */
final class StyleReconcilerTest
{
    private RecordingCapabilityProvider provider;
    private RecordingObservabilitySink sink;
    private StyleReconciler reconciler;

    @BeforeEach
    void setUp() {
        provider = new RecordingCapabilityProvider();
        sink = new RecordingObservabilitySink();
        reconciler = new StyleReconciler(provider, WindowStyle.defaults(), sink);
    }

    private void applied() {
        reconciler.applyInitial();
        provider.clear();
        sink.clear();
    }

    @Test
    void initialApplyIssuesEveryOperationInOrder() {
        reconciler.applyInitial();

        assertEquals(List.of(
                "setChromeMode", "setTransparent", "setBackgroundColor", "setMacOSVibrancy",
                "setWindowsMaterial", "setShadow", "setCornerRadius", "setResizable",
                "setWindowButtons", "setAlwaysOnTop", "setSkipTaskbar", "setDragRegions"),
                provider.operations());
        assertEquals(EnumSet.allOf(StyleOperation.class), sink.getStyleApplications().get(0).invoked());
    }

    @Test
    void identicalStyleIsFree() {
        applied();

        reconciler.apply(WindowStyle.defaults());

        assertTrue(provider.calls().isEmpty());
        StyleAppliedEvent event = sink.getStyleApplications().get(0);
        assertTrue(event.isNoOp());
        assertEquals(event.previous(), event.current());
    }

    @Test
    void onlyChangedOperationsRun() {
        applied();

        reconciler.apply(WindowStyle.defaults().toBuilder()
                .withBackgroundColor(Color.BLACK)
                .withAlwaysOnTop(true)
                .build());

        assertEquals(List.of("setBackgroundColor", "setAlwaysOnTop"), provider.operations());
        assertEquals(EnumSet.of(StyleOperation.BACKGROUND_COLOR, StyleOperation.ALWAYS_ON_TOP),
                sink.getStyleApplications().get(0).invoked());
    }

    @Test
    void chromeModeChangeReissuesFrameDependentOperations() {
        applied();

        reconciler.setChromeMode(ChromeMode.FRAMELESS);

        assertEquals(List.of("setChromeMode", "setCornerRadius", "setResizable", "setWindowButtons"),
                provider.operations());
        assertEquals(ChromeMode.FRAMELESS, provider.callsTo("setChromeMode").get(0).args().get(0));
    }

    @Test
    void titlebarButtonPositionFollowsFrame() {
        applied();

        reconciler.setTitlebarStyle(TitlebarStyle.DEFAULT.withButtonPosition(new TitlebarButtonPosition(10, 12)));

        assertEquals(List.of("setChromeMode", "setTitlebarButtonPosition", "setCornerRadius", "setResizable",
                "setWindowButtons"), provider.operations());
    }

    @Test
    void cornerRadiusAloneDoesNotTouchFrame() {
        applied();

        reconciler.setCornerRadius(8);
        reconciler.setCornerRadius(8);

        assertEquals(List.of("setCornerRadius"), provider.operations());
        assertEquals(8, reconciler.current().cornerRadius());
    }

    @Test
    void resizableIsPartOfTheFrame() {
        applied();

        reconciler.setResizable(false);

        assertEquals(List.of("setChromeMode", "setCornerRadius", "setResizable", "setWindowButtons"),
                provider.operations());
    }

    @Test
    void unsupportedOperationIsReportedOnceAndTreatedAsApplied() {
        provider.unsupported("setWindowsMaterial");
        applied();

        reconciler.setWindowsMaterial(WindowsMaterial.MICA);
        reconciler.setWindowsMaterial(WindowsMaterial.MICA);

        List<BridgeProtocolEvent.OperationUnsupported> unsupported =
                sink.eventsOfType(BridgeProtocolEvent.OperationUnsupported.class);
        assertEquals(1, unsupported.size());
        assertEquals("WINDOWS_MATERIAL", unsupported.get(0).operation());
        assertEquals(WindowsMaterial.MICA, reconciler.current().windowsMaterial());
        assertFalse(sink.hasEventOfType(BridgeErrorEvent.class));
    }

    @Test
    void failedOperationIsRetriedOnNextPass() {
        applied();
        provider.failing("setShadow");

        reconciler.apply(WindowStyle.defaults().toBuilder()
                .withShadow(WindowStyle.defaults().shadow().withBlur(3))
                .withCornerRadius(4)
                .build());

        assertEquals(List.of("setCornerRadius"), provider.operations());
        assertEquals(1, sink.eventsOfType(BridgeErrorEvent.class).size());

        provider.recovered("setShadow");
        provider.clear();
        reconciler.apply(reconciler.current());

        assertEquals(List.of("setShadow"), provider.operations());
    }

    @Test
    void dragRegionsAreReplacedWholesale() {
        applied();

        reconciler.setDragRegions(List.of(DragRegion.draggable(0, 0, 100, 20), DragRegion.hole(80, 0, 20, 20)));
        reconciler.setDragRegions(List.of());

        List<RecordingCapabilityProvider.Call> calls = provider.callsTo("setDragRegions");
        assertEquals(2, calls.size());
        assertEquals(List.of(), calls.get(1).args().get(0));
        assertTrue(reconciler.current().dragRegions().isEmpty());
    }

    @Test
    void listenersSeeEveryPassAndFailuresAreContained() {
        applied();
        List<WindowStyle> seen = new ArrayList<>();
        reconciler.addStyleListener(s -> {
            throw new IllegalStateException("listener bug");
        });
        reconciler.addStyleListener(seen::add);

        reconciler.setAlwaysOnTop(true);
        reconciler.setAlwaysOnTop(true);

        assertEquals(2, seen.size());
        assertTrue(seen.get(1).alwaysOnTop());
        assertEquals(2, sink.eventsOfType(BridgeErrorEvent.class).size());
    }

    @Test
    void applyInitialForgetsWhatWasApplied() {
        applied();

        reconciler.applyInitial();

        assertEquals(12, provider.calls().size());
    }
}
