package com.questrail.bamboo.script;

import com.questrail.bamboo.api.ScriptValue;
import com.questrail.bamboo.bridge.BridgeChannel;
import com.questrail.bamboo.bridge.RemoteCallException;
import com.questrail.bamboo.bridge.window.RecordingWindowControl;
import com.questrail.bamboo.exec.InlineOwnerThread;
import com.questrail.bamboo.platform.PlatformFamily;
import com.questrail.bamboo.platform.RecordingCapabilityProvider;
import com.questrail.bamboo.style.DragRegion;
import com.questrail.bamboo.style.StylePatch;
import com.questrail.bamboo.style.WindowStyle;
import com.questrail.bamboo.style.reconcile.StyleReconciler;
import com.questrail.bamboo.time.DeterministicScheduler;
import com.questrail.bamboo.time.ManualMonotonicClock;
import com.questrail.bamboo.transport.loopback.LoopbackScriptEndpoints;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BridgeRoundTripTest
 * -----------------------------------------------------------------------------
 * Both ends of the bridge wired through an in-process loopback pair.
 */
final class BridgeRoundTripTest
{
    private RecordingCapabilityProvider provider;
    private StyleReconciler reconciler;
    private RecordingWindowControl windowControl;
    private List<String> nativeMessages;
    private BridgeChannel channel;
    private ScriptBridge script;

    @BeforeEach
    void setUp() {
        ManualMonotonicClock clock = new ManualMonotonicClock();
        DeterministicScheduler scheduler = new DeterministicScheduler(clock);
        LoopbackScriptEndpoints pair = LoopbackScriptEndpoints.direct();

        provider = new RecordingCapabilityProvider(PlatformFamily.WINDOWS);
        reconciler = new StyleReconciler(provider, WindowStyle.defaults(), null);
        reconciler.applyInitial();
        provider.clear();
        windowControl = new RecordingWindowControl();
        nativeMessages = new ArrayList<>();

        channel = BridgeChannel.builder()
                .withEndpoint(pair.nativeEndpoint())
                .withOwnerThread(new InlineOwnerThread())
                .withClock(clock)
                .withScheduler(scheduler)
                .withStyleReconciler(reconciler)
                .withWindowControl(windowControl)
                .withMessageCallback((event, payload) -> nativeMessages.add(event + "=" + payload))
                .build();

        script = ScriptBridge.builder()
                .withEndpoint(pair.scriptEndpoint())
                .withScriptThread(new InlineOwnerThread())
                .withClock(clock)
                .withScheduler(scheduler)
                .withPlatform(PlatformFamily.WINDOWS)
                .withEvaluator(s -> ScriptValue.of("evaluated " + s))
                .build();

        channel.start();
        script.start();
    }

    @Test
    void scriptCallsBoundNativeFunction() throws Exception {
        channel.bindFunction("greet", args -> ScriptValue.of("hello " + args.get(0).asText().orElse("?")));

        assertEquals(ScriptValue.of("hello ada"), script.call("greet", ScriptValue.of("ada")).get());
    }

    @Test
    void unknownFunctionRejectsScriptCall() {
        CompletableFuture<ScriptValue> result = script.call("missing");

        ExecutionException e = assertThrows(ExecutionException.class, result::get);
        assertInstanceOf(RemoteCallException.class, e.getCause());
        assertEquals("Unknown function: missing", e.getCause().getMessage());
    }

    @Test
    void nativeEvaluatesInScript() throws Exception {
        assertEquals(ScriptValue.of("evaluated 1+1"), channel.invokeRemoteEval("1+1").get());
    }

    @Test
    void eventsFlowBothWays() {
        List<String> scriptSeen = new ArrayList<>();
        script.on("tick", scriptSeen::add);

        channel.sendEvent("tick", "{\"n\":1}");
        script.send("saved", "[1,2]");

        assertEquals(List.of("{\"n\":1}"), scriptSeen);
        assertEquals(List.of("saved=[1,2]"), nativeMessages);
    }

    @Test
    void styleChangeIsAppliedBroadcastAndAcknowledged() throws Exception {
        List<String> styleChanges = new ArrayList<>();
        script.on("styleChanged", styleChanges::add);

        ScriptValue ack = script.setStyle(StylePatch.parse("{\"cornerRadius\":8}")).get();

        assertEquals(ScriptValue.of(true), ack);
        assertEquals(8, reconciler.current().cornerRadius());
        assertEquals(List.of("setCornerRadius"), provider.operations());
        assertEquals(1, styleChanges.size());
        assertTrue(styleChanges.get(0).contains("\"cornerRadius\":8"));
    }

    @Test
    void dragRegionsAndWindowCommandsReachNative() {
        script.setDragRegions(List.of(DragRegion.draggable(0, 0, 300, 30)));
        script.maximize();
        script.setZoom(1.5);

        assertEquals(List.of(DragRegion.draggable(0, 0, 300, 30)), reconciler.current().dragRegions());
        assertEquals(List.of("maximize", "setZoom 1.5"), windowControl.commands());
    }

    @Test
    void closingNativeSideRejectsItsPendingEvals() {
        script.detach();
        CompletableFuture<ScriptValue> eval = channel.invokeRemoteEval("1");

        channel.close();

        assertTrue(eval.isCompletedExceptionally());
        assertTrue(channel.isClosed());
    }
}
