package com.questrail.bamboo.script;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.bamboo.api.ScriptValue;
import com.questrail.bamboo.bridge.BridgeClosedException;
import com.questrail.bamboo.bridge.BridgeTimeoutException;
import com.questrail.bamboo.bridge.RemoteCallException;
import com.questrail.bamboo.config.BridgeTimingPolicy;
import com.questrail.bamboo.exec.InlineOwnerThread;
import com.questrail.bamboo.observability.BridgeProtocolEvent;
import com.questrail.bamboo.observability.RecordingObservabilitySink;
import com.questrail.bamboo.platform.PlatformFamily;
import com.questrail.bamboo.style.DragRegion;
import com.questrail.bamboo.style.StylePatch;
import com.questrail.bamboo.time.DeterministicScheduler;
import com.questrail.bamboo.time.ManualMonotonicClock;
import com.questrail.bamboo.transport.FakeScriptEndpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class ScriptBridgeTest
{
    private static final ObjectMapper JSON = new ObjectMapper();

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private FakeScriptEndpoint endpoint;
    private RecordingObservabilitySink sink;
    private ScriptBridge bridge;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        endpoint = new FakeScriptEndpoint();
        sink = new RecordingObservabilitySink();
        AtomicInteger ids = new AtomicInteger();

        bridge = ScriptBridge.builder()
                .withEndpoint(endpoint)
                .withScriptThread(new InlineOwnerThread())
                .withClock(clock)
                .withScheduler(scheduler)
                .withTimingPolicy(BridgeTimingPolicy.withCallTimeout(Duration.ofSeconds(5)))
                .withObservabilitySink(sink)
                .withIdGenerator(() -> "id-" + ids.incrementAndGet())
                .withPlatform(PlatformFamily.LINUX)
                .withEvaluator(script -> {
                    if (script.equals("throw")) {
                        throw new IllegalStateException("thrown by page");
                    }
                    return ScriptValue.of(script.length());
                })
                .build();
        bridge.start();
    }

    private JsonNode lastSent() throws Exception {
        return JSON.readTree(endpoint.lastSentText());
    }

    @Test
    void reportsVersionAndPlatform() {
        assertEquals("1.0.0", bridge.version());
        assertEquals("linux", bridge.platform());
    }

    @Test
    void callSendsRequestAndResolvesWithReply() throws Exception {
        CompletableFuture<ScriptValue> result = bridge.call("add", ScriptValue.of(1), ScriptValue.of(2));

        JsonNode sent = lastSent();
        assertEquals("call", sent.get("type").asText());
        assertEquals("id-1", sent.get("id").asText());
        assertEquals("add", sent.get("name").asText());
        assertEquals(2, sent.get("args").size());

        endpoint.inject("{\"type\":\"callResult\",\"id\":\"id-1\",\"value\":3}");

        assertEquals(ScriptValue.of(3), result.get());
    }

    @Test
    void errorReplyRejectsCall() {
        CompletableFuture<ScriptValue> result = bridge.call("nope");

        endpoint.inject("{\"type\":\"callResult\",\"id\":\"id-1\",\"error\":\"Unknown function: nope\"}");

        ExecutionException e = assertThrows(ExecutionException.class, result::get);
        RemoteCallException remote = assertInstanceOf(RemoteCallException.class, e.getCause());
        assertEquals("Unknown function: nope", remote.getMessage());
    }

    @Test
    void callWithoutReplyTimesOut() {
        CompletableFuture<ScriptValue> result = bridge.call("slow");

        clock.advanceMillis(4_999);
        scheduler.runDueTasks();
        assertFalse(result.isDone());

        clock.advanceMillis(1);
        scheduler.runDueTasks();

        ExecutionException e = assertThrows(ExecutionException.class, result::get);
        assertInstanceOf(BridgeTimeoutException.class, e.getCause());
    }

    @Test
    void setStyleIsAcknowledged() throws Exception {
        CompletableFuture<ScriptValue> ack = bridge.setStyle(StylePatch.parse("{\"alwaysOnTop\":true}"));

        JsonNode sent = lastSent();
        assertEquals("setStyle", sent.get("type").asText());
        assertTrue(sent.get("style").get("alwaysOnTop").asBoolean());

        endpoint.inject("{\"type\":\"callResult\",\"id\":\"" + sent.get("id").asText() + "\",\"value\":true}");
        assertEquals(ScriptValue.of(true), ack.get());
    }

    @Test
    void dragRegionsAndWindowOpsAreFireAndForget() throws Exception {
        bridge.setDragRegions(List.of(DragRegion.draggable(0, 0, 10, 10)));
        assertEquals("setDragRegions", lastSent().get("type").asText());

        bridge.setTitle("Hi");
        JsonNode title = lastSent();
        assertEquals("windowOp", title.get("type").asText());
        assertEquals("setTitle", title.get("op").asText());
        assertEquals("Hi", title.get("value").asText());

        bridge.minimize();
        assertFalse(lastSent().has("value"));

        bridge.openDevTools();
        assertFalse(lastSent().get("value").asBoolean());
        assertEquals(0, scheduler.liveTasks());
    }

    @Test
    void screenshotDecodesToText() throws Exception {
        CompletableFuture<String> png = bridge.captureScreenshot();
        assertEquals("__captureScreenshot", lastSent().get("name").asText());

        endpoint.inject("{\"type\":\"callResult\",\"id\":\"id-1\",\"value\":\"AQID\"}");

        assertEquals("AQID", png.get());
    }

    @Test
    void inboundEventsReachSubscribers() {
        List<String> seen = new ArrayList<>();
        bridge.on("styleChanged", seen::add);

        endpoint.inject("{\"type\":\"message\",\"event\":\"styleChanged\",\"data\":{\"cornerRadius\":3}}");

        assertEquals(List.of("{\"cornerRadius\":3}"), seen);
    }

    @Test
    void offStopsDelivery() {
        List<String> seen = new ArrayList<>();
        EventHandler h = seen::add;
        bridge.on("e", h);
        bridge.off("e", h);

        endpoint.inject("{\"type\":\"message\",\"event\":\"e\",\"data\":1}");

        assertTrue(seen.isEmpty());
    }

    @Test
    void sendUsesNullForMissingData() throws Exception {
        bridge.send("hello", null);

        JsonNode sent = lastSent();
        assertEquals("hello", sent.get("event").asText());
        assertTrue(sent.get("data").isNull());
    }

    @Test
    void evalRequestsAreAnswered() throws Exception {
        endpoint.inject("{\"type\":\"eval\",\"id\":\"eval-1\",\"script\":\"abcd\"}");
        JsonNode ok = lastSent();
        assertEquals("eval-1", ok.get("id").asText());
        assertEquals(4, ok.get("value").asInt());

        endpoint.inject("{\"type\":\"eval\",\"id\":\"eval-2\",\"script\":\"throw\"}");
        assertEquals("thrown by page", lastSent().get("error").asText());
    }

    @Test
    void unexpectedMessageIsDropped() {
        endpoint.inject("{\"type\":\"windowOp\",\"op\":\"minimize\"}");

        assertTrue(sink.hasEventOfType(BridgeProtocolEvent.MessageDropped.class));
        assertTrue(endpoint.sent().isEmpty());
    }

    @Test
    void detachRejectsPendingAndForgetsSubscriptions() {
        List<String> seen = new ArrayList<>();
        bridge.on("e", seen::add);
        CompletableFuture<ScriptValue> pending = bridge.call("f");

        bridge.detach();
        endpoint.inject("{\"type\":\"message\",\"event\":\"e\",\"data\":1}");

        ExecutionException e = assertThrows(ExecutionException.class, pending::get);
        assertInstanceOf(BridgeClosedException.class, e.getCause());
        assertTrue(seen.isEmpty());
        assertEquals(0, bridge.events().subscriberCount("e"));

        CompletableFuture<ScriptValue> late = bridge.call("g");
        assertTrue(late.isCompletedExceptionally());
    }
}
