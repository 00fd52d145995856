package com.questrail.bamboo.script;

import com.questrail.bamboo.api.ScriptValue;
import com.questrail.bamboo.bridge.BridgeClosedException;
import com.questrail.bamboo.bridge.BridgeTimeoutException;
import com.questrail.bamboo.bridge.RemoteCallException;
import com.questrail.bamboo.bridge.codec.BridgeDecodeException;
import com.questrail.bamboo.bridge.codec.BridgeMessageDecoder;
import com.questrail.bamboo.bridge.codec.BridgeMessageEncoder;
import com.questrail.bamboo.bridge.codec.impl.JsonBridgeMessageDecoder;
import com.questrail.bamboo.bridge.codec.impl.JsonBridgeMessageEncoder;
import com.questrail.bamboo.bridge.model.BridgeMessage;
import com.questrail.bamboo.bridge.model.CallOutcome;
import com.questrail.bamboo.bridge.model.ReservedNames;
import com.questrail.bamboo.bridge.model.WindowCommand;
import com.questrail.bamboo.bridge.pending.PendingCallTable;
import com.questrail.bamboo.config.BridgeTimingPolicy;
import com.questrail.bamboo.internal.exec.OwnerThread;
import com.questrail.bamboo.internal.time.MonotonicClock;
import com.questrail.bamboo.internal.time.MonotonicScheduler;
import com.questrail.bamboo.internal.time.SystemWallClock;
import com.questrail.bamboo.observability.BridgeErrorEvent;
import com.questrail.bamboo.observability.BridgeObservabilitySink;
import com.questrail.bamboo.observability.BridgeProtocolEvent;
import com.questrail.bamboo.observability.NullObservabilitySink;
import com.questrail.bamboo.platform.PlatformFamily;
import com.questrail.bamboo.style.DragRegion;
import com.questrail.bamboo.style.StylePatch;
import com.questrail.bamboo.transport.ScriptEndpoint;
import com.questrail.bamboo.transport.ScriptEndpointListener;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * ScriptBridge
 * =============================================================================
 * The script-side end of the bridge: the same API the page sees as
 * {@code window.bamboo}, for script hosts that run inside the JVM.
 *
 * <h2>Surface</h2>
 * <ul>
 *   <li>pub/sub: {@link #send}, {@link #on}, {@link #off}</li>
 *   <li>RPC: {@link #call}, which times out after the call timeout</li>
 *   <li>style: {@link #setStyle} (acknowledged), {@link #setDragRegions}</li>
 *   <li>window commands: {@link #setTitle}, {@link #minimize} and friends</li>
 *   <li>{@link #captureScreenshot}, answered with base64 PNG text</li>
 * </ul>
 *
 * <h2>Inbound</h2>
 * Events from native are published on the {@link EventBus}. Replies settle
 * the matching pending call at most once. {@code eval} requests are run through
 * the {@link ScriptEvaluator} and answered with a call result.
 *
 * <p>All state is confined to the script thread.</p>
 */
public final class ScriptBridge implements ScriptEndpointListener
{
    public static final String VERSION = "1.0.0";

    private final ScriptEndpoint endpoint;
    private final OwnerThread scriptThread;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final BridgeTimingPolicy timingPolicy;
    private final BridgeObservabilitySink observabilitySink;
    private final BridgeMessageDecoder decoder;
    private final BridgeMessageEncoder encoder;
    private final ScriptEvaluator evaluator;
    private final Supplier<String> idGenerator;
    private final PlatformFamily platform;

    private final EventBus bus;
    private final PendingCallTable pending = new PendingCallTable();

    private volatile boolean closed;

    private ScriptBridge(Builder b)
    {
        this.endpoint = b.endpoint;
        this.scriptThread = b.scriptThread;
        this.clock = b.clock;
        this.scheduler = b.scheduler;
        this.timingPolicy = b.timingPolicy;
        this.observabilitySink = b.observabilitySink;
        this.decoder = b.decoder;
        this.encoder = b.encoder;
        this.evaluator = b.evaluator;
        this.idGenerator = b.idGenerator;
        this.platform = b.platform;
        this.bus = new EventBus(observabilitySink);

        this.endpoint.setListener(this);
    }

    public static Builder builder() {
        return new Builder();
    }

    public void start() {
        endpoint.start();
    }

    public String version() {
        return VERSION;
    }

    /** Platform name as the page sees it: {@code windows}, {@code macos} or {@code linux}. */
    public String platform() {
        return platform.wireName();
    }

    public EventBus events() {
        return bus;
    }

    // -------------------------------------------------------------------------
    // Pub/sub
    // -------------------------------------------------------------------------

    /**
     * @param jsonData event data as JSON text, or {@code null} for none
     */
    public void send(String event, String jsonData) {
        post(new BridgeMessage.Event(event, jsonData == null ? "null" : jsonData));
    }

    public Subscription on(String event, EventHandler handler) {
        return bus.subscribe(event, handler);
    }

    public void off(String event, EventHandler handler) {
        bus.unsubscribe(event, handler);
    }

    // -------------------------------------------------------------------------
    // RPC
    // -------------------------------------------------------------------------

    /**
     * Invoke a native bound function.
     *
     * <p>Completes with the function's value, with {@link RemoteCallException}
     * if native replies with an error (unknown name included), or with
     * {@link BridgeTimeoutException} if no reply arrives in time.</p>
     */
    public CompletableFuture<ScriptValue> call(String name, ScriptValue... args) {
        Objects.requireNonNull(name, "name");
        List<ScriptValue> argList = Arrays.asList(args);
        return request("bamboo.call('" + name + "')", id -> new BridgeMessage.Call(id, name, argList));
    }

    /**
     * Merge the given fields into the window style.
     *
     * @return completes with {@code true} once native has applied the change
     */
    public CompletableFuture<ScriptValue> setStyle(StylePatch patch) {
        Objects.requireNonNull(patch, "patch");
        return request("bamboo.setStyle()", id -> new BridgeMessage.StyleRequest(patch, id));
    }

    public void setDragRegions(List<DragRegion> regions) {
        post(new BridgeMessage.DragRegionUpdate(regions));
    }

    /**
     * @return completes with the page's PNG image as base64 text
     */
    public CompletableFuture<String> captureScreenshot() {
        return call(ReservedNames.CAPTURE_SCREENSHOT)
                .thenApply(v -> v.asText().orElseThrow(
                        () -> new IllegalStateException("Screenshot reply carried no image data")));
    }

    // -------------------------------------------------------------------------
    // Window commands
    // -------------------------------------------------------------------------

    public void setTitle(String title) {
        windowOp(WindowCommand.SET_TITLE, ScriptValue.of(title));
    }

    public void minimize() {
        windowOp(WindowCommand.MINIMIZE, ScriptValue.ABSENT);
    }

    public void maximize() {
        windowOp(WindowCommand.MAXIMIZE, ScriptValue.ABSENT);
    }

    public void restore() {
        windowOp(WindowCommand.RESTORE, ScriptValue.ABSENT);
    }

    public void close() {
        windowOp(WindowCommand.CLOSE, ScriptValue.ABSENT);
    }

    public void setAlwaysOnTop(boolean alwaysOnTop) {
        windowOp(WindowCommand.ALWAYS_ON_TOP, ScriptValue.of(alwaysOnTop));
    }

    public void setFullscreen(boolean fullscreen) {
        windowOp(WindowCommand.FULLSCREEN, ScriptValue.of(fullscreen));
    }

    public void setZoom(double factor) {
        windowOp(WindowCommand.ZOOM, ScriptValue.of(factor));
    }

    public void openDevTools() {
        openDevTools(false);
    }

    public void openDevTools(boolean docked) {
        windowOp(WindowCommand.DEV_TOOLS, ScriptValue.of(docked));
    }

    public void print() {
        windowOp(WindowCommand.PRINT, ScriptValue.ABSENT);
    }

    private void windowOp(WindowCommand command, ScriptValue value) {
        post(new BridgeMessage.WindowOp(command.wireName(), value));
    }

    // -------------------------------------------------------------------------
    // Inbound
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp() {
    }

    @Override
    public void onTransportDown(Throwable cause) {
        scriptThread.execute(this::detach);
    }

    @Override
    public void onPayload(byte[] payload) {
        scriptThread.execute(() -> handle(payload));
    }

    private void handle(byte[] payload) {
        if (closed) {
            return;
        }

        final BridgeMessage message;
        try {
            message = decoder.decode(payload);
        } catch (BridgeDecodeException e) {
            observabilitySink.onProtocolEvent(new BridgeProtocolEvent.MessageDropped(
                    SystemWallClock.INSTANCE.now(), e.getMessage(), e));
            return;
        }

        if (message instanceof BridgeMessage.Event e) {
            bus.publish(e.name(), e.payload());
        } else if (message instanceof BridgeMessage.CallResult r) {
            resolve(r);
        } else if (message instanceof BridgeMessage.Eval ev) {
            evaluate(ev);
        } else {
            observabilitySink.onProtocolEvent(new BridgeProtocolEvent.MessageDropped(
                    SystemWallClock.INSTANCE.now(),
                    "Unexpected message from native: " + message.getClass().getSimpleName(),
                    null));
        }
    }

    private void resolve(BridgeMessage.CallResult result) {
        if (result.outcome() instanceof CallOutcome.Failure f) {
            pending.fail(result.id(), c -> new RemoteCallException(c.id(), f.message()));
        } else {
            pending.complete(result.id(), ((CallOutcome.Success) result.outcome()).value());
        }
    }

    private void evaluate(BridgeMessage.Eval eval) {
        if (evaluator == null) {
            post(BridgeMessage.CallResult.failure(eval.id(), "Script evaluation unavailable"));
            return;
        }
        ScriptValue value;
        try {
            value = evaluator.evaluate(eval.script());
        } catch (Exception e) {
            String m = e.getMessage();
            post(BridgeMessage.CallResult.failure(eval.id(), m == null ? e.getClass().getSimpleName() : m));
            return;
        }
        post(BridgeMessage.CallResult.success(eval.id(), value == null ? ScriptValue.ABSENT : value));
    }

    // -------------------------------------------------------------------------
    // Plumbing
    // -------------------------------------------------------------------------

    private CompletableFuture<ScriptValue> request(String description,
                                                   Function<String, BridgeMessage> message) {
        CompletableFuture<ScriptValue> result = new CompletableFuture<>();
        scriptThread.execute(() -> {
            if (closed) {
                result.completeExceptionally(new BridgeClosedException(description + " issued after the page unloaded"));
                return;
            }
            String id = idGenerator.get();
            Duration timeout = timingPolicy.callTimeout();
            long deadline = clock.nowNanos() + timeout.toNanos();

            pending.register(id, description, deadline, result);
            pending.armTimeout(id, scheduler.scheduleAtNanos(deadline, () -> scriptThread.execute(
                    () -> pending.fail(id, c -> new BridgeTimeoutException(c.id(), c.description(), timeout)))));

            try {
                endpoint.send(encoder.encode(message.apply(id)));
            } catch (RuntimeException e) {
                pending.fail(id, c -> e);
            }
        });
        return result;
    }

    private void post(BridgeMessage message) {
        byte[] bytes = encoder.encode(message);
        scriptThread.execute(() -> {
            if (closed) {
                return;
            }
            try {
                endpoint.send(bytes);
            } catch (RuntimeException e) {
                observabilitySink.onError(new BridgeErrorEvent(
                        SystemWallClock.INSTANCE.now(), "Failed to send to native", e));
            }
        });
    }

    /**
     * Page teardown: reject outstanding calls and forget all subscriptions.
     */
    public void detach() {
        scriptThread.execute(() -> {
            if (closed) {
                return;
            }
            closed = true;
            pending.rejectAll(c -> new BridgeClosedException(c.description() + " rejected: page unloaded"));
            bus.clear();
        });
    }

    /**
     * Builder
     * -------------------------------------------------------------------------
     * Endpoint, script thread, clock and scheduler are required.
     */
    public static final class Builder
    {
        private ScriptEndpoint endpoint;
        private OwnerThread scriptThread;
        private MonotonicClock clock;
        private MonotonicScheduler scheduler;
        private BridgeTimingPolicy timingPolicy = BridgeTimingPolicy.defaults();
        private BridgeObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private BridgeMessageDecoder decoder = new JsonBridgeMessageDecoder();
        private BridgeMessageEncoder encoder = new JsonBridgeMessageEncoder();
        private ScriptEvaluator evaluator;
        private Supplier<String> idGenerator = () -> UUID.randomUUID().toString();
        private PlatformFamily platform = PlatformFamily.current();

        private Builder() {}

        public Builder withEndpoint(ScriptEndpoint endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder withScriptThread(OwnerThread scriptThread) {
            this.scriptThread = scriptThread;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder withTimingPolicy(BridgeTimingPolicy timingPolicy) {
            this.timingPolicy = Objects.requireNonNull(timingPolicy, "timingPolicy");
            return this;
        }

        public Builder withObservabilitySink(BridgeObservabilitySink sink) {
            this.observabilitySink = Objects.requireNonNullElse(sink, NullObservabilitySink.INSTANCE);
            return this;
        }

        public Builder withEvaluator(ScriptEvaluator evaluator) {
            this.evaluator = evaluator;
            return this;
        }

        public Builder withIdGenerator(Supplier<String> idGenerator) {
            this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
            return this;
        }

        public Builder withPlatform(PlatformFamily platform) {
            this.platform = Objects.requireNonNull(platform, "platform");
            return this;
        }

        public ScriptBridge build() {
            Objects.requireNonNull(endpoint, "endpoint");
            Objects.requireNonNull(scriptThread, "scriptThread");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(scheduler, "scheduler");
            return new ScriptBridge(this);
        }
    }
}
