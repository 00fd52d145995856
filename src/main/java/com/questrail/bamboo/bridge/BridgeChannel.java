package com.questrail.bamboo.bridge;

import com.questrail.bamboo.api.BrowserError;
import com.questrail.bamboo.api.BrowserException;
import com.questrail.bamboo.api.MessageCallback;
import com.questrail.bamboo.api.NativeFunction;
import com.questrail.bamboo.api.ScriptValue;
import com.questrail.bamboo.bridge.codec.BridgeDecodeException;
import com.questrail.bamboo.bridge.codec.BridgeMessageDecoder;
import com.questrail.bamboo.bridge.codec.BridgeMessageEncoder;
import com.questrail.bamboo.bridge.codec.impl.JsonBridgeMessageDecoder;
import com.questrail.bamboo.bridge.codec.impl.JsonBridgeMessageEncoder;
import com.questrail.bamboo.bridge.model.BridgeMessage;
import com.questrail.bamboo.bridge.model.CallOutcome;
import com.questrail.bamboo.bridge.model.ReservedNames;
import com.questrail.bamboo.bridge.pending.PendingCall;
import com.questrail.bamboo.bridge.pending.PendingCallTable;
import com.questrail.bamboo.bridge.rpc.RpcRegistry;
import com.questrail.bamboo.bridge.window.WindowCommandDispatcher;
import com.questrail.bamboo.bridge.window.WindowControl;
import com.questrail.bamboo.config.BridgeTimingPolicy;
import com.questrail.bamboo.internal.exec.OwnerThread;
import com.questrail.bamboo.internal.time.MonotonicClock;
import com.questrail.bamboo.internal.time.MonotonicScheduler;
import com.questrail.bamboo.internal.time.SystemWallClock;
import com.questrail.bamboo.observability.BridgeErrorEvent;
import com.questrail.bamboo.observability.BridgeObservabilitySink;
import com.questrail.bamboo.observability.BridgeProtocolEvent;
import com.questrail.bamboo.observability.BridgeTransportEvent;
import com.questrail.bamboo.observability.NullObservabilitySink;
import com.questrail.bamboo.style.StyleJson;
import com.questrail.bamboo.style.WindowStyle;
import com.questrail.bamboo.style.reconcile.StyleReconciler;
import com.questrail.bamboo.transport.ScriptEndpoint;
import com.questrail.bamboo.transport.ScriptEndpointListener;

import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * BridgeChannel
 * =============================================================================
 * The native end of one page's script bridge.
 *
 * <h2>Inbound path</h2>
 * <pre>
 *   ScriptEndpoint.onPayload
 *        → post to owner thread
 *            → BridgeMessageDecoder        (malformed: dropped, reported)
 *                → CallResult   → PendingCallTable
 *                → Call         → RpcRegistry, reply
 *                → StyleRequest → merge, StyleReconciler.apply, styleChanged, ack
 *                → DragRegionUpdate → StyleReconciler.setDragRegions
 *                → WindowOp     → WindowCommandDispatcher
 *                → Event        → host MessageCallback
 * </pre>
 *
 * <h2>Outbound path</h2>
 * {@link #sendEvent} and {@link #invokeRemoteEval} encode on the calling thread
 * and hand the bytes to the owner thread, which writes them to the endpoint in
 * posting order.
 *
 * <h2>Threading</h2>
 * The pending table, RPC registry and reconciler are touched only on the owner
 * thread. Public methods may be called from any thread.
 *
 * <h2>Teardown</h2>
 * {@link #close()} rejects every pending call with
 * {@link BridgeClosedException}, stops the endpoint, and makes the channel drop
 * all further traffic.
 */
public final class BridgeChannel implements ScriptEndpointListener
{
    private static final String EVAL_ID_PREFIX = "eval-";
    private static final int DESCRIPTION_SCRIPT_LIMIT = 60;

    private final ScriptEndpoint endpoint;
    private final OwnerThread ownerThread;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final BridgeTimingPolicy timingPolicy;
    private final BridgeObservabilitySink observabilitySink;
    private final BridgeMessageDecoder decoder;
    private final BridgeMessageEncoder encoder;
    private final StyleReconciler reconciler;
    private final WindowCommandDispatcher windowCommands;
    private final ScreenshotSource screenshotSource;

    private final PendingCallTable pending = new PendingCallTable();
    private final RpcRegistry rpcRegistry = new RpcRegistry();
    private final AtomicLong nextEvalId = new AtomicLong(1);

    private volatile MessageCallback messageCallback;
    private volatile boolean closed;

    private BridgeChannel(Builder b)
    {
        this.endpoint = b.endpoint;
        this.ownerThread = b.ownerThread;
        this.clock = b.clock;
        this.scheduler = b.scheduler;
        this.timingPolicy = b.timingPolicy;
        this.observabilitySink = b.observabilitySink;
        this.decoder = b.decoder;
        this.encoder = b.encoder;
        this.reconciler = b.reconciler;
        this.windowCommands = new WindowCommandDispatcher(b.windowControl);
        this.screenshotSource = b.screenshotSource;
        this.messageCallback = b.messageCallback;

        this.endpoint.setListener(this);
    }

    public static Builder builder() {
        return new Builder();
    }

    public void start() {
        endpoint.start();
    }

    public boolean isClosed() {
        return closed;
    }

    public void setMessageCallback(MessageCallback callback) {
        this.messageCallback = callback;
    }

    public void bindFunction(String name, NativeFunction function) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(function, "function");
        ownerThread.execute(() -> rpcRegistry.bind(name, function));
    }

    public void unbindFunction(String name) {
        Objects.requireNonNull(name, "name");
        ownerThread.execute(() -> rpcRegistry.unbind(name));
    }

    /** Number of native-initiated calls awaiting a reply. Owner thread only. */
    public int pendingCalls() {
        return pending.size();
    }

    // -------------------------------------------------------------------------
    // Inbound
    // -------------------------------------------------------------------------

    /**
     * Decode and route one inbound payload on the owner thread.
     */
    public void dispatch(byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        ownerThread.execute(() -> handle(payload));
    }

    @Override
    public void onPayload(byte[] payload) {
        dispatch(payload);
    }

    @Override
    public void onTransportUp() {
        observabilitySink.onTransportEvent(new BridgeTransportEvent(
                SystemWallClock.INSTANCE.now(), BridgeTransportEvent.Kind.UP, null));
    }

    @Override
    public void onTransportDown(Throwable cause) {
        observabilitySink.onTransportEvent(new BridgeTransportEvent(
                SystemWallClock.INSTANCE.now(), BridgeTransportEvent.Kind.DOWN, cause));
    }

    private void handle(byte[] payload) {
        if (closed) {
            protocol(new BridgeProtocolEvent.MessageDropped(SystemWallClock.INSTANCE.now(), "channel closed", null));
            return;
        }

        final BridgeMessage message;
        try {
            message = decoder.decode(payload);
        } catch (BridgeDecodeException e) {
            protocol(new BridgeProtocolEvent.MessageDropped(SystemWallClock.INSTANCE.now(), e.getMessage(), e));
            return;
        }

        if (message instanceof BridgeMessage.CallResult r) {
            onCallResult(r);
        } else if (message instanceof BridgeMessage.Call c) {
            onCall(c);
        } else if (message instanceof BridgeMessage.StyleRequest s) {
            onStyleRequest(s);
        } else if (message instanceof BridgeMessage.DragRegionUpdate d) {
            reconciler.setDragRegions(d.regions());
        } else if (message instanceof BridgeMessage.WindowOp w) {
            onWindowOp(w);
        } else if (message instanceof BridgeMessage.Event e) {
            onEvent(e);
        } else {
            protocol(new BridgeProtocolEvent.MessageDropped(
                    SystemWallClock.INSTANCE.now(),
                    "Unexpected inbound " + message.getClass().getSimpleName(),
                    null));
        }
    }

    private void onCallResult(BridgeMessage.CallResult result) {
        Optional<PendingCall> settled;
        if (result.outcome() instanceof CallOutcome.Failure f) {
            settled = pending.fail(result.id(), c -> new BrowserException(
                    BrowserError.SCRIPT_EXCEPTION,
                    c.description() + " failed: " + f.message(),
                    new RemoteCallException(c.id(), f.message())));
        } else {
            settled = pending.complete(result.id(), ((CallOutcome.Success) result.outcome()).value());
        }

        if (settled.isEmpty()) {
            protocol(new BridgeProtocolEvent.LateReplyDropped(SystemWallClock.INSTANCE.now(), result.id()));
        }
    }

    private void onCall(BridgeMessage.Call call) {
        if (ReservedNames.CAPTURE_SCREENSHOT.equals(call.name())) {
            captureScreenshot(call.id());
            return;
        }

        Optional<NativeFunction> function = rpcRegistry.lookup(call.name());
        if (function.isEmpty()) {
            protocol(new BridgeProtocolEvent.UnknownFunction(SystemWallClock.INSTANCE.now(), call.id(), call.name()));
            reply(BridgeMessage.CallResult.failure(call.id(), "Unknown function: " + call.name()));
            return;
        }

        ScriptValue result;
        try {
            result = function.get().invoke(call.args());
        } catch (Exception e) {
            reply(BridgeMessage.CallResult.failure(call.id(), describe(e)));
            return;
        }
        reply(BridgeMessage.CallResult.success(call.id(), result == null ? ScriptValue.ABSENT : result));
    }

    private void captureScreenshot(String id) {
        if (screenshotSource == null) {
            reply(BridgeMessage.CallResult.failure(id, "Screenshot capture unavailable"));
            return;
        }

        CompletableFuture<byte[]> png;
        try {
            png = screenshotSource.capturePng();
        } catch (RuntimeException e) {
            reply(BridgeMessage.CallResult.failure(id, "Screenshot capture failed: " + describe(e)));
            return;
        }

        png.whenComplete((bytes, err) -> ownerThread.execute(() -> {
            if (err != null || bytes == null) {
                String reason = err == null ? "no image" : describe(err);
                reply(BridgeMessage.CallResult.failure(id, "Screenshot capture failed: " + reason));
            } else {
                reply(BridgeMessage.CallResult.success(id, ScriptValue.of(Base64.getEncoder().encodeToString(bytes))));
            }
        }));
    }

    private void onStyleRequest(BridgeMessage.StyleRequest request) {
        WindowStyle merged;
        try {
            merged = request.patch().applyTo(reconciler.current());
        } catch (IllegalArgumentException e) {
            protocol(new BridgeProtocolEvent.MessageDropped(SystemWallClock.INSTANCE.now(), e.getMessage(), e));
            request.ack().ifPresent(id -> reply(BridgeMessage.CallResult.failure(id, e.getMessage())));
            return;
        }

        reconciler.apply(merged);
        transmit(new BridgeMessage.Event(ReservedNames.STYLE_CHANGED, StyleJson.toJson(merged)));
        request.ack().ifPresent(id -> reply(BridgeMessage.CallResult.success(id, ScriptValue.of(true))));
    }

    private void onWindowOp(BridgeMessage.WindowOp op) {
        if (op.command().isEmpty()) {
            protocol(new BridgeProtocolEvent.UnknownWindowOp(SystemWallClock.INSTANCE.now(), op.op()));
            return;
        }
        windowCommands.dispatch(op);
    }

    private void onEvent(BridgeMessage.Event event) {
        MessageCallback callback = messageCallback;
        if (callback == null) {
            return;
        }
        try {
            callback.onMessage(event.name(), event.payload());
        } catch (RuntimeException e) {
            observabilitySink.onError(new BridgeErrorEvent(
                    SystemWallClock.INSTANCE.now(),
                    "Message callback failed for event " + event.name(),
                    e));
        }
    }

    // -------------------------------------------------------------------------
    // Outbound
    // -------------------------------------------------------------------------

    /**
     * Publish an event to the page's subscribers.
     *
     * @param jsonPayload JSON text; use {@code "null"} for no data
     * @throws IllegalArgumentException if {@code jsonPayload} is not valid JSON
     */
    public void sendEvent(String name, String jsonPayload) {
        byte[] bytes = encoder.encode(new BridgeMessage.Event(name, jsonPayload));
        ownerThread.execute(() -> write(bytes));
    }

    /**
     * Evaluate script in the page and resolve with its value.
     *
     * <p>The returned future completes exactly once: with the reply's value,
     * with {@link BrowserException} ({@link BrowserError#SCRIPT_EXCEPTION}) if
     * the script threw, with {@link BridgeTimeoutException} if no reply arrives
     * within the call timeout, or with {@link BridgeClosedException} if the
     * channel closes first.</p>
     */
    public CompletableFuture<ScriptValue> invokeRemoteEval(String script) {
        Objects.requireNonNull(script, "script");
        CompletableFuture<ScriptValue> result = new CompletableFuture<>();
        ownerThread.execute(() -> startEval(script, result));
        return result;
    }

    private void startEval(String script, CompletableFuture<ScriptValue> result) {
        String description = "evalRemote(" + abbreviate(script) + ")";
        if (closed) {
            result.completeExceptionally(new BridgeClosedException(description + " issued on a closed channel"));
            return;
        }

        String id = EVAL_ID_PREFIX + nextEvalId.getAndIncrement();
        Duration timeout = timingPolicy.callTimeout();
        long deadline = clock.nowNanos() + timeout.toNanos();

        pending.register(id, description, deadline, result);
        pending.armTimeout(id, scheduler.scheduleAtNanos(deadline,
                () -> ownerThread.execute(() -> onTimeout(id, timeout))));

        try {
            endpoint.send(encoder.encode(new BridgeMessage.Eval(id, script)));
        } catch (RuntimeException e) {
            pending.fail(id, c -> e);
            observabilitySink.onError(new BridgeErrorEvent(
                    SystemWallClock.INSTANCE.now(), "Failed to send " + description, e));
        }
    }

    private void onTimeout(String id, Duration timeout) {
        pending.fail(id, c -> new BridgeTimeoutException(c.id(), c.description(), timeout))
                .ifPresent(c -> protocol(new BridgeProtocolEvent.CallTimedOut(
                        SystemWallClock.INSTANCE.now(), c.id(), c.description())));
    }

    private void reply(BridgeMessage.CallResult result) {
        transmit(result);
    }

    private void transmit(BridgeMessage message) {
        write(encoder.encode(message));
    }

    private void write(byte[] bytes) {
        if (closed) {
            return;
        }
        try {
            endpoint.send(bytes);
        } catch (RuntimeException e) {
            observabilitySink.onError(new BridgeErrorEvent(
                    SystemWallClock.INSTANCE.now(), "Failed to send to script", e));
        }
    }

    // -------------------------------------------------------------------------
    // Teardown
    // -------------------------------------------------------------------------

    /**
     * Tear down the channel. Idempotent.
     */
    public void close() {
        ownerThread.execute(this::closeOnOwner);
    }

    private void closeOnOwner() {
        if (closed) {
            return;
        }
        closed = true;

        List<String> rejected = pending.rejectAll(
                c -> new BridgeClosedException(c.description() + " rejected: bridge channel closed"));
        rpcRegistry.clear();
        protocol(new BridgeProtocolEvent.ChannelClosed(SystemWallClock.INSTANCE.now(), rejected.size()));
        endpoint.stop();
    }

    private void protocol(BridgeProtocolEvent event) {
        observabilitySink.onProtocolEvent(event);
    }

    private static String describe(Throwable t) {
        String m = t.getMessage();
        return (m == null || m.isBlank()) ? t.getClass().getSimpleName() : m;
    }

    private static String abbreviate(String script) {
        String s = script.strip();
        return "'" + (s.length() <= DESCRIPTION_SCRIPT_LIMIT ? s : s.substring(0, DESCRIPTION_SCRIPT_LIMIT) + "...") + "'";
    }

    /**
     * Builder
     * -------------------------------------------------------------------------
     * Endpoint, owner thread, clock, scheduler, reconciler and window control
     * are required. Everything else has a default.
     */
    public static final class Builder
    {
        private ScriptEndpoint endpoint;
        private OwnerThread ownerThread;
        private MonotonicClock clock;
        private MonotonicScheduler scheduler;
        private BridgeTimingPolicy timingPolicy = BridgeTimingPolicy.defaults();
        private BridgeObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private BridgeMessageDecoder decoder = new JsonBridgeMessageDecoder();
        private BridgeMessageEncoder encoder = new JsonBridgeMessageEncoder();
        private StyleReconciler reconciler;
        private WindowControl windowControl;
        private ScreenshotSource screenshotSource;
        private MessageCallback messageCallback;

        private Builder() {}

        public Builder withEndpoint(ScriptEndpoint endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder withOwnerThread(OwnerThread ownerThread) {
            this.ownerThread = ownerThread;
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

        public Builder withDecoder(BridgeMessageDecoder decoder) {
            this.decoder = Objects.requireNonNull(decoder, "decoder");
            return this;
        }

        public Builder withEncoder(BridgeMessageEncoder encoder) {
            this.encoder = Objects.requireNonNull(encoder, "encoder");
            return this;
        }

        public Builder withStyleReconciler(StyleReconciler reconciler) {
            this.reconciler = reconciler;
            return this;
        }

        public Builder withWindowControl(WindowControl windowControl) {
            this.windowControl = windowControl;
            return this;
        }

        public Builder withScreenshotSource(ScreenshotSource screenshotSource) {
            this.screenshotSource = screenshotSource;
            return this;
        }

        public Builder withMessageCallback(MessageCallback messageCallback) {
            this.messageCallback = messageCallback;
            return this;
        }

        public BridgeChannel build() {
            Objects.requireNonNull(endpoint, "endpoint");
            Objects.requireNonNull(ownerThread, "ownerThread");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(scheduler, "scheduler");
            Objects.requireNonNull(reconciler, "reconciler");
            Objects.requireNonNull(windowControl, "windowControl");
            return new BridgeChannel(this);
        }
    }
}
