package com.questrail.bamboo.transport.loopback;

import com.questrail.bamboo.transport.ScriptEndpoint;
import com.questrail.bamboo.transport.ScriptEndpointListener;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * LoopbackScriptEndpoints
 * =============================================================================
 * A connected pair of in-process endpoints. Whatever one side sends is
 * delivered to the other side's listener through that side's executor.
 *
 * <p>Used to wire a {@code BridgeChannel} to a JVM-hosted script runtime, and
 * in tests. Each executor must run tasks in submission order to keep the
 * FIFO guarantee.</p>
 */
public final class LoopbackScriptEndpoints
{
    private final Side nativeSide;
    private final Side scriptSide;

    private LoopbackScriptEndpoints(Executor nativeDelivery, Executor scriptDelivery) {
        this.nativeSide = new Side("native", nativeDelivery);
        this.scriptSide = new Side("script", scriptDelivery);
        nativeSide.peer = scriptSide;
        scriptSide.peer = nativeSide;
    }

    /**
     * @param nativeDelivery runs deliveries into the native side's listener
     * @param scriptDelivery runs deliveries into the script side's listener
     */
    public static LoopbackScriptEndpoints create(Executor nativeDelivery, Executor scriptDelivery) {
        return new LoopbackScriptEndpoints(
                Objects.requireNonNull(nativeDelivery, "nativeDelivery"),
                Objects.requireNonNull(scriptDelivery, "scriptDelivery"));
    }

    /** Pair that delivers inline on the sending thread. */
    public static LoopbackScriptEndpoints direct() {
        return create(Runnable::run, Runnable::run);
    }

    public ScriptEndpoint nativeEndpoint() {
        return nativeSide;
    }

    public ScriptEndpoint scriptEndpoint() {
        return scriptSide;
    }

    private static final class Side implements ScriptEndpoint
    {
        private final String name;
        private final Executor delivery;
        private Side peer;

        private volatile ScriptEndpointListener listener;
        private volatile boolean up;

        Side(String name, Executor delivery) {
            this.name = name;
            this.delivery = delivery;
        }

        @Override
        public void setListener(ScriptEndpointListener listener) {
            this.listener = Objects.requireNonNull(listener, "listener");
        }

        @Override
        public void start() {
            ScriptEndpointListener l = listener;
            if (l == null) {
                throw new IllegalStateException("ScriptEndpointListener must be set before start()");
            }
            if (!up) {
                up = true;
                l.onTransportUp();
            }
        }

        @Override
        public void stop() {
            if (up) {
                up = false;
                ScriptEndpointListener l = listener;
                if (l != null) {
                    l.onTransportDown(null);
                }
            }
        }

        @Override
        public void send(byte[] payload) {
            Objects.requireNonNull(payload, "payload");
            if (!up || !peer.up) {
                // Nobody on the other end; loopback drops like a closed socket.
                return;
            }
            byte[] copy = payload.clone();
            peer.delivery.execute(() -> {
                ScriptEndpointListener l = peer.listener;
                if (l != null && peer.up) {
                    l.onPayload(copy);
                }
            });
        }

        @Override
        public String toString() {
            return "LoopbackScriptEndpoint[" + name + "]";
        }
    }
}
