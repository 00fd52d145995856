package com.questrail.bamboo.bridge.model;

import com.questrail.bamboo.api.ScriptValue;
import com.questrail.bamboo.style.DragRegion;
import com.questrail.bamboo.style.StylePatch;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * BridgeMessage
 * =============================================================================
 * Everything that crosses the script/native bridge, as a closed set of
 * variants.
 *
 * <h2>Direction</h2>
 * <ul>
 *   <li>Script to native: {@link Event}, {@link Call}, {@link CallResult},
 *       {@link StyleRequest}, {@link DragRegionUpdate}, {@link WindowOp}</li>
 *   <li>Native to script: {@link Event}, {@link CallResult}, {@link Eval}</li>
 * </ul>
 *
 * <h2>Invariants</h2>
 * A {@link Call} id is unique while its pending entry lives. A
 * {@link CallResult} carries exactly one of value or error, and consumes at
 * most one pending entry.
 */
public sealed interface BridgeMessage
{
    /**
     * Fire-and-forget pub/sub notification.
     *
     * @param payload JSON text; {@code "null"} when the sender gave no data
     */
    record Event(String name, String payload) implements BridgeMessage
    {
        public Event {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(payload, "payload");
        }
    }

    /** Invoke a function on the other side; exactly one reply expected. */
    record Call(String id, String name, List<ScriptValue> args) implements BridgeMessage
    {
        public Call {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(name, "name");
            args = List.copyOf(args);
        }
    }

    record CallResult(String id, CallOutcome outcome) implements BridgeMessage
    {
        public CallResult {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(outcome, "outcome");
        }

        public static CallResult success(String id, ScriptValue value) {
            return new CallResult(id, new CallOutcome.Success(value));
        }

        public static CallResult failure(String id, String message) {
            return new CallResult(id, new CallOutcome.Failure(message));
        }
    }

    /**
     * @param ackId id to acknowledge once applied; {@code null} for no acknowledgment
     */
    record StyleRequest(StylePatch patch, String ackId) implements BridgeMessage
    {
        public StyleRequest {
            Objects.requireNonNull(patch, "patch");
        }

        public Optional<String> ack() {
            return Optional.ofNullable(ackId);
        }
    }

    record DragRegionUpdate(List<DragRegion> regions) implements BridgeMessage
    {
        public DragRegionUpdate {
            regions = List.copyOf(regions);
        }
    }

    /**
     * @param op    raw command name; may be outside the known vocabulary
     * @param value {@link ScriptValue#ABSENT} when not supplied
     */
    record WindowOp(String op, ScriptValue value) implements BridgeMessage
    {
        public WindowOp {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(value, "value");
        }

        public Optional<WindowCommand> command() {
            return WindowCommand.fromWire(op);
        }
    }

    /** Native request to evaluate script; answered by a {@link CallResult} with the same id. */
    record Eval(String id, String script) implements BridgeMessage
    {
        public Eval {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(script, "script");
        }
    }
}
