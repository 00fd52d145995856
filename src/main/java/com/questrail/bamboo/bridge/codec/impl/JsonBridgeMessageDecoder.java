package com.questrail.bamboo.bridge.codec.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.bamboo.api.ScriptValue;
import com.questrail.bamboo.bridge.codec.BridgeDecodeException;
import com.questrail.bamboo.bridge.codec.BridgeMessageDecoder;
import com.questrail.bamboo.bridge.model.BridgeMessage;
import com.questrail.bamboo.bridge.model.CallOutcome;
import com.questrail.bamboo.bridge.model.ReservedNames;
import com.questrail.bamboo.style.DragRegion;
import com.questrail.bamboo.style.StyleJson;
import com.questrail.bamboo.style.StylePatch;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JsonBridgeMessageDecoder
 * =============================================================================
 * Decodes the JSON wire form into {@link BridgeMessage} variants.
 *
 * <h2>Reserved events</h2>
 * The page-side API sends some requests as ordinary {@code message} envelopes
 * with a reserved event name. Those are unwrapped here so the channel only ever
 * sees typed variants:
 *
 * <pre>
 *   {"type":"message","event":"__call","data":{"id":..,"name":..,"args":[..]}}
 *        → BridgeMessage.Call
 * </pre>
 *
 * <p>Ids are opaque: a numeric id is accepted and carried as its text form.</p>
 */
public final class JsonBridgeMessageDecoder implements BridgeMessageDecoder
{
    private final ObjectMapper mapper;

    public JsonBridgeMessageDecoder() {
        this(new ObjectMapper());
    }

    public JsonBridgeMessageDecoder(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public BridgeMessage decode(byte[] payload) {
        Objects.requireNonNull(payload, "payload");

        JsonNode root;
        try {
            root = mapper.readTree(payload);
        } catch (IOException e) {
            throw new BridgeDecodeException("Malformed JSON payload", e);
        }
        if (root == null || !root.isObject()) {
            throw new BridgeDecodeException("Bridge message must be a JSON object");
        }

        String type = requiredText(root, "type");
        switch (type) {
            case "message":
                return decodeMessage(root);
            case "call":
                return decodeCall(root);
            case "callResult":
                return decodeCallResult(root);
            case "setStyle":
                return decodeStyleRequest(root);
            case "setDragRegions":
                return decodeDragRegions(root);
            case "windowOp":
                return decodeWindowOp(root);
            case "eval":
                return decodeEval(root);
            default:
                throw new BridgeDecodeException("Unknown message type: " + type);
        }
    }

    private BridgeMessage decodeMessage(JsonNode root) {
        String event = requiredText(root, "event");
        JsonNode data = root.get("data");

        if (ReservedNames.isReserved(event)) {
            if (data == null || !data.isObject()) {
                throw new BridgeDecodeException("Reserved event " + event + " requires an object payload");
            }
            switch (event) {
                case ReservedNames.EVAL_RESULT:
                    return decodeCallResult(data);
                case ReservedNames.CALL:
                    return decodeCall(data);
                case ReservedNames.SET_STYLE:
                    return decodeStyleRequest(data);
                case ReservedNames.SET_DRAG_REGIONS:
                    return decodeDragRegions(data);
                case ReservedNames.WINDOW_OP:
                    return decodeWindowOp(data);
                default:
                    throw new BridgeDecodeException("Unhandled reserved event: " + event);
            }
        }

        String payload;
        try {
            payload = (data == null) ? "null" : mapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new BridgeDecodeException("Unserializable event payload", e);
        }
        return new BridgeMessage.Event(event, payload);
    }

    private BridgeMessage.Call decodeCall(JsonNode node) {
        String id = requiredId(node);
        String name = requiredText(node, "name");

        List<ScriptValue> args = new ArrayList<>();
        JsonNode argsNode = node.get("args");
        if (argsNode != null && !argsNode.isNull()) {
            if (!argsNode.isArray()) {
                throw new BridgeDecodeException("Call args must be an array");
            }
            argsNode.forEach(a -> args.add(JsonScriptValues.fromNode(a)));
        }
        return new BridgeMessage.Call(id, name, args);
    }

    private BridgeMessage.CallResult decodeCallResult(JsonNode node) {
        String id = requiredId(node);
        JsonNode error = node.get("error");
        JsonNode value = node.get("value");

        boolean hasError = error != null && !error.isNull();
        boolean hasValue = value != null && !value.isNull();
        if (hasError && hasValue) {
            throw new BridgeDecodeException("Call result " + id + " carries both value and error");
        }
        if (hasError) {
            return new BridgeMessage.CallResult(id, new CallOutcome.Failure(error.asText()));
        }
        return new BridgeMessage.CallResult(id, new CallOutcome.Success(JsonScriptValues.fromNode(value)));
    }

    private BridgeMessage.StyleRequest decodeStyleRequest(JsonNode node) {
        JsonNode style = node.get("style");
        if (style == null || !style.isObject()) {
            throw new BridgeDecodeException("setStyle requires a style object");
        }
        JsonNode id = node.get("id");
        String ackId = (id == null || id.isNull()) ? null : idText(id);
        return new BridgeMessage.StyleRequest(StylePatch.of(style), ackId);
    }

    private BridgeMessage.DragRegionUpdate decodeDragRegions(JsonNode node) {
        JsonNode regions = node.get("regions");
        if (regions == null || !regions.isArray()) {
            throw new BridgeDecodeException("setDragRegions requires a regions array");
        }
        List<DragRegion> parsed;
        try {
            parsed = StyleJson.dragRegionsFromTree(regions);
        } catch (IllegalArgumentException e) {
            throw new BridgeDecodeException("Invalid drag regions", e);
        }
        return new BridgeMessage.DragRegionUpdate(parsed);
    }

    private BridgeMessage.WindowOp decodeWindowOp(JsonNode node) {
        String op = requiredText(node, "op");
        return new BridgeMessage.WindowOp(op, JsonScriptValues.fromNode(node.get("value")));
    }

    private BridgeMessage.Eval decodeEval(JsonNode node) {
        return new BridgeMessage.Eval(requiredId(node), requiredText(node, "script"));
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || !v.isTextual()) {
            throw new BridgeDecodeException("Missing or non-text field: " + field);
        }
        return v.textValue();
    }

    private static String requiredId(JsonNode node) {
        JsonNode v = node.get("id");
        if (v == null || v.isNull()) {
            throw new BridgeDecodeException("Missing field: id");
        }
        return idText(v);
    }

    private static String idText(JsonNode v) {
        if (v.isTextual()) {
            return v.textValue();
        }
        if (v.isIntegralNumber()) {
            return v.asText();
        }
        throw new BridgeDecodeException("Id must be text or an integer");
    }
}
