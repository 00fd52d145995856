package com.questrail.bamboo.bridge.codec.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.bamboo.api.ScriptValue;
import com.questrail.bamboo.bridge.codec.BridgeMessageEncoder;
import com.questrail.bamboo.bridge.model.BridgeMessage;
import com.questrail.bamboo.bridge.model.CallOutcome;
import com.questrail.bamboo.style.StyleJson;

import java.util.Objects;

/**
 * Encodes {@link BridgeMessage} variants into the JSON wire form.
 *
 * <p>An {@link BridgeMessage.Event} payload must already be valid JSON text;
 * it is embedded as structured data, not as a string.</p>
 */
public final class JsonBridgeMessageEncoder implements BridgeMessageEncoder
{
    private final ObjectMapper mapper;

    public JsonBridgeMessageEncoder() {
        this(new ObjectMapper());
    }

    public JsonBridgeMessageEncoder(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public byte[] encode(BridgeMessage message) {
        Objects.requireNonNull(message, "message");
        try {
            return mapper.writeValueAsBytes(toTree(message));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + message.getClass().getSimpleName(), e);
        }
    }

    ObjectNode toTree(BridgeMessage message) {
        ObjectNode root = mapper.createObjectNode();

        if (message instanceof BridgeMessage.Event e) {
            root.put("type", "message");
            root.put("event", e.name());
            root.set("data", parsePayload(e.payload()));
        } else if (message instanceof BridgeMessage.Call c) {
            root.put("type", "call");
            root.put("id", c.id());
            root.put("name", c.name());
            ArrayNode args = root.putArray("args");
            for (ScriptValue a : c.args()) {
                args.add(JsonScriptValues.toNode(a));
            }
        } else if (message instanceof BridgeMessage.CallResult r) {
            root.put("type", "callResult");
            root.put("id", r.id());
            if (r.outcome() instanceof CallOutcome.Success s) {
                root.set("value", JsonScriptValues.toNode(s.value()));
            } else if (r.outcome() instanceof CallOutcome.Failure f) {
                root.put("error", f.message());
            }
        } else if (message instanceof BridgeMessage.StyleRequest s) {
            root.put("type", "setStyle");
            s.ack().ifPresent(id -> root.put("id", id));
            root.set("style", s.patch().toJson());
        } else if (message instanceof BridgeMessage.DragRegionUpdate d) {
            root.put("type", "setDragRegions");
            root.set("regions", StyleJson.dragRegionsToTree(d.regions()));
        } else if (message instanceof BridgeMessage.WindowOp w) {
            root.put("type", "windowOp");
            root.put("op", w.op());
            if (!w.value().isAbsent()) {
                root.set("value", JsonScriptValues.toNode(w.value()));
            }
        } else if (message instanceof BridgeMessage.Eval ev) {
            root.put("type", "eval");
            root.put("id", ev.id());
            root.put("script", ev.script());
        } else {
            throw new IllegalArgumentException("Unsupported message: " + message);
        }
        return root;
    }

    private JsonNode parsePayload(String payload) {
        try {
            return mapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Event payload is not valid JSON", e);
        }
    }
}
