package com.questrail.bamboo.bridge.codec.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.bamboo.api.ScriptValue;
import com.questrail.bamboo.bridge.model.BridgeMessage;
import com.questrail.bamboo.style.DragRegion;
import com.questrail.bamboo.style.StylePatch;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class JsonBridgeMessageEncoderTest
{
    private final ObjectMapper mapper = new ObjectMapper();
    private final JsonBridgeMessageEncoder encoder = new JsonBridgeMessageEncoder(mapper);

    private JsonNode encode(BridgeMessage message) throws Exception {
        return mapper.readTree(encoder.encode(message));
    }

    @Test
    void eventPayloadIsEmbeddedAsStructuredData() throws Exception {
        JsonNode n = encode(new BridgeMessage.Event("progress", "{\"pct\":40,\"tags\":[\"a\"]}"));

        assertEquals("message", n.get("type").asText());
        assertEquals("progress", n.get("event").asText());
        assertTrue(n.get("data").isObject());
        assertEquals(40, n.get("data").get("pct").asInt());
    }

    @Test
    void invalidEventPayloadIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> encoder.encode(new BridgeMessage.Event("x", "{nope")));
    }

    @Test
    void integralNumbersHaveNoFraction() {
        String text = new String(encoder.encode(BridgeMessage.CallResult.success("e", ScriptValue.of(2.0))));
        assertEquals("{\"type\":\"callResult\",\"id\":\"e\",\"value\":2}", text);
    }

    @Test
    void fractionalNumbersAreKept() throws Exception {
        JsonNode n = encode(BridgeMessage.CallResult.success("e", ScriptValue.of(1.25)));
        assertEquals(1.25, n.get("value").asDouble());
    }

    @Test
    void absentValueIsJsonNull() throws Exception {
        JsonNode n = encode(BridgeMessage.CallResult.success("e", ScriptValue.ABSENT));
        assertTrue(n.has("value"));
        assertTrue(n.get("value").isNull());
    }

    @Test
    void failureCarriesErrorOnly() throws Exception {
        JsonNode n = encode(BridgeMessage.CallResult.failure("e", "bad"));
        assertEquals("bad", n.get("error").asText());
        assertFalse(n.has("value"));
    }

    @Test
    void evalCarriesScript() throws Exception {
        JsonNode n = encode(new BridgeMessage.Eval("eval-1", "document.title"));
        assertEquals("eval", n.get("type").asText());
        assertEquals("eval-1", n.get("id").asText());
        assertEquals("document.title", n.get("script").asText());
    }

    @Test
    void callEncodesArgs() throws Exception {
        JsonNode n = encode(new BridgeMessage.Call("c", "f", List.of(ScriptValue.of("a"), ScriptValue.of(false))));
        assertEquals(2, n.get("args").size());
        assertEquals("a", n.get("args").get(0).asText());
        assertFalse(n.get("args").get(1).asBoolean());
    }

    @Test
    void styleAndDragRegionRequestsUseWireNames() throws Exception {
        JsonNode style = encode(new BridgeMessage.StyleRequest(StylePatch.parse("{\"cornerRadius\":4}"), null));
        JsonNode regions = encode(new BridgeMessage.DragRegionUpdate(List.of(DragRegion.hole(1, 2, 3, 4))));

        assertEquals("setStyle", style.get("type").asText());
        assertFalse(style.has("id"));
        assertEquals(4, style.get("style").get("cornerRadius").asInt());
        assertFalse(regions.get("regions").get(0).get("isDraggable").asBoolean());
    }

    @Test
    void windowOpOmitsAbsentValue() throws Exception {
        JsonNode n = encode(new BridgeMessage.WindowOp("minimize", ScriptValue.ABSENT));
        assertEquals("minimize", n.get("op").asText());
        assertFalse(n.has("value"));
    }
}
