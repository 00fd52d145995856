package com.questrail.bamboo.bridge.codec.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.questrail.bamboo.api.ScriptValue;

/**
 * Mapping between JSON nodes and {@link ScriptValue}.
 */
final class JsonScriptValues
{
    private JsonScriptValues() {}

    static ScriptValue fromNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return ScriptValue.ABSENT;
        }
        if (node.isBoolean()) {
            return ScriptValue.of(node.booleanValue());
        }
        if (node.isNumber()) {
            return ScriptValue.of(node.doubleValue());
        }
        if (node.isTextual()) {
            return ScriptValue.of(node.textValue());
        }
        return ScriptValue.ABSENT;
    }

    static JsonNode toNode(ScriptValue value) {
        JsonNodeFactory f = JsonNodeFactory.instance;
        if (value instanceof ScriptValue.Bool b) {
            return f.booleanNode(b.value());
        }
        if (value instanceof ScriptValue.Num n) {
            double d = n.value();
            // Integral values go out without a fraction so "1+1" reads back as 2.
            if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 9.007199254740992E15) {
                return f.numberNode((long) d);
            }
            return f.numberNode(d);
        }
        if (value instanceof ScriptValue.Text t) {
            return f.textNode(t.value());
        }
        return f.nullNode();
    }
}
