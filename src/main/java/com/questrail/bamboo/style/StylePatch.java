package com.questrail.bamboo.style;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * StylePatch
 * =============================================================================
 * A partial set of {@link WindowStyle} fields, as sent by page script.
 *
 * <p>A patch never becomes a model on its own. {@link #applyTo(WindowStyle)}
 * merges it into the JSON form of a complete base model and maps the result
 * back, so the outcome is always fully populated and validated. Fields the
 * patch does not name keep their base value. Nested objects such as
 * {@code titlebar} and {@code shadow} merge field by field, while the
 * {@code dragRegions} array replaces the base list outright.</p>
 */
public final class StylePatch
{
    private static final StylePatch EMPTY = new StylePatch(JsonNodeFactory.instance.objectNode());

    private final ObjectNode fields;

    private StylePatch(ObjectNode fields) {
        this.fields = fields;
    }

    public static StylePatch empty() {
        return EMPTY;
    }

    /**
     * @throws IllegalArgumentException if {@code node} is not a JSON object
     */
    public static StylePatch of(JsonNode node) {
        Objects.requireNonNull(node, "node");
        if (!node.isObject()) {
            throw new IllegalArgumentException("style patch must be a JSON object, was " + node.getNodeType());
        }
        return new StylePatch(((ObjectNode) node).deepCopy());
    }

    public static StylePatch parse(String json) {
        return of(StyleJson.readTree(json));
    }

    /**
     * @return a copy of this patch with {@code field} set to {@code value}
     */
    public StylePatch with(String field, Object value) {
        Objects.requireNonNull(field, "field");
        ObjectNode copy = fields.deepCopy();
        copy.set(field, StyleJson.valueToTree(value));
        return new StylePatch(copy);
    }

    public WindowStyle applyTo(WindowStyle base) {
        Objects.requireNonNull(base, "base");
        if (fields.isEmpty()) {
            return base;
        }
        ObjectNode merged = StyleJson.toTree(base);
        StyleJson.deepMerge(merged, fields);
        return StyleJson.fromTree(merged);
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public Set<String> fieldNames() {
        Set<String> names = new LinkedHashSet<>();
        Iterator<String> it = fields.fieldNames();
        it.forEachRemaining(names::add);
        return names;
    }

    public ObjectNode toJson() {
        return fields.deepCopy();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StylePatch other && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "StylePatch" + fields;
    }
}
