package com.questrail.bamboo.style;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON mapping for the style model.
 *
 * <p>Field names are the record component names; enums use their
 * lowerCamelCase wire names. Unknown fields are ignored so that pages written
 * against a newer style vocabulary still apply what this runtime understands.
 * Mapping failures surface as {@link IllegalArgumentException}.</p>
 */
public final class StyleJson
{
    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .build();

    private static final TypeReference<List<DragRegion>> DRAG_REGIONS = new TypeReference<>() {};

    private StyleJson() {}

    public static ObjectNode toTree(WindowStyle style)
    {
        Objects.requireNonNull(style, "style");
        return MAPPER.valueToTree(style);
    }

    public static String toJson(WindowStyle style)
    {
        try {
            return MAPPER.writeValueAsString(Objects.requireNonNull(style, "style"));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("WindowStyle is not serializable", e);
        }
    }

    public static WindowStyle fromTree(JsonNode tree)
    {
        Objects.requireNonNull(tree, "tree");
        try {
            return MAPPER.treeToValue(tree, WindowStyle.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid window style: " + e.getMessage(), e);
        }
    }

    public static WindowStyle parse(String json)
    {
        return fromTree(readTree(json));
    }

    public static List<DragRegion> dragRegionsFromTree(JsonNode array)
    {
        Objects.requireNonNull(array, "array");
        if (!array.isArray()) {
            throw new IllegalArgumentException("drag regions must be an array");
        }
        try {
            return List.copyOf(MAPPER.convertValue(array, DRAG_REGIONS));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid drag regions: " + e.getMessage(), e);
        }
    }

    public static JsonNode dragRegionsToTree(List<DragRegion> regions)
    {
        return MAPPER.valueToTree(regions);
    }

    static JsonNode readTree(String json)
    {
        Objects.requireNonNull(json, "json");
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed style JSON: " + e.getOriginalMessage(), e);
        }
    }

    static JsonNode valueToTree(Object value)
    {
        return MAPPER.valueToTree(value);
    }

    /**
     * Merge {@code patch} into {@code target} in place. Nested objects merge
     * field by field; arrays and scalars replace the target value.
     */
    static void deepMerge(ObjectNode target, ObjectNode patch)
    {
        Iterator<Map.Entry<String, JsonNode>> it = patch.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode existing = target.get(e.getKey());
            JsonNode incoming = e.getValue();

            if (existing instanceof ObjectNode existingObject && incoming instanceof ObjectNode incomingObject) {
                deepMerge(existingObject, incomingObject);
            }
            else {
                target.set(e.getKey(), incoming.deepCopy());
            }
        }
    }
}
