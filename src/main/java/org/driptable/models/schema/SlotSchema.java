package org.driptable.models.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import org.driptable.utils.JsonNodes;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Header or footer section of a table schema: {@code true} for the built-in layout,
 * or an object with {@code style} and {@code elements}.
 */
public record SlotSchema(
        boolean enabled,
        Map<String, Object> style,
        List<SlotElement> elements
) {

    public static final SlotSchema DEFAULT_LAYOUT = new SlotSchema(true, null, null);
    public static final SlotSchema DISABLED = new SlotSchema(false, null, null);

    public boolean usesDefaultLayout() {
        return enabled && elements == null;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static SlotSchema fromJson(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue() ? DEFAULT_LAYOUT : DISABLED;
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("header/footer must be a boolean or an object");
        }
        List<SlotElement> elements = new ArrayList<>();
        JsonNode elementNodes = node.get("elements");
        if (elementNodes != null && elementNodes.isArray()) {
            for (JsonNode elementNode : elementNodes) {
                elements.add(JsonNodes.convert(elementNode, SlotElement.class));
            }
        }
        return new SlotSchema(true, JsonNodes.mapOrNull(node, "header/footer", "style"), List.copyOf(elements));
    }

    @JsonValue
    public Object toJson() {
        if (!enabled) {
            return Boolean.FALSE;
        }
        if (elements == null) {
            return Boolean.TRUE;
        }
        Map<String, Object> json = new LinkedHashMap<>();
        if (style != null) {
            json.put("style", style);
        }
        json.put("elements", elements);
        return json;
    }
}
