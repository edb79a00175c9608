package org.driptable.models.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import org.driptable.utils.JsonNodes;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pagination section of a table schema. In the document it is either {@code false} or an object.
 */
@Builder(toBuilder = true)
public record PaginationConfig(
        boolean enabled,
        Integer pageSize,
        String size,
        String position,
        Boolean showLessItems,
        Boolean showQuickJumper,
        Boolean showSizeChanger,
        Boolean hideOnSinglePage
) {

    public static final PaginationConfig DISABLED = PaginationConfig.builder().enabled(false).build();

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PaginationConfig fromJson(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue() ? PaginationConfig.builder().enabled(true).build() : DISABLED;
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("pagination must be an object or false");
        }
        return PaginationConfig.builder()
                .enabled(true)
                .pageSize(JsonNodes.intOrNull(node, "pagination", "pageSize"))
                .size(JsonNodes.textOrNull(node, "pagination", "size"))
                .position(JsonNodes.textOrNull(node, "pagination", "position"))
                .showLessItems(JsonNodes.boolOrNull(node, "pagination", "showLessItems"))
                .showQuickJumper(JsonNodes.boolOrNull(node, "pagination", "showQuickJumper"))
                .showSizeChanger(JsonNodes.boolOrNull(node, "pagination", "showSizeChanger"))
                .hideOnSinglePage(JsonNodes.boolOrNull(node, "pagination", "hideOnSinglePage"))
                .build();
    }

    @JsonValue
    public Object toJson() {
        if (!enabled) {
            return Boolean.FALSE;
        }
        Map<String, Object> json = new LinkedHashMap<>();
        putIfPresent(json, "pageSize", pageSize);
        putIfPresent(json, "size", size);
        putIfPresent(json, "position", position);
        putIfPresent(json, "showLessItems", showLessItems);
        putIfPresent(json, "showQuickJumper", showQuickJumper);
        putIfPresent(json, "showSizeChanger", showSizeChanger);
        putIfPresent(json, "hideOnSinglePage", hideOnSinglePage);
        return json;
    }

    private static void putIfPresent(Map<String, Object> json, String key, Object value) {
        if (value != null) {
            json.put(key, value);
        }
    }
}
