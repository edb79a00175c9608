package org.driptable.models.render;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Renderable unit produced by a driver: an element type, its properties and its children.
 * Text content is a node of type {@link #TEXT} carrying a {@code value} property.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record RenderNode(
        String type,
        Map<String, Object> props,
        List<RenderNode> children
) {

    public static final String TEXT = "#text";

    public RenderNode {
        Objects.requireNonNull(type, "type");
        props = props == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(props));
        children = children == null ? List.of() : children.stream().filter(Objects::nonNull).toList();
    }

    public static RenderNode text(Object value) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("value", value == null ? "" : String.valueOf(value));
        return new RenderNode(TEXT, props, List.of());
    }

    public static RenderNode element(String type, Map<String, Object> props, RenderNode... children) {
        return new RenderNode(type, props, Arrays.asList(children));
    }

    public static RenderNode element(String type, Map<String, Object> props, List<RenderNode> children) {
        return new RenderNode(type, props, children);
    }

    public Object prop(String name) {
        return props.get(name);
    }

    /**
     * Concatenated text of this node and its descendants, in document order.
     */
    public String textContent() {
        if (TEXT.equals(type)) {
            return String.valueOf(props.get("value"));
        }
        StringBuilder builder = new StringBuilder();
        for (RenderNode child : children) {
            builder.append(child.textContent());
        }
        return builder.toString();
    }

    public List<RenderNode> findAll(Predicate<RenderNode> predicate) {
        List<RenderNode> found = new ArrayList<>();
        collect(predicate, found);
        return found;
    }

    public List<RenderNode> findAll(String nodeType) {
        return findAll(node -> node.type.equals(nodeType));
    }

    private void collect(Predicate<RenderNode> predicate, List<RenderNode> found) {
        if (predicate.test(this)) {
            found.add(this);
        }
        for (RenderNode child : children) {
            child.collect(predicate, found);
        }
    }
}
