package org.driptable.adapters;

import org.driptable.models.render.RenderNode;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Rendering backend supplying the primitive widgets the engine composes. The engine never
 * looks inside the nodes a driver returns.
 */
public interface TableDriver {

    String name();

    RenderNode table(DriverTableProps props);

    RenderNode popover(String placement, RenderNode content, RenderNode trigger);

    RenderNode tooltip(RenderNode title, RenderNode child);

    RenderNode icon(String name);

    RenderNode alert(String message, String type);

    RenderNode richText(String html);

    RenderNode element(String type, Map<String, Object> props, List<RenderNode> children);

    default RenderNode element(String type, Map<String, Object> props, RenderNode... children) {
        return element(type, props, Arrays.asList(children));
    }
}
