package org.driptable.adapters;

import org.driptable.models.render.RenderNode;

import java.util.Collection;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Predicate;

public record ExpandableConfig(
        Predicate<Map<String, Object>> rowExpandable,
        BiFunction<Map<String, Object>, Integer, RenderNode> expandedRowRender,
        Collection<Object> expandedRowKeys
) {
}
