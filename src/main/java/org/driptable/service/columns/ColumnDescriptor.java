package org.driptable.service.columns;

import lombok.Builder;
import org.driptable.models.render.RenderNode;
import org.driptable.models.schema.ColumnFilter;

import java.util.List;

/**
 * Column as handed to a driver: normalized sizing, decorated title and the cell render function.
 */
@Builder
public record ColumnDescriptor(
        String key,
        RenderNode title,
        List<String> dataIndex,
        String width,
        String align,
        String verticalAlign,
        Object fixed,
        List<ColumnFilter> filters,
        List<Object> defaultFilteredValue,
        Boolean ellipsis,
        CellRenderFunction render
) {
}
