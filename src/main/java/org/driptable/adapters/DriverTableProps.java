package org.driptable.adapters;

import lombok.Builder;
import org.driptable.models.render.RenderNode;
import org.driptable.service.columns.ColumnDescriptor;

import java.util.List;
import java.util.Map;

/**
 * Everything a driver needs to draw one table body. A {@code null} pagination means the
 * table is not paginated; a {@code null} row selection means rows cannot be selected.
 */
@Builder(toBuilder = true)
public record DriverTableProps(
        String tableId,
        String rowKey,
        List<ColumnDescriptor> columns,
        List<Map<String, Object>> dataSource,
        PaginationDescriptor pagination,
        Boolean loading,
        String size,
        Boolean bordered,
        Boolean showHeader,
        Boolean sticky,
        ExpandableConfig expandable,
        RowSelectionConfig rowSelection,
        RenderNode title,
        RenderNode footer,
        ScrollConfig scroll,
        VirtualWindow virtualWindow
) {

    public record ScrollConfig(String x, Integer y) {
    }

    public record VirtualWindow(int offset, int limit) {
    }
}
