package org.driptable.adapters;

import org.driptable.models.render.RenderNode;
import org.driptable.service.columns.ColumnDescriptor;
import org.driptable.service.table.RowKeys;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Driver producing a plain render tree that serializes to JSON. Tables are paginated on the
 * server when the dataset is larger than a page; row indexes passed to cell renderers are
 * positions in the full dataset.
 */
@Component
public class JsonTreeDriver implements TableDriver {

    public static final String NAME = "json-tree";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RenderNode table(DriverTableProps props) {
        List<Map<String, Object>> dataSource = props.dataSource() == null ? List.of() : props.dataSource();
        List<ColumnDescriptor> columns = props.columns() == null ? List.of() : props.columns();

        List<RenderNode> sections = new ArrayList<>();
        if (props.title() != null) {
            sections.add(element("table-title", Map.of(), props.title()));
        }
        if (!Boolean.FALSE.equals(props.showHeader())) {
            sections.add(header(props, columns));
        }
        sections.add(body(props, columns, dataSource));
        if (props.footer() != null) {
            sections.add(element("table-footer", Map.of(), props.footer()));
        }
        RenderNode pagination = pagination(props.pagination());
        if (pagination != null) {
            sections.add(pagination);
        }

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("tableId", props.tableId());
        attributes.put("rowKey", props.rowKey());
        attributes.put("size", props.size());
        attributes.put("bordered", props.bordered());
        attributes.put("sticky", props.sticky());
        attributes.put("loading", props.loading());
        attributes.put("rowSelection", props.rowSelection() != null);
        if (props.scroll() != null) {
            Map<String, Object> scroll = new LinkedHashMap<>();
            scroll.put("x", props.scroll().x());
            scroll.put("y", props.scroll().y());
            attributes.put("scroll", scroll);
        }
        return element("table", attributes, sections);
    }

    private RenderNode header(DriverTableProps props, List<ColumnDescriptor> columns) {
        List<RenderNode> cells = new ArrayList<>();
        if (props.rowSelection() != null) {
            cells.add(element("th-selection", Map.of()));
        }
        for (ColumnDescriptor column : columns) {
            Map<String, Object> attributes = columnAttributes(column);
            if (column.filters() != null) {
                attributes.put("filters", column.filters());
            }
            if (column.defaultFilteredValue() != null) {
                attributes.put("defaultFilteredValue", column.defaultFilteredValue());
            }
            cells.add(element("th", attributes, column.title()));
        }
        return element("thead", Map.of(), element("tr", Map.of(), cells));
    }

    private RenderNode body(DriverTableProps props, List<ColumnDescriptor> columns, List<Map<String, Object>> dataSource) {
        ExpandableConfig expandable = props.expandable();
        List<RenderNode> rows = new ArrayList<>();
        int[] range = visibleRange(props, dataSource.size());
        for (int index = range[0]; index < range[1]; index++) {
            Map<String, Object> record = dataSource.get(index);
            Object key = record.get(props.rowKey());
            boolean rowExpandable = expandable != null && expandable.rowExpandable().test(record);
            boolean expanded = rowExpandable && RowKeys.contains(expandable.expandedRowKeys(), key);

            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put("rowKey", key);
            attributes.put("index", index);
            if (rowExpandable) {
                attributes.put("expandable", true);
                attributes.put("expanded", expanded);
            }
            List<RenderNode> cells = new ArrayList<>();
            if (props.rowSelection() != null) {
                boolean selected = RowKeys.contains(props.rowSelection().selectedRowKeys(), key);
                attributes.put("selected", selected);
                cells.add(element("td-selection", Map.of("checked", selected)));
            }
            for (ColumnDescriptor column : columns) {
                cells.add(element("td", columnAttributes(column), column.render().render(record, index)));
            }
            rows.add(element("tr", attributes, cells));
            if (expanded) {
                Map<String, Object> expandedAttributes = new LinkedHashMap<>();
                expandedAttributes.put("rowKey", key);
                rows.add(element("tr-expanded", expandedAttributes, expandable.expandedRowRender().apply(record, index)));
            }
        }
        if (rows.isEmpty()) {
            rows.add(element("empty", Map.of()));
        }
        return element("tbody", Map.of(), rows);
    }

    private static int[] visibleRange(DriverTableProps props, int size) {
        int from = 0;
        int to = size;
        PaginationDescriptor pagination = props.pagination();
        if (pagination != null && pagination.pageSize() > 0 && size > pagination.pageSize()) {
            long offset = (long) (pagination.current() - 1) * pagination.pageSize();
            from = (int) Math.min(size, Math.max(0L, offset));
            to = (int) Math.min(size, (long) from + pagination.pageSize());
        }
        DriverTableProps.VirtualWindow window = props.virtualWindow();
        if (window != null) {
            from = Math.min(to, from + Math.max(0, window.offset()));
            to = Math.min(to, from + Math.max(0, window.limit()));
        }
        return new int[]{from, to};
    }

    private RenderNode pagination(PaginationDescriptor pagination) {
        if (pagination == null) {
            return null;
        }
        if (Boolean.TRUE.equals(pagination.hideOnSinglePage()) && pagination.total() <= pagination.pageSize()) {
            return null;
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("current", pagination.current());
        attributes.put("pageSize", pagination.pageSize());
        attributes.put("total", pagination.total());
        attributes.put("size", pagination.size());
        attributes.put("position", pagination.position());
        attributes.put("showLessItems", pagination.showLessItems());
        attributes.put("showQuickJumper", pagination.showQuickJumper());
        attributes.put("showSizeChanger", pagination.showSizeChanger());
        return element("pagination", attributes);
    }

    private static Map<String, Object> columnAttributes(ColumnDescriptor column) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("columnKey", column.key());
        attributes.put("width", column.width());
        attributes.put("align", column.align());
        attributes.put("verticalAlign", column.verticalAlign());
        attributes.put("fixed", column.fixed());
        attributes.put("ellipsis", column.ellipsis());
        return attributes;
    }

    @Override
    public RenderNode popover(String placement, RenderNode content, RenderNode trigger) {
        return element("popover", Map.of("placement", placement), element("popover-content", Map.of(), content), trigger);
    }

    @Override
    public RenderNode tooltip(RenderNode title, RenderNode child) {
        return element("tooltip", Map.of(), element("tooltip-title", Map.of(), title), child);
    }

    @Override
    public RenderNode icon(String name) {
        return element("icon", Map.of("name", name));
    }

    @Override
    public RenderNode alert(String message, String type) {
        return element("alert", Map.of("type", type, "showIcon", true), RenderNode.text(message));
    }

    @Override
    public RenderNode richText(String html) {
        return element("rich-text", Map.of("html", html == null ? "" : html));
    }

    @Override
    public RenderNode element(String type, Map<String, Object> props, List<RenderNode> children) {
        return RenderNode.element(type, props, children);
    }
}
