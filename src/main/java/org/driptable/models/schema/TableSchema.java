package org.driptable.models.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * Declarative description of one table. A subtable is described by the same record, with
 * {@code dataSourceKey} naming the record field that holds the nested rows.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TableSchema(
        String id,
        List<ColumnSchema> columns,
        PaginationConfig pagination,
        String rowKey,
        String dataSourceKey,
        TableSchema subtable,
        SlotSchema header,
        SlotSchema footer,
        Boolean virtual,
        Integer scrollY,
        Boolean rowSelection,
        Boolean ellipsis,
        Boolean bordered,
        Boolean showHeader,
        Boolean sticky,
        String size,
        Map<String, Object> style,
        String className
) {

    public boolean virtualized() {
        return Boolean.TRUE.equals(virtual);
    }

    public boolean selectable() {
        return Boolean.TRUE.equals(rowSelection);
    }

    public boolean paginated() {
        return pagination == null || pagination.enabled();
    }

    public List<ColumnSchema> columnsOrEmpty() {
        return columns != null ? columns : List.of();
    }
}
