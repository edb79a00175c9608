package org.driptable.service.table;

import lombok.Builder;
import org.driptable.adapters.TableDriver;
import org.driptable.models.schema.SubtableOverrideRule;
import org.driptable.models.schema.TableSchema;
import org.driptable.service.components.CellRenderer;
import org.driptable.service.validation.ValidationOptions;

import java.util.List;
import java.util.Map;

/**
 * Inputs of one render. Only {@code schema}, {@code driver} and {@code dataSource} are
 * required; every other field is optional host control.
 *
 * @param instanceId        identifies the table instance whose UI state survives between renders;
 *                          {@code null} renders with throw-away state
 * @param components        host component libraries addressed as {@code "library::name"}
 * @param subtableOverrides partial properties applied to expanded subtables
 * @param validation        {@code null} uses the configured defaults
 * @param title             content placed directly above the table body
 * @param footer            content placed directly below the table body
 */
@Builder(toBuilder = true)
public record TableProps(
        String instanceId,
        TableSchema schema,
        TableDriver driver,
        List<Map<String, Object>> dataSource,
        List<Object> selectedRowKeys,
        List<String> displayColumnKeys,
        List<Object> expandedRowKeys,
        Integer currentPage,
        Integer total,
        Boolean loading,
        Object ext,
        Map<String, Map<String, CellRenderer>> components,
        List<SubtableOverrideRule> subtableOverrides,
        ValidationOptions validation,
        RowExpandable rowExpandable,
        RowRenderer expandedRowRender,
        RowRenderer subtableTitle,
        RowRenderer subtableFooter,
        TableSlotRenderer title,
        TableSlotRenderer footer
) {

    public List<Map<String, Object>> dataSourceOrEmpty() {
        return dataSource != null ? dataSource : List.of();
    }

    public List<SubtableOverrideRule> subtableOverridesOrEmpty() {
        return subtableOverrides != null ? subtableOverrides : List.of();
    }
}
