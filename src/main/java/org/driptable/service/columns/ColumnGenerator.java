package org.driptable.service.columns;

import lombok.extern.slf4j.Slf4j;
import org.driptable.adapters.TableDriver;
import org.driptable.models.render.RenderNode;
import org.driptable.models.schema.ColumnSchema;
import org.driptable.service.components.CellContext;
import org.driptable.service.components.CellRenderer;
import org.driptable.service.components.PlaceholderRenderer;
import org.driptable.service.table.TableDefaults;
import org.driptable.utils.DataIndex;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Slf4j
@Component
public class ColumnGenerator {

    /**
     * Columns to render: every non-hidable column, and hidable columns whose key is displayed.
     */
    public static List<ColumnSchema> visibleColumns(List<ColumnSchema> columns, Collection<String> displayColumnKeys) {
        return columns.stream()
                .filter(Objects::nonNull)
                .filter(column -> !column.hidableColumn()
                        || (displayColumnKeys != null && displayColumnKeys.contains(column.key())))
                .toList();
    }

    public List<ColumnDescriptor> generate(List<ColumnSchema> columns, ColumnGenerationContext context) {
        return columns.stream().map(column -> generate(column, context)).toList();
    }

    public ColumnDescriptor generate(ColumnSchema column, ColumnGenerationContext context) {
        return ColumnDescriptor.builder()
                .key(column.key())
                .title(title(column, context.driver()))
                .dataIndex(column.dataIndex())
                .width(WidthNormalizer.normalize(column.width()))
                .align(column.align())
                .verticalAlign(column.verticalAlign())
                .fixed(column.fixed())
                .filters(column.filters())
                .defaultFilteredValue(column.defaultFilteredValue())
                .ellipsis(context.ellipsis() ? Boolean.TRUE : null)
                .render(renderFunction(column, context))
                .build();
    }

    private RenderNode title(ColumnSchema column, TableDriver driver) {
        RenderNode plain = RenderNode.text(column.title());
        if (!StringUtils.hasText(column.description())) {
            return plain;
        }
        return driver.element("div", Map.of(),
                driver.element("span", Map.of("style", Map.of("marginRight", "6px")), plain),
                driver.popover("top", driver.richText(column.description()), driver.icon("QuestionCircleOutlined")));
    }

    private CellRenderFunction renderFunction(ColumnSchema column, ColumnGenerationContext context) {
        TableDriver driver = context.driver();
        String error = context.columnErrors() != null ? context.columnErrors().get(column.key()) : null;
        if (error != null) {
            return (record, index) -> driver.alert(error, "error");
        }
        CellRenderer renderer = context.resolver().resolve(column.component())
                .orElseGet(() -> {
                    log.warn("Column '{}' uses unknown component '{}'", column.key(), column.component());
                    return new PlaceholderRenderer(column.component());
                });
        return (record, index) -> {
            Object value = TableDefaults.cellValue(DataIndex.get(record, column.dataIndex(), null), column.defaultValue());
            CellContext cell = new CellContext(
                    driver,
                    value,
                    record,
                    index,
                    column,
                    context.ext(),
                    context.table(),
                    newValue -> changeValue(column, index, newValue, context),
                    event -> context.dispatcher().fireEvent(event, record, index, context.table())
            );
            try {
                return renderer.render(cell);
            } catch (RuntimeException ex) {
                log.warn("Component '{}' failed to render column '{}' row {}", column.component(), column.key(), index, ex);
                return driver.alert("Render error: " + ex.getMessage(), "error");
            }
        };
    }

    private void changeValue(ColumnSchema column, int index, Object newValue, ColumnGenerationContext context) {
        List<Map<String, Object>> source = context.dataSource();
        if (source == null || index < 0 || index >= source.size()) {
            log.warn("Ignoring change of column '{}' for row {} outside the dataset", column.key(), index);
            return;
        }
        List<Map<String, Object>> updated = new ArrayList<>(source);
        updated.set(index, DataIndex.set(source.get(index), column.dataIndex(), newValue));
        context.callbacks().onDataSourceChange(Collections.unmodifiableList(updated), context.table());
    }
}
