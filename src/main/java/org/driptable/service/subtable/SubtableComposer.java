package org.driptable.service.subtable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.driptable.configuration.DripTableProperties;
import org.driptable.models.render.RenderNode;
import org.driptable.models.schema.PaginationConfig;
import org.driptable.models.schema.TableSchema;
import org.driptable.service.events.TableCallbacks;
import org.driptable.service.table.TableDefaults;
import org.driptable.service.table.TableInformation;
import org.driptable.service.table.TableInstanceRegistry;
import org.driptable.service.table.TableProps;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the expanded content of a row: the nested table described by {@code schema.subtable}
 * over the rows held under its {@code dataSourceKey}, followed by any host expanded content.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SubtableComposer {

    private final SubtableOverrideResolver overrideResolver;
    private final DripTableProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * A record has children when the subtable's dataset key holds a non-empty list. Any other
     * value, including a malformed one, means no children.
     */
    public static boolean hasChildren(TableSchema schema, Map<String, Object> record) {
        if (schema == null || schema.subtable() == null || schema.subtable().dataSourceKey() == null || record == null) {
            return false;
        }
        return record.get(schema.subtable().dataSourceKey()) instanceof List<?> rows && !rows.isEmpty();
    }

    public boolean isExpandable(TableProps props, Map<String, Object> record, TableInformation table) {
        if (props.rowExpandable() != null && props.rowExpandable().test(record, table)) {
            return true;
        }
        return hasChildren(props.schema(), record);
    }

    public RenderNode expand(TableProps props, TableInformation table, Map<String, Object> record, int index,
                             TableCallbacks callbacks, NestedTableRenderer nested) {
        TableSchema schema = props.schema();
        Object rowKey = record.get(TableDefaults.rowKeyField(schema));
        List<RenderNode> content = new ArrayList<>();

        if (hasChildren(schema, record)) {
            int childDepth = table.depth() + 1;
            int maxDepth = properties.subtable().maxDepth();
            if (childDepth > maxDepth) {
                log.warn("Not rendering subtable of row {} in table '{}': nesting depth {} exceeds {}",
                        rowKey, table.tableId(), childDepth, maxDepth);
                content.add(props.driver().alert("Subtable nesting deeper than " + maxDepth + " levels is not rendered", "warning"));
            } else {
                TableProps child = childProps(props, record, index, rowKey);
                content.add(nested.render(child, table, rowKey, callbacks));
            }
        }
        if (props.expandedRowRender() != null) {
            content.add(props.expandedRowRender().render(record, index, table));
        }

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("rowKey", rowKey);
        return props.driver().element("expanded-row", attributes, content);
    }

    TableProps childProps(TableProps props, Map<String, Object> record, int index, Object rowKey) {
        TableSchema subtable = props.schema().subtable();
        Map<String, Object> overrides = overrideResolver.resolve(props.subtableOverridesOrEmpty(), subtable.id(), rowKey);
        return props.toBuilder()
                .instanceId(props.instanceId() == null ? null : TableInstanceRegistry.childId(props.instanceId(), rowKey))
                .schema(derive(subtable, overrides))
                .dataSource(rows(record.get(subtable.dataSourceKey())))
                .selectedRowKeys(null)
                .displayColumnKeys(null)
                .expandedRowKeys(null)
                .currentPage(null)
                .total(null)
                .subtableOverrides(overrideResolver.childRules(props.subtableOverridesOrEmpty(), rowKey))
                .title(props.subtableTitle() == null ? null : info -> props.subtableTitle().render(record, index, info))
                .footer(props.subtableFooter() == null ? null : info -> props.subtableFooter().render(record, index, info))
                .build();
    }

    /**
     * Subtable schema as rendered: without its dataset key, paginated only when it has more
     * than one page unless configured otherwise, then overridden.
     */
    TableSchema derive(TableSchema subtable, Map<String, Object> overrides) {
        TableSchema.TableSchemaBuilder builder = subtable.toBuilder().dataSourceKey(null);
        if (subtable.pagination() == null) {
            builder.pagination(PaginationConfig.builder().enabled(true).hideOnSinglePage(true).build());
        }
        TableSchema derived = builder.build();
        if (overrides.isEmpty()) {
            return derived;
        }
        ObjectNode tree = objectMapper.valueToTree(derived);
        overrides.forEach((field, value) -> tree.set(field, objectMapper.valueToTree(value)));
        try {
            return objectMapper.treeToValue(tree, TableSchema.class);
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            log.warn("Ignoring subtable overrides {} for table '{}': {}", overrides.keySet(), subtable.id(), ex.getMessage());
            return derived;
        }
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> rows(Object value) {
        List<Map<String, Object>> rows = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Map<?, ?> map) {
                    rows.add((Map<String, Object>) map);
                }
            }
        }
        return rows;
    }
}
