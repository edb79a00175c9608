package org.driptable.service.columns;

import lombok.extern.slf4j.Slf4j;
import org.driptable.models.schema.ColumnSchema;
import org.driptable.models.schema.TableSchema;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rewrites the deprecated {@code ui:type}/{@code ui:props} column form into
 * {@code component}/{@code options}. The deprecation warning is logged once per column key.
 */
@Slf4j
@Component
public class ColumnSchemaMigrator {

    private final Set<String> warnedKeys = ConcurrentHashMap.newKeySet();

    public TableSchema migrate(TableSchema schema) {
        if (schema == null || schema.columns() == null
                || schema.columns().stream().filter(Objects::nonNull).noneMatch(ColumnSchema::usesDeprecatedForm)) {
            return schema;
        }
        List<ColumnSchema> columns = schema.columns().stream()
                .map(column -> column == null ? null : migrate(column))
                .toList();
        return schema.toBuilder().columns(columns).build();
    }

    public ColumnSchema migrate(ColumnSchema column) {
        if (!column.usesDeprecatedForm()) {
            return column;
        }
        if (warnedKeys.add(String.valueOf(column.key()))) {
            log.warn("Column '{}' uses deprecated 'ui:type'/'ui:props', use 'component'/'options' instead",
                    column.key());
        }
        Map<String, Object> options = new LinkedHashMap<>();
        if (column.deprecatedProps() != null) {
            options.putAll(column.deprecatedProps());
        }
        if (column.options() != null) {
            options.putAll(column.options());
        }
        return column.toBuilder()
                .component(column.component() != null ? column.component() : column.deprecatedType())
                .options(options)
                .deprecatedType(null)
                .deprecatedProps(null)
                .build();
    }

    public Set<String> warnedColumnKeys() {
        return Collections.unmodifiableSet(warnedKeys);
    }
}
