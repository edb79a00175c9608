package org.driptable.service.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.driptable.models.schema.ColumnSchema;
import org.driptable.models.schema.TableSchema;
import org.driptable.service.components.CellRenderer;
import org.driptable.service.components.ComponentResolver;
import org.driptable.service.table.TableProps;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Validates render inputs before anything is drawn. Required props are checked first; when they
 * are all present the schema document is checked against the table descriptor and every
 * column's options against the descriptor published by its component. Results of the
 * structural checks are memoized per (prop, value, options).
 */
@Slf4j
@Component
public class TablePropsValidator {

    static final String TABLE_SCHEMA_LOCATION = "schemas/drip-table.schema.json";

    private final ObjectMapper objectMapper;
    private final CapabilitySchemaChecker checker;
    private final Cache<ValidationKey, List<ValidationError>> cache;
    private final JsonNode tableDescriptor;

    public TablePropsValidator(ObjectMapper objectMapper, CapabilitySchemaChecker checker,
                               Cache<ValidationKey, List<ValidationError>> validationCache) {
        this.objectMapper = objectMapper;
        this.checker = checker;
        this.cache = validationCache;
        try (InputStream in = new ClassPathResource(TABLE_SCHEMA_LOCATION).getInputStream()) {
            this.tableDescriptor = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + TABLE_SCHEMA_LOCATION, e);
        }
    }

    public List<ValidationError> validate(TableProps props, ComponentResolver resolver, ValidationOptions options) {
        if (options != null && !options.enabled()) {
            return List.of();
        }
        ValidationOptions effective = options != null ? options : ValidationOptions.defaults();

        List<ValidationError> errors = new ArrayList<>(checkRequired(props));
        if (!errors.isEmpty()) {
            return errors;
        }

        JsonNode schemaTree = objectMapper.valueToTree(props.schema());
        errors.addAll(memoized(new ValidationKey("schema", tableDescriptor, schemaTree, effective),
                () -> toErrors(checker.check(tableDescriptor, schemaTree, "schema", effective.additionalProperties()), null)));

        for (ColumnSchema column : props.schema().columns()) {
            Optional<CellRenderer> renderer = resolver.resolve(column.component());
            JsonNode descriptor = renderer.map(CellRenderer::capabilitySchema).orElse(null);
            if (descriptor == null) {
                continue;
            }
            JsonNode optionsTree = objectMapper.valueToTree(column.optionsOrEmpty());
            String propKey = "columns." + column.key() + "::" + column.component();
            errors.addAll(memoized(new ValidationKey(propKey, descriptor, optionsTree, effective),
                    () -> toErrors(checker.check(descriptor, optionsTree, "options", effective.additionalProperties()), column.key())));
        }
        if (!errors.isEmpty()) {
            log.debug("Table '{}' failed validation: {}", props.schema().id(), ValidationError.join(errors));
        }
        return errors;
    }

    private List<ValidationError> checkRequired(TableProps props) {
        List<ValidationError> errors = new ArrayList<>();
        if (props.driver() == null) {
            errors.add(ValidationError.prop("driver is required"));
        }
        if (props.dataSource() == null) {
            errors.add(ValidationError.prop("dataSource must be array"));
        } else {
            List<Map<String, Object>> dataSource = props.dataSource();
            for (int i = 0; i < dataSource.size(); i++) {
                if (dataSource.get(i) == null) {
                    errors.add(ValidationError.prop("dataSource[" + i + "] must be object"));
                }
            }
        }
        TableSchema schema = props.schema();
        if (schema == null) {
            errors.add(ValidationError.prop("schema is required"));
            return errors;
        }
        if (schema.columns() == null) {
            errors.add(ValidationError.prop("schema must have required property 'columns'"));
            return errors;
        }
        Set<String> keys = new HashSet<>();
        for (int i = 0; i < schema.columns().size(); i++) {
            ColumnSchema column = schema.columns().get(i);
            String path = "schema.columns[" + i + "]";
            if (column == null) {
                errors.add(ValidationError.prop(path + " must be object"));
            } else if (!StringUtils.hasText(column.key())) {
                errors.add(ValidationError.prop(path + " must have required property 'key'"));
            } else if (!keys.add(column.key())) {
                errors.add(ValidationError.prop(path + ".key '" + column.key() + "' is not unique"));
            }
        }
        return errors;
    }

    private List<ValidationError> memoized(ValidationKey key, Supplier<List<ValidationError>> check) {
        return cache.get(key, ignored -> List.copyOf(check.get()));
    }

    private static List<ValidationError> toErrors(List<String> messages, String columnKey) {
        return messages.stream()
                .map(message -> columnKey == null
                        ? ValidationError.prop(message)
                        : ValidationError.column(columnKey, "Column '" + columnKey + "': " + message))
                .toList();
    }
}
