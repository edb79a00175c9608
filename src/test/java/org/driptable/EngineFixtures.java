package org.driptable;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.driptable.adapters.JsonTreeDriver;
import org.driptable.adapters.WindowedVirtualTableAdapter;
import org.driptable.configuration.DripTableProperties;
import org.driptable.models.schema.ColumnSchema;
import org.driptable.service.TableRenderService;
import org.driptable.service.columns.ColumnGenerator;
import org.driptable.service.columns.ColumnSchemaMigrator;
import org.driptable.service.components.ComponentRegistry;
import org.driptable.service.components.TextRenderer;
import org.driptable.service.slots.SlotRenderer;
import org.driptable.service.subtable.SubtableComposer;
import org.driptable.service.subtable.SubtableOverrideResolver;
import org.driptable.service.table.TableInstanceRegistry;
import org.driptable.service.validation.CapabilitySchemaChecker;
import org.driptable.service.validation.TablePropsValidator;
import org.driptable.service.validation.ValidationError;
import org.driptable.service.validation.ValidationKey;
import org.driptable.service.validation.ValidationOptions;

import java.util.List;
import java.util.Map;

/**
 * Engine wired by hand, without a Spring context.
 */
public final class EngineFixtures {

    public static final ObjectMapper MAPPER = new ObjectMapper();

    public final DripTableProperties properties;
    public final ColumnSchemaMigrator migrator = new ColumnSchemaMigrator();
    public final TextRenderer textRenderer = new TextRenderer(MAPPER);
    public final ComponentRegistry componentRegistry = new ComponentRegistry(List.of(textRenderer));
    public final Cache<ValidationKey, List<ValidationError>> validationCache = Caffeine.newBuilder().maximumSize(100).build();
    public final TablePropsValidator validator = new TablePropsValidator(MAPPER, new CapabilitySchemaChecker(), validationCache);
    public final TableInstanceRegistry instances;
    public final JsonTreeDriver driver = new JsonTreeDriver();
    public final TableRenderService renderService;

    public EngineFixtures() {
        this(DripTableProperties.defaults());
    }

    public EngineFixtures(DripTableProperties properties) {
        this.properties = properties;
        this.instances = new TableInstanceRegistry(properties);
        this.renderService = new TableRenderService(
                migrator,
                validator,
                componentRegistry,
                new ColumnGenerator(),
                new SlotRenderer(),
                new SubtableComposer(new SubtableOverrideResolver(), properties, MAPPER),
                new WindowedVirtualTableAdapter(properties),
                instances,
                properties,
                ValidationOptions.defaults()
        );
    }

    public static ColumnSchema textColumn(String key) {
        return ColumnSchema.builder()
                .key(key)
                .title(key.toUpperCase())
                .dataIndex(List.of(key))
                .component(TextRenderer.NAME)
                .build();
    }

    public static ColumnSchema textColumn(String key, Map<String, Object> options) {
        return textColumn(key).toBuilder().options(options).build();
    }
}
