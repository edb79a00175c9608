package org.driptable.service.columns;

import org.driptable.EngineFixtures;
import org.driptable.adapters.JsonTreeDriver;
import org.driptable.models.render.RenderNode;
import org.driptable.models.schema.ColumnSchema;
import org.driptable.models.schema.TableSchema;
import org.driptable.service.components.ComponentResolver;
import org.driptable.service.components.TextRenderer;
import org.driptable.service.events.RecordingTableCallbacks;
import org.driptable.service.events.TableEventDispatcher;
import org.driptable.service.table.TableInformation;
import org.driptable.service.table.TableInformationTree;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ColumnGeneratorTest {

    private final ColumnGenerator generator = new ColumnGenerator();
    private final JsonTreeDriver driver = new JsonTreeDriver();
    private final RecordingTableCallbacks callbacks = new RecordingTableCallbacks();

    @Test
    void keepsNonHidableAndDisplayedHidableColumns() {
        List<ColumnSchema> columns = List.of(
                column("id", null),
                column("name", true),
                column("email", true),
                column("age", false));

        List<ColumnSchema> visible = ColumnGenerator.visibleColumns(columns, Set.of("email"));

        assertThat(visible).extracting(ColumnSchema::key).containsExactly("id", "email", "age");
        assertThat(ColumnGenerator.visibleColumns(columns, Set.of())).hasSize(2);
    }

    @Test
    void decoratesTitlesThatHaveADescription() {
        ColumnSchema column = EngineFixtures.textColumn("name").toBuilder().description("<b>Full</b> name").build();

        ColumnDescriptor descriptor = generator.generate(column, context(Map.of()));

        assertThat(descriptor.title().findAll("popover")).hasSize(1);
        assertThat(descriptor.title().findAll("rich-text").get(0).prop("html")).isEqualTo("<b>Full</b> name");
        assertThat(descriptor.title().textContent()).isEqualTo("NAME");
    }

    @Test
    void normalizesWidthAndFallsBackToColumnDefault() {
        ColumnSchema column = EngineFixtures.textColumn("name").toBuilder().width("120").defaultValue("-").build();

        ColumnDescriptor descriptor = generator.generate(column, context(Map.of()));
        RenderNode cell = descriptor.render().render(Map.of("key", 0), 0);

        assertThat(descriptor.width()).isEqualTo("120px");
        assertThat(cell.textContent()).isEqualTo("-");
    }

    @Test
    void rendersColumnErrorsInsteadOfCells() {
        ColumnSchema column = EngineFixtures.textColumn("name");

        RenderNode cell = generator.generate(column, context(Map.of("name", "options.mode is wrong")))
                .render().render(Map.of("name", "Ada"), 0);

        assertThat(cell.type()).isEqualTo("alert");
        assertThat(cell.textContent()).isEqualTo("options.mode is wrong");
    }

    private ColumnGenerationContext context(Map<String, String> columnErrors) {
        TableInformation table = new TableInformationTree().root(TableSchema.builder().id("people").build(), List.of());
        return ColumnGenerationContext.builder()
                .driver(driver)
                .resolver(new ComponentResolver(Map.of(TextRenderer.NAME, new TextRenderer(EngineFixtures.MAPPER)), Map.of()))
                .columnErrors(columnErrors)
                .table(table)
                .dataSource(List.of())
                .callbacks(callbacks)
                .dispatcher(new TableEventDispatcher(callbacks))
                .build();
    }

    private static ColumnSchema column(String key, Boolean hidable) {
        return EngineFixtures.textColumn(key).toBuilder().hidable(hidable).build();
    }
}
