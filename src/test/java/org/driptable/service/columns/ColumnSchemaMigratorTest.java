package org.driptable.service.columns;

import org.driptable.EngineFixtures;
import org.driptable.models.schema.ColumnSchema;
import org.driptable.models.schema.TableSchema;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(OutputCaptureExtension.class)
class ColumnSchemaMigratorTest {

    private final ColumnSchemaMigrator migrator = new ColumnSchemaMigrator();

    @Test
    void rewritesDeprecatedColumnForm() throws Exception {
        ColumnSchema column = EngineFixtures.MAPPER.readValue(
                "{\"key\":\"name\",\"ui:type\":\"text\",\"ui:props\":{\"fontSize\":\"12\"}}", ColumnSchema.class);

        ColumnSchema migrated = migrator.migrate(column);

        assertThat(migrated.component()).isEqualTo("text");
        assertThat(migrated.options()).isEqualTo(Map.of("fontSize", "12"));
        assertThat(migrated.deprecatedType()).isNull();
        assertThat(migrated.deprecatedProps()).isNull();
        assertThat(migrated.usesDeprecatedForm()).isFalse();
    }

    @Test
    void currentOptionsWinOverDeprecatedProps() {
        ColumnSchema column = ColumnSchema.builder()
                .key("name")
                .deprecatedType("text")
                .deprecatedProps(Map.of("fontSize", "12", "prefix", "#"))
                .options(Map.of("fontSize", "14"))
                .build();

        assertThat(migrator.migrate(column).options()).isEqualTo(Map.of("fontSize", "14", "prefix", "#"));
    }

    @Test
    void warnsOncePerColumnKey(CapturedOutput output) {
        TableSchema schema = TableSchema.builder()
                .columns(List.of(
                        ColumnSchema.builder().key("name").deprecatedType("text").build(),
                        ColumnSchema.builder().key("age").component("text").build()))
                .build();

        migrator.migrate(schema);
        migrator.migrate(schema);
        migrator.migrate(schema);

        assertThat(migrator.warnedColumnKeys()).containsExactly("name");
        assertThat(output.getOut().split("Column 'name' uses deprecated", -1)).hasSize(2);
    }

    @Test
    void leavesCurrentSchemasUntouched() {
        TableSchema schema = TableSchema.builder().columns(List.of(EngineFixtures.textColumn("name"))).build();

        assertThat(migrator.migrate(schema)).isSameAs(schema);
    }
}
