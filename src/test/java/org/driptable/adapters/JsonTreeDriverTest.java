package org.driptable.adapters;

import org.driptable.configuration.DripTableProperties;
import org.driptable.models.render.RenderNode;
import org.driptable.service.columns.ColumnDescriptor;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class JsonTreeDriverTest {

    private final JsonTreeDriver driver = new JsonTreeDriver();

    private final ColumnDescriptor nameColumn = ColumnDescriptor.builder()
            .key("name")
            .title(RenderNode.text("Name"))
            .width("120px")
            .render((record, index) -> RenderNode.text(index + ":" + record.get("name")))
            .build();

    @Test
    void slicesTheCurrentPageAndKeepsAbsoluteIndexes() {
        RenderNode table = driver.table(props(23)
                .pagination(page(3, 10, 23, false))
                .build());

        assertThat(table.findAll("td")).extracting(RenderNode::textContent)
                .containsExactly("20:row20", "21:row21", "22:row22");
        assertThat(table.findAll("pagination").get(0).prop("total")).isEqualTo(23);
    }

    @Test
    void pagesBeyondTheDatasetRenderNoRows() {
        RenderNode table = driver.table(props(30)
                .pagination(page(300_000_000, 10, 30, false))
                .build());

        assertThat(table.findAll("td")).isEmpty();
        assertThat(table.findAll("empty")).hasSize(1);
        assertThat(table.findAll("pagination").get(0).prop("current")).isEqualTo(300_000_000);
    }

    @Test
    void hidesPaginationForASinglePageWhenAsked() {
        assertThat(driver.table(props(5).pagination(page(1, 10, 5, true)).build()).findAll("pagination")).isEmpty();
        assertThat(driver.table(props(5).pagination(page(1, 10, 5, false)).build()).findAll("pagination")).hasSize(1);
        assertThat(driver.table(props(11).pagination(page(1, 10, 11, true)).build()).findAll("pagination")).hasSize(1);
    }

    @Test
    void rendersAnEmptyMarkerWithoutRows() {
        RenderNode table = driver.table(props(0).build());

        assertThat(table.findAll("tbody").get(0).children()).extracting(RenderNode::type).containsExactly("empty");
    }

    @Test
    void marksSelectedRows() {
        RenderNode table = driver.table(props(3).rowSelection(new RowSelectionConfig(Set.of(1))).build());

        assertThat(table.prop("rowSelection")).isEqualTo(true);
        assertThat(table.findAll("th-selection")).hasSize(1);
        assertThat(table.findAll("td-selection")).extracting(cell -> cell.prop("checked")).containsExactly(false, true, false);
    }

    @Test
    void decoratesHelpers() {
        RenderNode popover = driver.popover("top", driver.richText("<b>help</b>"), driver.icon("QuestionCircleOutlined"));

        assertThat(popover.prop("placement")).isEqualTo("top");
        assertThat(popover.findAll("rich-text").get(0).prop("html")).isEqualTo("<b>help</b>");
        assertThat(driver.alert("broken", "error").textContent()).isEqualTo("broken");
    }

    @Test
    void windowedAdapterRendersTheViewportPlusOverscan() {
        WindowedVirtualTableAdapter adapter = new WindowedVirtualTableAdapter(new DripTableProperties(
                DripTableProperties.defaults().validation(),
                DripTableProperties.defaults().subtable(),
                new DripTableProperties.Virtual(300, 50, 2),
                DripTableProperties.defaults().instances()));

        RenderNode virtual = adapter.render(driver, props(100)
                .scroll(new DriverTableProps.ScrollConfig(null, 200))
                .build());

        assertThat(virtual.type()).isEqualTo("virtual-table");
        assertThat(virtual.prop("windowSize")).isEqualTo(6);
        assertThat(virtual.prop("rowCount")).isEqualTo(100);
        assertThat(virtual.findAll("tr").stream().filter(row -> row.prop("rowKey") != null)).hasSize(6);
    }

    private DriverTableProps.DriverTablePropsBuilder props(int rowCount) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < rowCount; i++) {
            rows.add(Map.of("key", i, "name", "row" + i));
        }
        return DriverTableProps.builder()
                .tableId("people")
                .rowKey("key")
                .columns(List.of(nameColumn))
                .dataSource(rows);
    }

    private static PaginationDescriptor page(int current, int pageSize, int total, boolean hideOnSinglePage) {
        return PaginationDescriptor.builder()
                .current(current)
                .pageSize(pageSize)
                .total(total)
                .size("small")
                .position(List.of("bottomRight"))
                .hideOnSinglePage(hideOnSinglePage)
                .build();
    }
}
