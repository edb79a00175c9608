package org.driptable.service;

import org.driptable.EngineFixtures;
import org.driptable.models.dto.DisplayColumnsRequest;
import org.driptable.models.dto.InteractionResponse;
import org.driptable.models.dto.RenderRequest;
import org.driptable.models.dto.RenderResponse;
import org.driptable.models.dto.RowRequest;
import org.driptable.models.dto.SearchRequest;
import org.driptable.models.dto.SelectionRequest;
import org.driptable.models.dto.TableChangeRequest;
import org.driptable.models.schema.TableSchema;
import org.driptable.service.events.ObservedEvent;
import org.driptable.service.state.TableState;
import org.driptable.service.validation.ValidationOptions;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class TableInteractionServiceTest {

    private final EngineFixtures engine = new EngineFixtures();
    private final TableInteractionService service = new TableInteractionService(
            engine.renderService, engine.instances, engine.driver, ValidationOptions.defaults());

    @Test
    void renderMountsTheInstance() {
        RenderResponse response = service.render(request("orders", schema(), rows(3)));

        assertThat(response.rendered()).isTrue();
        assertThat(response.errors()).isEmpty();
        assertThat(response.state().pagination()).isEqualTo(new TableState.Pagination(1, 10));
        assertThat(response.events()).extracting(ObservedEvent::name).containsExactly("mount");
        assertThat(service.render(request("orders", schema(), rows(3))).events())
                .extracting(ObservedEvent::name).containsExactly("update");
    }

    @Test
    void renderWithoutAnIdMountsAFreshInstance() {
        RenderResponse response = service.render(request(null, schema(), rows(1)));

        assertThat(response.instanceId()).isNotBlank();
        assertThat(engine.instances.find(response.instanceId())).isPresent();
    }

    @Test
    void invalidRequestsRenderTheErrorsWithoutMounting() {
        RenderResponse response = service.render(request("broken", null, rows(1)));

        assertThat(response.rendered()).isFalse();
        assertThat(response.tree().textContent()).isEqualTo("schema is required");
        assertThat(response.events()).isEmpty();
        assertThatThrownBy(() -> service.insert("broken"))
                .isInstanceOfSatisfying(ResponseStatusException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT));
    }

    @Test
    void pageChangeIsKeptAcrossTheReRender() {
        service.render(request("orders", schema(), rows(25)));

        InteractionResponse response = service.change("orders", new TableChangeRequest(2, null, null));

        assertThat(response.state().pagination()).isEqualTo(new TableState.Pagination(2, 10));
        assertThat(response.events()).extracting(ObservedEvent::name)
                .containsExactly("filterChange", "pageChange", "change", "update");
        assertThat(response.tree().findAll("td").get(0).textContent()).isEqualTo("row10");
    }

    @Test
    void displayColumnsAndSearchAreReported() {
        TableSchema schema = schema().toBuilder()
                .columns(List.of(EngineFixtures.textColumn("name"),
                        EngineFixtures.textColumn("note").toBuilder().hidable(true).build()))
                .build();
        service.render(request("orders", schema, rows(2)));

        InteractionResponse hidden = service.displayColumns("orders", new DisplayColumnsRequest(List.of()));
        InteractionResponse searched = service.search("orders", new SearchRequest("name", "row1"));

        assertThat(hidden.state().displayColumnKeys()).isEmpty();
        assertThat(hidden.tree().findAll("th")).extracting(th -> th.prop("columnKey")).containsExactly("name");
        assertThat(searched.events().get(0).payload()).containsEntry("searchKey", "name").containsEntry("searchStr", "row1");
    }

    @Test
    void selectionOnATableWithoutSelectionIsAConflict() {
        service.render(request("orders", schema(), rows(2)));

        assertThatThrownBy(() -> service.select("orders", new SelectionRequest(List.of(0))))
                .isInstanceOfSatisfying(ResponseStatusException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT));
    }

    @Test
    void unknownRowsAreBadRequests() {
        service.render(request("orders", schema(), rows(2)));

        assertThatThrownBy(() -> service.rowClick("orders", new RowRequest(99, null), false))
                .isInstanceOfSatisfying(ResponseStatusException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST));
    }

    @Test
    void unknownInstancesAreNotFound() {
        assertThatThrownBy(() -> service.state("missing"))
                .isInstanceOfSatisfying(ResponseStatusException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND));
    }

    @Test
    void nestedInstancesReportThroughTheOutermostTable() {
        TableSchema schema = schema().toBuilder()
                .rowKey("id")
                .subtable(TableSchema.builder()
                        .id("items")
                        .dataSourceKey("items")
                        .columns(List.of(EngineFixtures.textColumn("sku")))
                        .build())
                .build();
        List<Map<String, Object>> rows = List.of(
                Map.of("id", 5, "name", "a", "items", List.of(Map.of("sku", "x"))));
        service.render(request("t", schema, rows));

        InteractionResponse expanded = service.expand("t", new RowRequest(5, true));
        assertThat(expanded.events()).extracting(ObservedEvent::name, ObservedEvent::tableId)
                .containsExactly(
                        tuple("mount", "items"),
                        tuple("update", "orders"));
        assertThat(expanded.tree().findAll("tr-expanded")).hasSize(1);

        InteractionResponse clicked = service.rowClick("t.5", new RowRequest(0, null), false);
        assertThat(clicked.instanceId()).isEqualTo("t.5");
        assertThat(clicked.events().get(0).name()).isEqualTo("rowClick");
        assertThat(clicked.events().get(0).payload()).containsEntry("recordKeyPath", List.of(5));

        List<ObservedEvent> released = service.release("t");
        assertThat(released).extracting(ObservedEvent::tableId).containsExactlyInAnyOrder("orders", "items");
        assertThat(engine.instances.find("t.5")).isEmpty();
    }

    private static RenderRequest request(String instanceId, TableSchema schema, List<Map<String, Object>> dataSource) {
        return new RenderRequest(instanceId, schema, dataSource, null, null, null, null, null, null, null, null, null);
    }

    private static TableSchema schema() {
        return TableSchema.builder().id("orders").columns(List.of(EngineFixtures.textColumn("name"))).build();
    }

    private static List<Map<String, Object>> rows(int count) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            rows.add(Map.of("name", "row" + i));
        }
        return rows;
    }
}
