package org.driptable.service.events;

import org.driptable.models.schema.TableSchema;
import org.driptable.service.table.TableInformation;
import org.driptable.service.table.TableInformationTree;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TableEventDispatcherTest {

    private final TableInformationTree tree = new TableInformationTree();
    private final TableInformation orders = tree.root(TableSchema.builder().id("orders").build(), List.of());
    private final TableInformation items = tree.child(orders, TableSchema.builder().id("items").build(), List.of(), 7);

    @Test
    void attachesTheRecordToTheDispatchOnly() {
        RecordingTableCallbacks recorder = new RecordingTableCallbacks();
        Map<String, Object> record = Map.of("sku", "x");

        new TableEventDispatcher(recorder).fireEvent(TableEvent.of("open"), record, 3, items);

        ObservedEvent event = recorder.events().get(0);
        assertThat(event.name()).isEqualTo("event");
        assertThat(event.tableId()).isEqualTo("items");
        assertThat(event.payload())
                .containsEntry("record", record)
                .containsEntry("index", 3)
                .containsEntry("parentTableId", "orders")
                .containsEntry("recordKeyPath", List.of(7));
        assertThat(items.record()).isEmpty();
    }

    @Test
    void dispatchingWithoutCallbacksIsANoOp() {
        new TableEventDispatcher(null).fireEvent(TableEvent.of("open"), Map.of(), 0, orders);
    }

    @Test
    void drainForgetsWhatWasReturned() {
        RecordingTableCallbacks recorder = new RecordingTableCallbacks();
        recorder.onSearch(new SearchParams("name", "ada"), orders);
        recorder.onInsertButtonClick(orders);

        assertThat(recorder.drain()).extracting(ObservedEvent::name).containsExactly("search", "insertButtonClick");
        assertThat(recorder.drain()).isEmpty();
        assertThat(recorder.events()).isEmpty();
    }
}
