package org.driptable.service.events;

import org.driptable.service.state.TableState;
import org.driptable.service.table.TableInformation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects every notification as an {@link ObservedEvent}, in the order it was raised.
 * Used where the host is a remote client that reads the notifications afterwards.
 */
public class RecordingTableCallbacks implements TableCallbacks {

    private final List<ObservedEvent> events = Collections.synchronizedList(new ArrayList<>());

    public List<ObservedEvent> events() {
        synchronized (events) {
            return List.copyOf(events);
        }
    }

    /**
     * Returns the events collected so far and forgets them.
     */
    public List<ObservedEvent> drain() {
        synchronized (events) {
            List<ObservedEvent> drained = List.copyOf(events);
            events.clear();
            return drained;
        }
    }

    @Override
    public void onMount(TableInformation table) {
        observe("mount", table, Map.of());
    }

    @Override
    public void onUpdate(TableInformation table) {
        observe("update", table, Map.of());
    }

    @Override
    public void onUnmount(TableInformation table) {
        observe("unmount", table, Map.of());
    }

    @Override
    public void onRowClick(Map<String, Object> record, int index, TableInformation table) {
        observe("rowClick", table, payload("record", record, "index", index));
    }

    @Override
    public void onRowDoubleClick(Map<String, Object> record, int index, TableInformation table) {
        observe("rowDoubleClick", table, payload("record", record, "index", index));
    }

    @Override
    public void onSelectionChange(List<Object> selectedKeys, List<Map<String, Object>> selectedRows,
                                  TableInformation table) {
        observe("selectionChange", table, payload("selectedRowKeys", selectedKeys, "selectedRows", selectedRows));
    }

    @Override
    public void onSearch(SearchParams params, TableInformation table) {
        observe("search", table, payload("searchKey", params.searchKey(), "searchStr", params.searchStr()));
    }

    @Override
    public void onInsertButtonClick(TableInformation table) {
        observe("insertButtonClick", table, Map.of());
    }

    @Override
    public void onFilterChange(Map<String, List<Object>> filters, TableInformation table) {
        observe("filterChange", table, payload("filters", filters));
    }

    @Override
    public void onPageChange(int currentPage, int pageSize, TableInformation table) {
        observe("pageChange", table, payload("currentPage", currentPage, "pageSize", pageSize));
    }

    @Override
    public void onChange(TableState.Pagination pagination, Map<String, List<Object>> filters, TableInformation table) {
        observe("change", table, payload("pagination", pagination, "filters", filters));
    }

    @Override
    public void onDisplayColumnKeysChange(List<String> displayColumnKeys, TableInformation table) {
        observe("displayColumnKeysChange", table, payload("displayColumnKeys", displayColumnKeys));
    }

    @Override
    public void onEvent(TableEvent event, Map<String, Object> record, int index, TableInformation table) {
        observe("event", table, payload("event", event, "record", record, "index", index));
    }

    @Override
    public void onDataSourceChange(List<Map<String, Object>> dataSource, TableInformation table) {
        observe("dataSourceChange", table, payload("dataSource", dataSource));
    }

    private void observe(String name, TableInformation table, Map<String, Object> payload) {
        Map<String, Object> enriched = new LinkedHashMap<>(payload);
        table.parent().ifPresent(parent -> enriched.put("parentTableId", parent.tableId()));
        if (!table.recordKeyPath().isEmpty()) {
            enriched.put("recordKeyPath", table.recordKeyPath());
        }
        events.add(new ObservedEvent(name, table.tableId(), enriched));
    }

    private static Map<String, Object> payload(Object... keyValues) {
        Map<String, Object> payload = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            payload.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return payload;
    }
}
