package org.driptable.service.table;

import lombok.extern.slf4j.Slf4j;
import org.driptable.models.render.RenderNode;
import org.driptable.service.events.SearchParams;
import org.driptable.service.events.TableCallbacks;
import org.driptable.service.state.StateAction;
import org.driptable.service.state.TableState;
import org.driptable.service.state.TableStatePatch;
import org.driptable.service.state.TableStateStore;
import org.driptable.service.validation.ValidationError;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Outcome of one render together with the handlers a host calls when the user interacts with
 * the rendered table. Handlers update the instance state first and notify the callbacks
 * afterwards; the host renders again to see the new state.
 */
@Slf4j
public class RenderedTable {

    private final String instanceId;
    private final RenderNode node;
    private final List<ValidationError> errors;
    private final TableInformation table;
    private final TableStateStore store;
    private final TableCallbacks callbacks;
    private final List<Map<String, Object>> rows;
    private final String rowKey;
    private final boolean selectionEnabled;
    private final Predicate<Map<String, Object>> rowExpandable;

    public RenderedTable(String instanceId, RenderNode node, List<ValidationError> errors, TableInformation table,
                  TableStateStore store, TableCallbacks callbacks, List<Map<String, Object>> rows, String rowKey,
                  boolean selectionEnabled, Predicate<Map<String, Object>> rowExpandable) {
        this.instanceId = instanceId;
        this.node = node;
        this.errors = List.copyOf(errors);
        this.table = table;
        this.store = store;
        this.callbacks = callbacks;
        this.rows = rows;
        this.rowKey = rowKey;
        this.selectionEnabled = selectionEnabled;
        this.rowExpandable = rowExpandable;
    }

    public static RenderedTable failed(String instanceId, RenderNode node, List<ValidationError> errors,
                                TableStateStore store, TableCallbacks callbacks) {
        return new RenderedTable(instanceId, node, errors, null, store, callbacks, List.of(), TableDefaults.ROW_KEY,
                false, record -> false);
    }

    public String instanceId() {
        return instanceId;
    }

    public RenderNode node() {
        return node;
    }

    public List<ValidationError> errors() {
        return errors;
    }

    /**
     * {@code null} when the table failed validation and only an error surface was rendered.
     */
    public TableInformation table() {
        return table;
    }

    public boolean failed() {
        return table == null;
    }

    public TableState state() {
        return store.getState();
    }

    TableCallbacks callbacks() {
        return callbacks;
    }

    /**
     * Pagination or filter change. Callbacks fire in a fixed order: filter change, page change,
     * then the combined change.
     */
    public TableState onChange(TableState.Pagination pagination, Map<String, List<Object>> filters) {
        requireRendered();
        TableState current = store.setState(StateAction.updater(state -> TableStatePatch.builder()
                .pagination(pagination != null ? pagination : state.pagination())
                .filters(filters != null ? filters : state.filters())
                .build()));
        log.debug("Table '{}' moved to page {} with filters {}", table.tableId(), current.pagination().current(),
                current.filters().keySet());
        callbacks.onFilterChange(current.filters(), table);
        callbacks.onPageChange(current.pagination().current(), current.pagination().pageSize(), table);
        callbacks.onChange(current.pagination(), current.filters(), table);
        return current;
    }

    public TableState onSelectionChange(List<Object> selectedKeys) {
        requireRendered();
        if (!selectionEnabled) {
            throw new IllegalStateException("Row selection is not enabled for table '" + table.tableId() + "'");
        }
        List<Object> keys = selectedKeys != null ? selectedKeys : List.of();
        TableState current = store.setState(TableStatePatch.builder()
                .selectedRowKeys(new LinkedHashSet<>(keys))
                .build());
        List<Map<String, Object>> selectedRows = rows.stream()
                .filter(row -> RowKeys.contains(keys, row.get(rowKey)))
                .toList();
        callbacks.onSelectionChange(List.copyOf(keys), selectedRows, table);
        return current;
    }

    public TableState onDisplayColumnKeysChange(List<String> displayColumnKeys) {
        requireRendered();
        List<String> keys = displayColumnKeys != null ? displayColumnKeys : List.of();
        TableState current = store.setState(TableStatePatch.builder()
                .displayColumnKeys(new LinkedHashSet<>(keys))
                .build());
        callbacks.onDisplayColumnKeysChange(List.copyOf(keys), table);
        return current;
    }

    public void onSearch(SearchParams params) {
        requireRendered();
        callbacks.onSearch(params, table);
    }

    public void onInsertButtonClick() {
        requireRendered();
        callbacks.onInsertButtonClick(table);
    }

    public void onRowClick(Object key) {
        int index = indexOf(key);
        callbacks.onRowClick(rows.get(index), index, table);
    }

    public void onRowDoubleClick(Object key) {
        int index = indexOf(key);
        callbacks.onRowDoubleClick(rows.get(index), index, table);
    }

    public TableState expandRow(Object key, boolean expanded) {
        int index = indexOf(key);
        if (expanded && !rowExpandable.test(rows.get(index))) {
            throw new IllegalStateException("Row '" + key + "' of table '" + table.tableId() + "' cannot be expanded");
        }
        return store.setState(StateAction.updater(state -> {
            Set<Object> keys = new LinkedHashSet<>();
            for (Object existing : state.expandedRowKeys()) {
                if (!RowKeys.sameKey(existing, key)) {
                    keys.add(existing);
                }
            }
            if (expanded) {
                keys.add(rows.get(index).get(rowKey));
            }
            return TableStatePatch.builder().expandedRowKeys(keys).build();
        }));
    }

    private int indexOf(Object key) {
        requireRendered();
        for (int index = 0; index < rows.size(); index++) {
            if (RowKeys.sameKey(rows.get(index).get(rowKey), key)) {
                return index;
            }
        }
        throw new IllegalArgumentException("Table '" + table.tableId() + "' has no row with key '" + key + "'");
    }

    private void requireRendered() {
        if (table == null) {
            throw new IllegalStateException("Table did not render: " + ValidationError.join(errors));
        }
    }
}
