package org.driptable.service.state;

import org.driptable.models.schema.ColumnSchema;
import org.driptable.models.schema.PaginationConfig;
import org.driptable.service.table.TableDefaults;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Holds the UI state of one table instance. Updates are applied one at a time; readers always
 * see the result of the last applied merge.
 */
public class TableStateStore {

    private static final Object UNSET = new Object();

    private TableState state;
    private Object pageSizeSource = UNSET;
    private Object displayColumnsSource = UNSET;
    private Object selectedRowKeysSource = UNSET;
    private Object expandedRowKeysSource = UNSET;
    private Object currentPageSource = UNSET;

    public TableStateStore() {
        this(TableState.initial(TableDefaults.PAGE_SIZE));
    }

    public TableStateStore(TableState initial) {
        this.state = Objects.requireNonNull(initial, "initial");
    }

    public synchronized TableState getState() {
        return state;
    }

    public synchronized TableState setState(StateAction action) {
        state = state.merge(action.toPatch(state));
        return state;
    }

    public TableState setState(TableStatePatch patch) {
        return setState(StateAction.patch(patch));
    }

    /**
     * Re-derives the page size when the schema's configured page size differs from the one
     * seen last time. The current page is kept.
     */
    public synchronized TableState syncPageSize(PaginationConfig pagination) {
        Integer configured = pagination != null ? pagination.pageSize() : null;
        if (!Objects.equals(pageSizeSource, configured)) {
            pageSizeSource = configured;
            int pageSize = TableDefaults.pageSize(pagination);
            setState(StateAction.updater(current -> TableStatePatch.builder()
                    .pagination(new TableState.Pagination(current.pagination().current(), pageSize))
                    .build()));
        }
        return state;
    }

    /**
     * Re-derives the visible hidable columns when the host list changes. Without a host list the
     * visible set is every hidable column, recomputed when that set changes.
     */
    public synchronized TableState syncDisplayColumns(List<String> hostKeys, List<ColumnSchema> columns) {
        Set<String> source = hostKeys != null
                ? new LinkedHashSet<>(hostKeys)
                : hidableKeys(columns);
        Object marker = hostKeys != null ? List.of("host", source) : List.of("schema", source);
        if (!Objects.equals(displayColumnsSource, marker)) {
            displayColumnsSource = marker;
            setState(TableStatePatch.builder().displayColumnKeys(source).build());
        }
        return state;
    }

    /**
     * Adopts host supplied selected row keys when they differ from the ones adopted last time.
     * Without host keys the selection stays whatever the user made it.
     */
    public synchronized TableState syncSelectedRowKeys(List<Object> hostKeys) {
        if (hostKeys != null && !Objects.equals(selectedRowKeysSource, hostKeys)) {
            selectedRowKeysSource = new ArrayList<>(hostKeys);
            setState(TableStatePatch.builder().selectedRowKeys(new LinkedHashSet<>(hostKeys)).build());
        }
        return state;
    }

    public synchronized TableState syncExpandedRowKeys(List<Object> hostKeys) {
        if (hostKeys != null && !Objects.equals(expandedRowKeysSource, hostKeys)) {
            expandedRowKeysSource = new ArrayList<>(hostKeys);
            setState(TableStatePatch.builder().expandedRowKeys(new LinkedHashSet<>(hostKeys)).build());
        }
        return state;
    }

    public synchronized TableState syncCurrentPage(Integer hostPage) {
        if (hostPage != null && !Objects.equals(currentPageSource, hostPage)) {
            currentPageSource = hostPage;
            setState(StateAction.updater(current -> TableStatePatch.builder()
                    .pagination(new TableState.Pagination(
                            TableDefaults.currentPage(hostPage, current.pagination().current()),
                            current.pagination().pageSize()))
                    .build()));
        }
        return state;
    }

    private static Set<String> hidableKeys(Collection<ColumnSchema> columns) {
        if (columns == null) {
            return Set.of();
        }
        return columns.stream()
                .filter(Objects::nonNull)
                .filter(ColumnSchema::hidableColumn)
                .map(ColumnSchema::key)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
