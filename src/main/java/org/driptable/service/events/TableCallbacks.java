package org.driptable.service.events;

import org.driptable.service.state.TableState;
import org.driptable.service.table.TableInformation;

import java.util.List;
import java.util.Map;

/**
 * Outward notifications of a table. Every method receives the table it concerns as its last
 * argument; all methods are invoked synchronously and default to doing nothing.
 */
public interface TableCallbacks {

    TableCallbacks NONE = new TableCallbacks() {
    };

    default void onMount(TableInformation table) {
    }

    default void onUpdate(TableInformation table) {
    }

    default void onUnmount(TableInformation table) {
    }

    default void onRowClick(Map<String, Object> record, int index, TableInformation table) {
    }

    default void onRowDoubleClick(Map<String, Object> record, int index, TableInformation table) {
    }

    default void onSelectionChange(List<Object> selectedKeys, List<Map<String, Object>> selectedRows,
                                   TableInformation table) {
    }

    default void onSearch(SearchParams params, TableInformation table) {
    }

    default void onInsertButtonClick(TableInformation table) {
    }

    default void onFilterChange(Map<String, List<Object>> filters, TableInformation table) {
    }

    default void onPageChange(int currentPage, int pageSize, TableInformation table) {
    }

    default void onChange(TableState.Pagination pagination, Map<String, List<Object>> filters,
                          TableInformation table) {
    }

    default void onDisplayColumnKeysChange(List<String> displayColumnKeys, TableInformation table) {
    }

    default void onEvent(TableEvent event, Map<String, Object> record, int index, TableInformation table) {
    }

    default void onDataSourceChange(List<Map<String, Object>> dataSource, TableInformation table) {
    }
}
