package org.driptable.service.state;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Transient UI state of one table instance.
 */
public record TableState(
        Pagination pagination,
        Set<Object> selectedRowKeys,
        Set<String> displayColumnKeys,
        Map<String, List<Object>> filters,
        Set<Object> expandedRowKeys
) {

    public record Pagination(int current, int pageSize) {
    }

    public TableState {
        selectedRowKeys = frozenSet(selectedRowKeys);
        displayColumnKeys = frozenSet(displayColumnKeys);
        expandedRowKeys = frozenSet(expandedRowKeys);
        filters = filters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(filters));
    }

    public static TableState initial(int pageSize) {
        return new TableState(new Pagination(1, pageSize), Set.of(), Set.of(), Map.of(), Set.of());
    }

    /**
     * Shallow merge: every field present in the patch replaces the current field as a whole.
     */
    public TableState merge(TableStatePatch patch) {
        if (patch == null) {
            return this;
        }
        return new TableState(
                patch.pagination() != null ? patch.pagination() : pagination,
                patch.selectedRowKeys() != null ? patch.selectedRowKeys() : selectedRowKeys,
                patch.displayColumnKeys() != null ? patch.displayColumnKeys() : displayColumnKeys,
                patch.filters() != null ? patch.filters() : filters,
                patch.expandedRowKeys() != null ? patch.expandedRowKeys() : expandedRowKeys
        );
    }

    private static <T> Set<T> frozenSet(Collection<T> values) {
        return values == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }
}
