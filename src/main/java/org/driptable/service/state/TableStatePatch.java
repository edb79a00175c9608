package org.driptable.service.state;

import lombok.Builder;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Partial {@link TableState}; a {@code null} field is left untouched by the merge.
 */
@Builder
public record TableStatePatch(
        TableState.Pagination pagination,
        Set<Object> selectedRowKeys,
        Set<String> displayColumnKeys,
        Map<String, List<Object>> filters,
        Set<Object> expandedRowKeys
) {
}
