package org.driptable.adapters;

import java.util.Collection;

public record RowSelectionConfig(Collection<Object> selectedRowKeys) {
}
