package org.driptable.models.schema;

public record ColumnFilter(String text, Object value) {
}
