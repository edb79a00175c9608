package org.driptable.service.table;

import org.driptable.models.schema.PaginationConfig;
import org.driptable.models.schema.TableSchema;

import java.util.List;

/**
 * Default resolution for table level settings. Every method lists its sources in the order
 * they are consulted.
 */
public final class TableDefaults {

    public static final String ROW_KEY = "key";
    public static final int PAGE_SIZE = 10;
    public static final String PAGINATION_SIZE = "small";
    public static final String PAGINATION_POSITION = "bottomRight";
    public static final String SUBTABLE_SIZE = "middle";

    private TableDefaults() {
    }

    /** schema.rowKey, then {@value #ROW_KEY}. */
    public static String rowKeyField(TableSchema schema) {
        return schema != null && schema.rowKey() != null ? schema.rowKey() : ROW_KEY;
    }

    /** pagination.pageSize when positive, then {@value #PAGE_SIZE}. */
    public static int pageSize(PaginationConfig pagination) {
        return pagination != null && pagination.pageSize() != null && pagination.pageSize() > 0
                ? pagination.pageSize()
                : PAGE_SIZE;
    }

    /** pagination.size, then {@value #PAGINATION_SIZE}. */
    public static String paginationSize(PaginationConfig pagination) {
        return pagination != null && pagination.size() != null ? pagination.size() : PAGINATION_SIZE;
    }

    /** pagination.position, then {@value #PAGINATION_POSITION}. */
    public static String paginationPosition(PaginationConfig pagination) {
        return pagination != null && pagination.position() != null ? pagination.position() : PAGINATION_POSITION;
    }

    /** host supplied page when positive, then the page kept in UI state. */
    public static int currentPage(Integer hostPage, int statePage) {
        return hostPage != null && hostPage > 0 ? hostPage : statePage;
    }

    /** host supplied total, then the size of the dataset. */
    public static int total(Integer hostTotal, List<?> dataSource) {
        if (hostTotal != null) {
            return hostTotal;
        }
        return dataSource == null ? 0 : dataSource.size();
    }

    /** schema.size, then {@value #SUBTABLE_SIZE} for nested tables, then none. */
    public static String tableSize(TableSchema schema, boolean nested) {
        if (schema.size() != null) {
            return schema.size();
        }
        return nested ? SUBTABLE_SIZE : null;
    }

    /** schema.scrollY when positive, then the configured default. */
    public static int scrollY(TableSchema schema, int configuredDefault) {
        return schema.scrollY() != null && schema.scrollY() > 0 ? schema.scrollY() : configuredDefault;
    }

    /** projected cell value, then the column's defaultValue. */
    public static Object cellValue(Object projected, Object columnDefault) {
        return projected != null ? projected : columnDefault;
    }

    /** sticky is never applied to virtualized tables; otherwise schema.sticky. */
    public static Boolean sticky(TableSchema schema) {
        return schema.virtualized() ? Boolean.FALSE : schema.sticky();
    }
}
