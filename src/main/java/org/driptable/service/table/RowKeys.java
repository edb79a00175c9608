package org.driptable.service.table;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Row key handling. Keys are compared by their string form so that {@code 5} and {@code "5"}
 * coming from different JSON sources address the same row.
 */
public final class RowKeys {

    private RowKeys() {
    }

    /**
     * Copies every record, storing its position as the row key when the record has none.
     */
    public static List<Map<String, Object>> assign(List<Map<String, Object>> dataSource, String rowKey) {
        List<Map<String, Object>> keyed = new ArrayList<>(dataSource.size());
        for (int index = 0; index < dataSource.size(); index++) {
            Map<String, Object> record = dataSource.get(index);
            Map<String, Object> copy = record == null ? new LinkedHashMap<>() : new LinkedHashMap<>(record);
            if (copy.get(rowKey) == null) {
                copy.put(rowKey, index);
            }
            keyed.add(copy);
        }
        return keyed;
    }

    public static boolean sameKey(Object left, Object right) {
        if (left == null || right == null) {
            return left == right;
        }
        return Objects.equals(String.valueOf(left), String.valueOf(right));
    }

    public static boolean contains(Collection<?> keys, Object key) {
        if (keys == null) {
            return false;
        }
        for (Object candidate : keys) {
            if (sameKey(candidate, key)) {
                return true;
            }
        }
        return false;
    }
}
