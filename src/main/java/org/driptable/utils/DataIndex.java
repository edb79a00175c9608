package org.driptable.utils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Projection of a value out of a record by field path, and the reverse operation that writes
 * a value into a copy of the record. Neither operation modifies its input.
 */
public final class DataIndex {

    private DataIndex() {
    }

    public static Object get(Map<String, ?> record, List<String> path, Object defaultValue) {
        if (record == null || path == null || path.isEmpty()) {
            return defaultValue;
        }
        Object current = record;
        for (String segment : path) {
            if (segment == null || segment.isEmpty()) {
                return defaultValue;
            }
            current = step(current, segment);
            if (current == null) {
                return defaultValue;
            }
        }
        return current;
    }

    /**
     * Returns a copy of {@code record} with {@code value} stored at {@code path}. Maps along the
     * path are copied, everything else is shared with the original record.
     */
    public static Map<String, Object> set(Map<String, ?> record, List<String> path, Object value) {
        Map<String, Object> copy = record == null ? new LinkedHashMap<>() : new LinkedHashMap<>(record);
        if (path == null || path.isEmpty() || path.get(0) == null || path.get(0).isEmpty()) {
            return copy;
        }
        String head = path.get(0);
        if (path.size() == 1) {
            copy.put(head, value);
            return copy;
        }
        Object child = copy.get(head);
        copy.put(head, setInto(child, path.subList(1, path.size()), value));
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static Object setInto(Object container, List<String> path, Object value) {
        if (container instanceof List<?> list && isIndex(path.get(0))) {
            List<Object> copy = new ArrayList<>(list);
            int position = Integer.parseInt(path.get(0));
            while (copy.size() <= position) {
                copy.add(null);
            }
            copy.set(position, path.size() == 1 ? value : setInto(copy.get(position), path.subList(1, path.size()), value));
            return copy;
        }
        Map<String, Object> map = container instanceof Map<?, ?> existing ? (Map<String, Object>) existing : Map.of();
        return set(map, path, value);
    }

    private static Object step(Object current, String segment) {
        if (current instanceof Map<?, ?> map) {
            return map.get(segment);
        }
        if (current instanceof List<?> list && isIndex(segment)) {
            int position = Integer.parseInt(segment);
            return position < list.size() ? list.get(position) : null;
        }
        return null;
    }

    private static boolean isIndex(String segment) {
        return !segment.isEmpty() && segment.length() < 10 && segment.chars().allMatch(Character::isDigit);
    }
}
