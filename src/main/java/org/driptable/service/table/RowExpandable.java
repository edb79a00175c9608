package org.driptable.service.table;

import java.util.Map;

@FunctionalInterface
public interface RowExpandable {
    boolean test(Map<String, Object> record, TableInformation table);
}
