package org.driptable.service.table;

import org.driptable.models.schema.TableSchema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Owns every {@link TableInformation} built during one render pass. Children point back at
 * their parent by index only.
 */
public final class TableInformationTree {

    private final List<TableInformation> nodes = new ArrayList<>();

    public TableInformation root(TableSchema schema, List<Map<String, Object>> dataSource) {
        return register(null, schema, dataSource, List.of());
    }

    public TableInformation child(TableInformation parent, TableSchema schema,
                                  List<Map<String, Object>> dataSource, Object parentRowKey) {
        if (parent.tree() != this) {
            throw new IllegalArgumentException("Parent table belongs to another render pass");
        }
        List<Object> keyPath = new ArrayList<>(parent.recordKeyPath());
        keyPath.add(parentRowKey);
        return register(parent.index(), schema, dataSource, keyPath);
    }

    TableInformation get(int index) {
        return nodes.get(index);
    }

    public List<TableInformation> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    private synchronized TableInformation register(Integer parentIndex, TableSchema schema,
                                                   List<Map<String, Object>> dataSource, List<Object> keyPath) {
        TableInformation information = new TableInformation(this, nodes.size(), parentIndex, schema,
                dataSource == null ? List.of() : Collections.unmodifiableList(dataSource),
                Collections.unmodifiableList(keyPath), null);
        nodes.add(information);
        return information;
    }
}
