package org.driptable.service.table;

import org.driptable.models.schema.TableSchema;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of one rendered table: its schema, its rows and the table it is nested in.
 * {@code record} is only set on the copy handed to an event callback.
 */
public final class TableInformation {

    private final TableInformationTree tree;
    private final int index;
    private final Integer parentIndex;
    private final TableSchema schema;
    private final List<Map<String, Object>> dataSource;
    private final List<Object> recordKeyPath;
    private final Map<String, Object> record;

    TableInformation(TableInformationTree tree, int index, Integer parentIndex, TableSchema schema,
                     List<Map<String, Object>> dataSource, List<Object> recordKeyPath, Map<String, Object> record) {
        this.tree = tree;
        this.index = index;
        this.parentIndex = parentIndex;
        this.schema = schema;
        this.dataSource = dataSource;
        this.recordKeyPath = recordKeyPath;
        this.record = record;
    }

    public TableSchema schema() {
        return schema;
    }

    public List<Map<String, Object>> dataSource() {
        return dataSource;
    }

    public Optional<TableInformation> parent() {
        return parentIndex == null ? Optional.empty() : Optional.of(tree.get(parentIndex));
    }

    /**
     * Row keys of the ancestor rows this table was expanded from, outermost first.
     */
    public List<Object> recordKeyPath() {
        return recordKeyPath;
    }

    public int depth() {
        return recordKeyPath.size();
    }

    public Optional<Map<String, Object>> record() {
        return Optional.ofNullable(record);
    }

    public String tableId() {
        return schema != null ? schema.id() : null;
    }

    public TableInformation withRecord(Map<String, Object> eventRecord) {
        return new TableInformation(tree, index, parentIndex, schema, dataSource, recordKeyPath, eventRecord);
    }

    TableInformationTree tree() {
        return tree;
    }

    int index() {
        return index;
    }
}
