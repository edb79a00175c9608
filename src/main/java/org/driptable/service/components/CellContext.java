package org.driptable.service.components;

import org.driptable.adapters.TableDriver;
import org.driptable.models.schema.ColumnSchema;
import org.driptable.service.events.TableEvent;
import org.driptable.service.table.TableInformation;

import java.util.Map;
import java.util.function.Consumer;

/**
 * Everything a renderer receives for one cell.
 *
 * @param value     the projected value, already defaulted
 * @param onChange  reports a new value for this cell; the engine writes it into a copy of the dataset
 * @param fireEvent forwards a renderer event to the host together with this row
 */
public record CellContext(
        TableDriver driver,
        Object value,
        Map<String, Object> record,
        int index,
        ColumnSchema column,
        Object ext,
        TableInformation table,
        Consumer<Object> onChange,
        Consumer<TableEvent> fireEvent
) {

    public Map<String, Object> options() {
        return column.optionsOrEmpty();
    }
}
