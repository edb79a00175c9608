package org.driptable.service.events;

import lombok.extern.slf4j.Slf4j;
import org.driptable.service.table.TableInformation;

import java.util.Map;

/**
 * Single entry point for events raised by cell renderers. The table information handed to the
 * host carries the firing record for this dispatch only.
 */
@Slf4j
public class TableEventDispatcher {

    private final TableCallbacks callbacks;

    public TableEventDispatcher(TableCallbacks callbacks) {
        this.callbacks = callbacks != null ? callbacks : TableCallbacks.NONE;
    }

    public void fireEvent(TableEvent event, Map<String, Object> record, int index, TableInformation table) {
        log.debug("Dispatching event type={} table={} index={}", event.type(), table.tableId(), index);
        callbacks.onEvent(event, record, index, table.withRecord(record));
    }
}
