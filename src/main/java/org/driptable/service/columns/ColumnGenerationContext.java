package org.driptable.service.columns;

import lombok.Builder;
import org.driptable.adapters.TableDriver;
import org.driptable.service.components.ComponentResolver;
import org.driptable.service.events.TableCallbacks;
import org.driptable.service.events.TableEventDispatcher;
import org.driptable.service.table.TableInformation;

import java.util.List;
import java.util.Map;

/**
 * Per-render inputs shared by every column of one table.
 *
 * @param columnErrors validation message per column key; such columns render the message instead of cells
 * @param dataSource   the host's dataset, never modified
 */
@Builder
public record ColumnGenerationContext(
        TableDriver driver,
        ComponentResolver resolver,
        Map<String, String> columnErrors,
        TableInformation table,
        List<Map<String, Object>> dataSource,
        Object ext,
        boolean ellipsis,
        TableCallbacks callbacks,
        TableEventDispatcher dispatcher
) {
}
