package org.driptable.service.subtable;

import org.driptable.models.render.RenderNode;
import org.driptable.service.events.TableCallbacks;
import org.driptable.service.table.TableInformation;
import org.driptable.service.table.TableProps;

/**
 * Renders a nested table below the row {@code parentRowKey} of {@code parent}.
 */
@FunctionalInterface
public interface NestedTableRenderer {
    RenderNode render(TableProps props, TableInformation parent, Object parentRowKey, TableCallbacks callbacks);
}
