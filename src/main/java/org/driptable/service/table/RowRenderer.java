package org.driptable.service.table;

import org.driptable.models.render.RenderNode;

import java.util.Map;

/**
 * Host renderer for content tied to a row: custom expanded content, subtable title and footer.
 */
@FunctionalInterface
public interface RowRenderer {
    RenderNode render(Map<String, Object> record, int index, TableInformation table);
}
