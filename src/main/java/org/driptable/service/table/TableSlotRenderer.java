package org.driptable.service.table;

import org.driptable.models.render.RenderNode;

@FunctionalInterface
public interface TableSlotRenderer {
    RenderNode render(TableInformation table);
}
