package org.driptable.service.columns;

import org.driptable.models.render.RenderNode;

import java.util.Map;

@FunctionalInterface
public interface CellRenderFunction {

    /**
     * @param index position of the record in the table's dataset
     */
    RenderNode render(Map<String, Object> record, int index);
}
