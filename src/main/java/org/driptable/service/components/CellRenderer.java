package org.driptable.service.components;

import com.fasterxml.jackson.databind.JsonNode;
import org.driptable.models.render.RenderNode;

/**
 * Draws the cells of a column. A renderer may publish the shape of the {@code options} it
 * accepts; the validator checks every column using the renderer against it.
 */
public interface CellRenderer {

    String name();

    default JsonNode capabilitySchema() {
        return null;
    }

    RenderNode render(CellContext context);
}
