package org.driptable.adapters;

import org.driptable.models.render.RenderNode;

/**
 * Windowed rendering strategy. Receives exactly the inputs a standard table body receives.
 */
public interface VirtualTableAdapter {

    RenderNode render(TableDriver driver, DriverTableProps props);
}
