package org.driptable.service.components;

import org.driptable.models.render.RenderNode;

/**
 * Stands in for a component identifier that resolved to nothing.
 */
public class PlaceholderRenderer implements CellRenderer {

    private final String identifier;

    public PlaceholderRenderer(String identifier) {
        this.identifier = identifier;
    }

    @Override
    public String name() {
        return "placeholder";
    }

    @Override
    public RenderNode render(CellContext context) {
        return context.driver().alert("Unknown component: " + identifier, "warning");
    }
}
