package org.driptable.adapters;

import lombok.RequiredArgsConstructor;
import org.driptable.configuration.DripTableProperties;
import org.driptable.models.render.RenderNode;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders only the rows that fit the scroll viewport (plus an overscan margin) starting at the
 * top of the current page.
 */
@Component
@RequiredArgsConstructor
public class WindowedVirtualTableAdapter implements VirtualTableAdapter {

    private final DripTableProperties properties;

    @Override
    public RenderNode render(TableDriver driver, DriverTableProps props) {
        DripTableProperties.Virtual settings = properties.virtual();
        int scrollY = props.scroll() != null && props.scroll().y() != null
                ? props.scroll().y()
                : settings.defaultScrollY();
        int rowHeight = Math.max(1, settings.rowHeight());
        int windowSize = (int) Math.ceil(scrollY / (double) rowHeight) + Math.max(0, settings.overscan());

        RenderNode table = driver.table(props.toBuilder()
                .virtualWindow(new DriverTableProps.VirtualWindow(0, windowSize))
                .build());

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("scrollY", scrollY);
        attributes.put("rowHeight", rowHeight);
        attributes.put("windowSize", windowSize);
        attributes.put("rowCount", props.dataSource() == null ? 0 : props.dataSource().size());
        return driver.element("virtual-table", attributes, table);
    }
}
