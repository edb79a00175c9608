package org.driptable.service.slots;

import org.driptable.adapters.TableDriver;
import org.driptable.models.render.RenderNode;
import org.driptable.models.schema.ColumnSchema;
import org.driptable.models.schema.SlotElement;
import org.driptable.models.schema.SlotSchema;
import org.driptable.models.schema.TableSchema;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Component
public class SlotRenderer {

    public RenderNode header(TableDriver driver, TableSchema schema, Collection<String> displayColumnKeys) {
        return render(driver, "header", schema.header(), SlotLayoutResolver.header(schema.header()), schema, displayColumnKeys);
    }

    public RenderNode footer(TableDriver driver, TableSchema schema, Collection<String> displayColumnKeys) {
        return render(driver, "footer", schema.footer(), SlotLayoutResolver.footer(schema.footer()), schema, displayColumnKeys);
    }

    private RenderNode render(TableDriver driver, String section, SlotSchema slot, List<SlotElement> elements,
                              TableSchema schema, Collection<String> displayColumnKeys) {
        if (elements.isEmpty()) {
            return null;
        }
        List<RenderNode> children = new ArrayList<>();
        for (SlotElement element : elements) {
            if (element != null && element.type() != null) {
                children.add(element(driver, element, schema, displayColumnKeys));
            }
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        if (slot.style() != null) {
            attributes.put("style", slot.style());
        }
        return driver.element(section, attributes, children);
    }

    private RenderNode element(TableDriver driver, SlotElement element, TableSchema schema,
                               Collection<String> displayColumnKeys) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        putIfPresent(attributes, "span", element.span());
        putIfPresent(attributes, "align", element.align());
        putIfPresent(attributes, "style", element.style());
        return switch (element.type()) {
            case DISPLAY_COLUMN_SELECTOR -> {
                attributes.put("buttonText", Objects.requireNonNullElse(element.selectorButtonText(), "Columns"));
                List<RenderNode> options = schema.columnsOrEmpty().stream()
                        .filter(Objects::nonNull)
                        .filter(ColumnSchema::hidableColumn)
                        .map(column -> columnOption(driver, column, displayColumnKeys))
                        .toList();
                yield driver.element(element.type().value(), attributes, options);
            }
            case SPACER -> driver.element(element.type().value(), attributes);
            case TEXT -> driver.element(element.type().value(), attributes, RenderNode.text(element.text()));
            case SEARCH -> {
                putIfPresent(attributes, "placeholder", element.searchPlaceholder());
                attributes.put("buttonText", Objects.requireNonNullElse(element.searchButtonText(), "Search"));
                putIfPresent(attributes, "searchKeys", element.searchKeys());
                putIfPresent(attributes, "searchKeyDefaultValue", element.searchKeyDefaultValue());
                yield driver.element(element.type().value(), attributes);
            }
            case INSERT_BUTTON -> {
                attributes.put("buttonText", Objects.requireNonNullElse(element.insertButtonText(), "Add"));
                yield driver.element(element.type().value(), attributes);
            }
        };
    }

    private static RenderNode columnOption(TableDriver driver, ColumnSchema column, Collection<String> displayColumnKeys) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("columnKey", column.key());
        attributes.put("checked", displayColumnKeys != null && displayColumnKeys.contains(column.key()));
        return driver.element("column-option", attributes, RenderNode.text(column.title()));
    }

    private static void putIfPresent(Map<String, Object> attributes, String key, Object value) {
        if (value != null) {
            attributes.put(key, value);
        }
    }
}
