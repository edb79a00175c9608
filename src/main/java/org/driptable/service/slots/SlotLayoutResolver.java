package org.driptable.service.slots;

import org.driptable.models.enums.SlotElementType;
import org.driptable.models.schema.SlotElement;
import org.driptable.models.schema.SlotSchema;

import java.util.List;

/**
 * Turns a header or footer declaration into the list of elements to draw. {@code true} selects
 * the built-in layout of the section.
 */
public final class SlotLayoutResolver {

    static final List<SlotElement> DEFAULT_HEADER = List.of(
            SlotElement.of(SlotElementType.DISPLAY_COLUMN_SELECTOR),
            SlotElement.builder().type(SlotElementType.SPACER).span("flex-auto").build(),
            SlotElement.of(SlotElementType.SEARCH),
            SlotElement.of(SlotElementType.INSERT_BUTTON)
    );

    static final List<SlotElement> DEFAULT_FOOTER = List.of(
            SlotElement.of(SlotElementType.DISPLAY_COLUMN_SELECTOR),
            SlotElement.of(SlotElementType.SEARCH),
            SlotElement.of(SlotElementType.INSERT_BUTTON)
    );

    private SlotLayoutResolver() {
    }

    public static List<SlotElement> header(SlotSchema slot) {
        return resolve(slot, DEFAULT_HEADER);
    }

    public static List<SlotElement> footer(SlotSchema slot) {
        return resolve(slot, DEFAULT_FOOTER);
    }

    private static List<SlotElement> resolve(SlotSchema slot, List<SlotElement> defaults) {
        if (slot == null || !slot.enabled()) {
            return List.of();
        }
        return slot.usesDefaultLayout() ? defaults : slot.elements();
    }
}
