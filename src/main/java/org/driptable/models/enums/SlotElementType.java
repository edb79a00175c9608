package org.driptable.models.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SlotElementType {
    DISPLAY_COLUMN_SELECTOR("display-column-selector"),
    SPACER("spacer"),
    TEXT("text"),
    SEARCH("search"),
    INSERT_BUTTON("insert-button");

    private final String value;

    SlotElementType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static SlotElementType fromValue(String raw) {
        for (SlotElementType type : values()) {
            if (type.value.equalsIgnoreCase(raw)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown slot element type: " + raw);
    }
}
