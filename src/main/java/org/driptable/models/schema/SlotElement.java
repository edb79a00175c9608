package org.driptable.models.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import org.driptable.models.enums.SlotElementType;

import java.util.List;
import java.util.Map;

@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SlotElement(
        SlotElementType type,
        String span,
        String align,
        Map<String, Object> style,
        String text,
        String selectorButtonText,
        String searchPlaceholder,
        String searchButtonText,
        List<Map<String, Object>> searchKeys,
        Object searchKeyDefaultValue,
        String insertButtonText
) {

    public static SlotElement of(SlotElementType type) {
        return SlotElement.builder().type(type).build();
    }
}
