package org.driptable.models.schema;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * One column of a table schema. {@code dataIndex} accepts a single field name or a path.
 * {@code ui:type} and {@code ui:props} are the deprecated spelling of {@code component} and
 * {@code options}; they are rewritten before a column is used.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ColumnSchema(
        String key,
        String title,
        String description,
        @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
        List<String> dataIndex,
        String component,
        Map<String, Object> options,
        Object width,
        String align,
        String verticalAlign,
        Object fixed,
        List<ColumnFilter> filters,
        List<Object> defaultFilteredValue,
        Boolean hidable,
        Object defaultValue,
        @JsonProperty("ui:type")
        String deprecatedType,
        @JsonProperty("ui:props")
        Map<String, Object> deprecatedProps
) {

    public boolean hidableColumn() {
        return Boolean.TRUE.equals(hidable);
    }

    public boolean usesDeprecatedForm() {
        return deprecatedType != null || deprecatedProps != null;
    }

    public Map<String, Object> optionsOrEmpty() {
        return options != null ? options : Map.of();
    }
}
