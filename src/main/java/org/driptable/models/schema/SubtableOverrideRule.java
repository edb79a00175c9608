package org.driptable.models.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.driptable.models.enums.OverrideMatch;

import java.util.List;
import java.util.Map;

/**
 * Partial properties applied to the subtables matched by this rule. A rule matches either every
 * subtable ({@code default}), subtables with a given id, or the subtable expanded from a chain
 * of record keys walked from the outermost table inwards.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubtableOverrideRule(
        @JsonProperty("default")
        Boolean matchesAll,
        String subtableId,
        List<Object> recordKeys,
        Map<String, Object> properties
) {

    public static SubtableOverrideRule byDefault(Map<String, Object> properties) {
        return new SubtableOverrideRule(true, null, null, properties);
    }

    public static SubtableOverrideRule byTableId(String subtableId, Map<String, Object> properties) {
        return new SubtableOverrideRule(null, subtableId, null, properties);
    }

    public static SubtableOverrideRule byRecordKeys(List<Object> recordKeys, Map<String, Object> properties) {
        return new SubtableOverrideRule(null, null, recordKeys, properties);
    }

    public OverrideMatch match() {
        if (recordKeys != null && !recordKeys.isEmpty()) {
            return OverrideMatch.RECORD_KEYS;
        }
        if (subtableId != null) {
            return OverrideMatch.TABLE_ID;
        }
        if (Boolean.TRUE.equals(matchesAll)) {
            return OverrideMatch.DEFAULT;
        }
        return OverrideMatch.NONE;
    }

    public SubtableOverrideRule consumeKey() {
        return new SubtableOverrideRule(matchesAll, subtableId, recordKeys.subList(1, recordKeys.size()), properties);
    }
}
