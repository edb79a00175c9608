package org.driptable.service.subtable;

import org.driptable.models.enums.OverrideMatch;
import org.driptable.models.schema.SubtableOverrideRule;
import org.driptable.service.table.RowKeys;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies subtable override rules. Properties are shallow-merged in precedence order: rules
 * matching every subtable, then rules matching the subtable id, then rules whose record key
 * chain ends at the expanded row.
 */
@Component
public class SubtableOverrideResolver {

    public Map<String, Object> resolve(List<SubtableOverrideRule> rules, String subtableId, Object rowKey) {
        Map<String, Object> merged = new LinkedHashMap<>();
        apply(merged, rules, OverrideMatch.DEFAULT, subtableId, rowKey);
        apply(merged, rules, OverrideMatch.TABLE_ID, subtableId, rowKey);
        apply(merged, rules, OverrideMatch.RECORD_KEYS, subtableId, rowKey);
        return merged;
    }

    /**
     * Rules handed down to the tables nested below the row {@code rowKey}. A record key chain
     * loses its first key when it passes a matching row and is dropped otherwise, so a chain
     * never applies deeper than its length.
     */
    public List<SubtableOverrideRule> childRules(List<SubtableOverrideRule> rules, Object rowKey) {
        List<SubtableOverrideRule> children = new ArrayList<>();
        for (SubtableOverrideRule rule : rules) {
            if (rule == null) {
                continue;
            }
            switch (rule.match()) {
                case DEFAULT, TABLE_ID -> children.add(rule);
                case RECORD_KEYS -> {
                    if (rule.recordKeys().size() > 1 && RowKeys.sameKey(rule.recordKeys().get(0), rowKey)) {
                        children.add(rule.consumeKey());
                    }
                }
                default -> {
                }
            }
        }
        return children;
    }

    private static void apply(Map<String, Object> merged, List<SubtableOverrideRule> rules, OverrideMatch level,
                              String subtableId, Object rowKey) {
        for (SubtableOverrideRule rule : rules) {
            if (rule == null || rule.match() != level || rule.properties() == null) {
                continue;
            }
            boolean matches = switch (level) {
                case DEFAULT -> true;
                case TABLE_ID -> rule.subtableId().equals(subtableId);
                case RECORD_KEYS -> rule.recordKeys().size() == 1 && RowKeys.sameKey(rule.recordKeys().get(0), rowKey);
                case NONE -> false;
            };
            if (matches) {
                merged.putAll(rule.properties());
            }
        }
    }
}
