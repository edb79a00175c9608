package org.driptable.service.validation;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Structural validation settings. {@link #disabled()} turns every check off; otherwise
 * {@code additionalProperties} decides whether properties not declared by a descriptor pass.
 */
public record ValidationOptions(boolean enabled, boolean additionalProperties) {

    private static final ValidationOptions DISABLED = new ValidationOptions(false, true);
    private static final ValidationOptions DEFAULTS = new ValidationOptions(true, true);

    public static ValidationOptions disabled() {
        return DISABLED;
    }

    public static ValidationOptions defaults() {
        return DEFAULTS;
    }

    public static ValidationOptions strict() {
        return new ValidationOptions(true, false);
    }

    /**
     * Reads the wire form: {@code false} disables validation, an object configures it,
     * anything else falls back to {@code fallback}.
     */
    public static ValidationOptions fromJson(JsonNode node, ValidationOptions fallback) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return fallback;
        }
        if (node.isBoolean()) {
            return node.booleanValue() ? fallback : DISABLED;
        }
        if (node.isObject()) {
            JsonNode additional = node.get("additionalProperties");
            boolean allowAdditional = additional == null || !additional.isBoolean() || additional.booleanValue();
            return new ValidationOptions(true, allowAdditional);
        }
        return fallback;
    }
}
