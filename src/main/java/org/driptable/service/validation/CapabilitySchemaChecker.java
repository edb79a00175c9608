package org.driptable.service.validation;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Checks a JSON value against a JSON-Schema-like descriptor. Supported keywords: {@code type},
 * {@code enum}, {@code const}, {@code properties}, {@code required}, {@code additionalProperties},
 * {@code items}, {@code anyOf}, {@code oneOf}, {@code minimum}, {@code maximum},
 * {@code minLength}, {@code pattern} and the root reference {@code "$ref": "#"}.
 * Unknown keywords are ignored.
 */
public class CapabilitySchemaChecker {

    public List<String> check(JsonNode descriptor, JsonNode value, String path, boolean additionalPropertiesByDefault) {
        List<String> errors = new ArrayList<>();
        check(descriptor, descriptor, value, path, additionalPropertiesByDefault, errors);
        return errors;
    }

    private void check(JsonNode root, JsonNode descriptor, JsonNode value, String path,
                       boolean additionalByDefault, List<String> errors) {
        if (descriptor == null || !descriptor.isObject() || value == null) {
            return;
        }
        JsonNode ref = descriptor.get("$ref");
        if (ref != null && "#".equals(ref.asText())) {
            check(root, root, value, path, additionalByDefault, errors);
            return;
        }

        JsonNode type = descriptor.get("type");
        if (type != null && !matchesType(type, value)) {
            errors.add(path + " must be " + describeType(type));
            return;
        }

        JsonNode allowed = descriptor.get("enum");
        if (allowed != null && allowed.isArray() && !contains(allowed, value)) {
            errors.add(path + " must be equal to one of the allowed values: " + joinValues(allowed));
        }

        JsonNode constant = descriptor.get("const");
        if (constant != null && !constant.equals(value)) {
            errors.add(path + " must be equal to constant " + constant);
        }

        checkAlternatives(root, descriptor, value, path, additionalByDefault, errors);

        if (value.isNumber()) {
            checkBounds(descriptor, value, path, errors);
        }
        if (value.isTextual()) {
            checkText(descriptor, value.textValue(), path, errors);
        }
        if (value.isObject()) {
            checkObject(root, descriptor, value, path, additionalByDefault, errors);
        }
        if (value.isArray()) {
            JsonNode items = descriptor.get("items");
            if (items != null && items.isObject()) {
                for (int i = 0; i < value.size(); i++) {
                    check(root, items, value.get(i), path + "[" + i + "]", additionalByDefault, errors);
                }
            }
        }
    }

    private void checkAlternatives(JsonNode root, JsonNode descriptor, JsonNode value, String path,
                                   boolean additionalByDefault, List<String> errors) {
        JsonNode anyOf = descriptor.get("anyOf");
        if (anyOf != null && anyOf.isArray()) {
            boolean matched = false;
            for (JsonNode branch : anyOf) {
                List<String> branchErrors = new ArrayList<>();
                check(root, branch, value, path, additionalByDefault, branchErrors);
                if (branchErrors.isEmpty()) {
                    matched = true;
                    break;
                }
            }
            if (!matched) {
                errors.add(path + " must match a schema in anyOf");
            }
        }
        JsonNode oneOf = descriptor.get("oneOf");
        if (oneOf != null && oneOf.isArray()) {
            int matches = 0;
            for (JsonNode branch : oneOf) {
                List<String> branchErrors = new ArrayList<>();
                check(root, branch, value, path, additionalByDefault, branchErrors);
                if (branchErrors.isEmpty()) {
                    matches++;
                }
            }
            if (matches != 1) {
                errors.add(path + " must match exactly one schema in oneOf");
            }
        }
    }

    private void checkObject(JsonNode root, JsonNode descriptor, JsonNode value, String path,
                             boolean additionalByDefault, List<String> errors) {
        JsonNode required = descriptor.get("required");
        if (required != null && required.isArray()) {
            for (JsonNode name : required) {
                JsonNode present = value.get(name.asText());
                if (present == null || present.isNull()) {
                    errors.add(path + " must have required property '" + name.asText() + "'");
                }
            }
        }
        JsonNode properties = descriptor.get("properties");
        JsonNode additional = descriptor.get("additionalProperties");
        Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String childPath = path + "." + field.getKey();
            JsonNode propertyDescriptor = properties != null ? properties.get(field.getKey()) : null;
            if (propertyDescriptor != null) {
                check(root, propertyDescriptor, field.getValue(), childPath, additionalByDefault, errors);
            } else if (additional != null && additional.isObject()) {
                check(root, additional, field.getValue(), childPath, additionalByDefault, errors);
            } else if (properties != null && !allowsAdditional(additional, additionalByDefault)) {
                errors.add(path + " must NOT have additional property '" + field.getKey() + "'");
            }
        }
    }

    private static boolean allowsAdditional(JsonNode additional, boolean additionalByDefault) {
        if (additional != null && additional.isBoolean()) {
            return additional.booleanValue();
        }
        return additionalByDefault;
    }

    private static void checkBounds(JsonNode descriptor, JsonNode value, String path, List<String> errors) {
        JsonNode minimum = descriptor.get("minimum");
        if (minimum != null && minimum.isNumber() && value.doubleValue() < minimum.doubleValue()) {
            errors.add(path + " must be >= " + minimum.asText());
        }
        JsonNode maximum = descriptor.get("maximum");
        if (maximum != null && maximum.isNumber() && value.doubleValue() > maximum.doubleValue()) {
            errors.add(path + " must be <= " + maximum.asText());
        }
    }

    private static void checkText(JsonNode descriptor, String text, String path, List<String> errors) {
        JsonNode minLength = descriptor.get("minLength");
        if (minLength != null && minLength.isInt() && text.length() < minLength.intValue()) {
            errors.add(path + " must NOT have fewer than " + minLength.intValue() + " characters");
        }
        JsonNode pattern = descriptor.get("pattern");
        if (pattern != null && pattern.isTextual()) {
            try {
                if (!Pattern.compile(pattern.textValue()).matcher(text).find()) {
                    errors.add(path + " must match pattern \"" + pattern.textValue() + "\"");
                }
            } catch (PatternSyntaxException ex) {
                errors.add(path + " has an invalid pattern in its descriptor: " + ex.getDescription());
            }
        }
    }

    private static boolean matchesType(JsonNode type, JsonNode value) {
        if (type.isArray()) {
            for (JsonNode option : type) {
                if (matchesType(option.asText(), value)) {
                    return true;
                }
            }
            return false;
        }
        return matchesType(type.asText(), value);
    }

    private static boolean matchesType(String type, JsonNode value) {
        return switch (type) {
            case "string" -> value.isTextual();
            case "number" -> value.isNumber();
            case "integer" -> value.isIntegralNumber() || (value.isNumber() && value.doubleValue() % 1 == 0);
            case "boolean" -> value.isBoolean();
            case "object" -> value.isObject();
            case "array" -> value.isArray();
            case "null" -> value.isNull();
            default -> true;
        };
    }

    private static String describeType(JsonNode type) {
        if (type.isArray()) {
            List<String> names = new ArrayList<>();
            type.forEach(option -> names.add(option.asText()));
            return String.join(",", names);
        }
        return type.asText();
    }

    private static boolean contains(JsonNode allowed, JsonNode value) {
        for (JsonNode candidate : allowed) {
            if (candidate.equals(value)) {
                return true;
            }
        }
        return false;
    }

    private static String joinValues(JsonNode allowed) {
        List<String> values = new ArrayList<>();
        allowed.forEach(candidate -> values.add(candidate.isTextual() ? candidate.textValue() : candidate.toString()));
        return String.join(", ", values);
    }
}
