package org.driptable.service.validation;

import com.fasterxml.jackson.databind.JsonNode;
import org.driptable.EngineFixtures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CapabilitySchemaCheckerTest {

    private final CapabilitySchemaChecker checker = new CapabilitySchemaChecker();

    private final JsonNode descriptor = json("""
            {
              "type": "object",
              "required": ["mode"],
              "properties": {
                "mode": { "enum": ["single", "multiple"] },
                "fontSize": { "type": ["string", "number"] },
                "maxRow": { "type": "integer", "minimum": 1 },
                "code": { "type": "string", "pattern": "^[A-Z]+$", "minLength": 2 },
                "children": { "type": "array", "items": { "$ref": "#" } }
              }
            }
            """);

    @Test
    void acceptsConformingValues() {
        JsonNode value = json("{\"mode\":\"single\",\"fontSize\":12,\"maxRow\":2,\"code\":\"AB\"}");

        assertThat(checker.check(descriptor, value, "options", true)).isEmpty();
    }

    @Test
    void reportsEveryViolationWithItsPath() {
        JsonNode value = json("{\"mode\":\"other\",\"fontSize\":true,\"maxRow\":0,\"code\":\"a\"}");

        assertThat(checker.check(descriptor, value, "options", true)).containsExactlyInAnyOrder(
                "options.mode must be equal to one of the allowed values: single, multiple",
                "options.fontSize must be string,number",
                "options.maxRow must be >= 1",
                "options.code must NOT have fewer than 2 characters",
                "options.code must match pattern \"^[A-Z]+$\"");
    }

    @Test
    void reportsMissingRequiredProperties() {
        assertThat(checker.check(descriptor, json("{}"), "options", true))
                .containsExactly("options must have required property 'mode'");
    }

    @Test
    void additionalPropertiesFollowTheOptions() {
        JsonNode value = json("{\"mode\":\"single\",\"color\":\"red\"}");

        assertThat(checker.check(descriptor, value, "options", true)).isEmpty();
        assertThat(checker.check(descriptor, value, "options", false))
                .containsExactly("options must NOT have additional property 'color'");
    }

    @Test
    void followsRootReferences() {
        JsonNode value = json("{\"mode\":\"single\",\"children\":[{\"mode\":\"bad\"}]}");

        assertThat(checker.check(descriptor, value, "options", true))
                .containsExactly("options.children[0].mode must be equal to one of the allowed values: single, multiple");
    }

    @Test
    void supportsAlternatives() {
        JsonNode anyOf = json("{\"anyOf\":[{\"const\":false},{\"type\":\"object\"}]}");

        assertThat(checker.check(anyOf, json("false"), "pagination", true)).isEmpty();
        assertThat(checker.check(anyOf, json("{}"), "pagination", true)).isEmpty();
        assertThat(checker.check(anyOf, json("true"), "pagination", true)).containsExactly("pagination must match a schema in anyOf");
    }

    private static JsonNode json(String text) {
        try {
            return EngineFixtures.MAPPER.readTree(text);
        } catch (Exception e) {
            throw new IllegalArgumentException(e);
        }
    }
}
