package org.driptable.service.validation;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Memo key of one validation: which prop was checked, the descriptor it was checked against,
 * its value and the settings used. Host libraries may bind the same component id to renderers
 * publishing different descriptors, so the descriptor is part of the key.
 */
public record ValidationKey(String propKey, JsonNode descriptor, JsonNode value, ValidationOptions options) {
}
