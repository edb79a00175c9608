package org.driptable.service.events;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Event emitted by a cell renderer, e.g. a link or button click inside a cell.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record TableEvent(String type, Map<String, Object> payload) {

    public TableEvent {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static TableEvent of(String type) {
        return new TableEvent(type, Map.of());
    }
}
