package org.driptable.service.events;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ObservedEvent(String name, String tableId, Map<String, Object> payload) {
}
