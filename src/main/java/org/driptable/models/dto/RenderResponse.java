package org.driptable.models.dto;

import org.driptable.models.render.RenderNode;
import org.driptable.service.events.ObservedEvent;
import org.driptable.service.state.TableState;
import org.driptable.service.validation.ValidationError;

import java.util.List;

public record RenderResponse(
        String instanceId,
        boolean rendered,
        List<ValidationError> errors,
        RenderNode tree,
        TableState state,
        List<ObservedEvent> events
) {
}
