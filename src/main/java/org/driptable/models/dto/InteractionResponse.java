package org.driptable.models.dto;

import org.driptable.models.render.RenderNode;
import org.driptable.service.events.ObservedEvent;
import org.driptable.service.state.TableState;

import java.util.List;

/**
 * Result of an interaction: the new state of the addressed table, the notifications it raised
 * and the table tree rendered again from its outermost instance.
 */
public record InteractionResponse(
        String instanceId,
        TableState state,
        List<ObservedEvent> events,
        RenderNode tree
) {
}
