package org.driptable.controllers;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.driptable.models.dto.DisplayColumnsRequest;
import org.driptable.models.dto.InteractionResponse;
import org.driptable.models.dto.RenderRequest;
import org.driptable.models.dto.RenderResponse;
import org.driptable.models.dto.RowRequest;
import org.driptable.models.dto.SearchRequest;
import org.driptable.models.dto.SelectionRequest;
import org.driptable.models.dto.TableChangeRequest;
import org.driptable.service.TableInteractionService;
import org.driptable.service.events.ObservedEvent;
import org.driptable.service.state.TableState;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/tables")
@RequiredArgsConstructor
public class TableController {

    private final TableInteractionService interactionService;

    @PostMapping("/render")
    public RenderResponse render(@Valid @RequestBody RenderRequest request) {
        RenderResponse response = interactionService.render(request);
        if (!response.rendered()) {
            log.debug("Render of '{}' answered with {} validation error(s)", response.instanceId(), response.errors().size());
        }
        return response;
    }

    @PostMapping("/{instanceId}/change")
    public InteractionResponse change(@PathVariable String instanceId, @Valid @RequestBody TableChangeRequest request) {
        return interactionService.change(instanceId, request);
    }

    @PostMapping("/{instanceId}/selection")
    public InteractionResponse selection(@PathVariable String instanceId, @Valid @RequestBody SelectionRequest request) {
        return interactionService.select(instanceId, request);
    }

    @PostMapping("/{instanceId}/display-columns")
    public InteractionResponse displayColumns(@PathVariable String instanceId,
                                              @Valid @RequestBody DisplayColumnsRequest request) {
        return interactionService.displayColumns(instanceId, request);
    }

    @PostMapping("/{instanceId}/search")
    public InteractionResponse search(@PathVariable String instanceId, @RequestBody SearchRequest request) {
        return interactionService.search(instanceId, request);
    }

    @PostMapping("/{instanceId}/insert")
    public InteractionResponse insert(@PathVariable String instanceId) {
        return interactionService.insert(instanceId);
    }

    @PostMapping("/{instanceId}/rows/click")
    public InteractionResponse rowClick(@PathVariable String instanceId, @Valid @RequestBody RowRequest request) {
        return interactionService.rowClick(instanceId, request, false);
    }

    @PostMapping("/{instanceId}/rows/double-click")
    public InteractionResponse rowDoubleClick(@PathVariable String instanceId, @Valid @RequestBody RowRequest request) {
        return interactionService.rowClick(instanceId, request, true);
    }

    @PostMapping("/{instanceId}/rows/expand")
    public InteractionResponse expand(@PathVariable String instanceId, @Valid @RequestBody RowRequest request) {
        return interactionService.expand(instanceId, request);
    }

    @GetMapping("/{instanceId}/state")
    public TableState state(@PathVariable String instanceId) {
        return interactionService.state(instanceId);
    }

    @DeleteMapping("/{instanceId}")
    public ResponseEntity<Map<String, Object>> release(@PathVariable String instanceId) {
        List<ObservedEvent> events = interactionService.release(instanceId);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "released");
        response.put("instanceId", instanceId);
        response.put("events", events);
        return ResponseEntity.ok(response);
    }
}
