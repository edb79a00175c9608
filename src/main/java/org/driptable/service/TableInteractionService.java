package org.driptable.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.driptable.adapters.TableDriver;
import org.driptable.models.dto.DisplayColumnsRequest;
import org.driptable.models.dto.InteractionResponse;
import org.driptable.models.dto.RenderRequest;
import org.driptable.models.dto.RenderResponse;
import org.driptable.models.dto.RowRequest;
import org.driptable.models.dto.SearchRequest;
import org.driptable.models.dto.SelectionRequest;
import org.driptable.models.dto.TableChangeRequest;
import org.driptable.service.events.ObservedEvent;
import org.driptable.service.events.SearchParams;
import org.driptable.service.state.TableState;
import org.driptable.service.table.RenderedTable;
import org.driptable.service.table.TableInstance;
import org.driptable.service.table.TableInstanceRegistry;
import org.driptable.service.table.TableProps;
import org.driptable.service.validation.ValidationOptions;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Drives table instances for remote clients. Notifications are recorded per outermost instance
 * and returned with the response of the call that raised them. After every interaction the
 * outermost instance is rendered again so the client receives the tree for the new state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TableInteractionService {

    private final TableRenderService renderService;
    private final TableInstanceRegistry instances;
    private final TableDriver driver;
    private final ValidationOptions defaultValidationOptions;

    public RenderResponse render(RenderRequest request) {
        String instanceId = request.instanceId() != null ? request.instanceId() : UUID.randomUUID().toString();
        TableInstance instance = instances.acquire(instanceId);
        TableProps props = TableProps.builder()
                .instanceId(instanceId)
                .schema(request.schema())
                .driver(driver)
                .dataSource(request.dataSource())
                .selectedRowKeys(request.selectedRowKeys())
                .displayColumnKeys(request.displayColumnKeys())
                .expandedRowKeys(request.expandedRowKeys())
                .currentPage(request.currentPage())
                .total(request.total())
                .loading(request.loading())
                .ext(request.ext())
                .subtableOverrides(request.subtableOverrides())
                .validation(ValidationOptions.fromJson(request.validation(), defaultValidationOptions))
                .build();
        RenderedTable rendered = renderService.render(props, instance.recorder());
        return new RenderResponse(
                instanceId,
                !rendered.failed(),
                rendered.errors(),
                rendered.node(),
                rendered.state(),
                instance.recorder().drain()
        );
    }

    public InteractionResponse change(String instanceId, TableChangeRequest request) {
        return interact(instanceId, table -> {
            TableState.Pagination current = table.state().pagination();
            TableState.Pagination pagination = new TableState.Pagination(
                    request.current() != null ? request.current() : current.current(),
                    request.pageSize() != null ? request.pageSize() : current.pageSize());
            table.onChange(pagination, request.filters());
        });
    }

    public InteractionResponse select(String instanceId, SelectionRequest request) {
        return interact(instanceId, table -> table.onSelectionChange(request.selectedRowKeys()));
    }

    public InteractionResponse displayColumns(String instanceId, DisplayColumnsRequest request) {
        return interact(instanceId, table -> table.onDisplayColumnKeysChange(request.displayColumnKeys()));
    }

    public InteractionResponse search(String instanceId, SearchRequest request) {
        return interact(instanceId, table -> table.onSearch(new SearchParams(request.searchKey(), request.searchStr())));
    }

    public InteractionResponse insert(String instanceId) {
        return interact(instanceId, RenderedTable::onInsertButtonClick);
    }

    public InteractionResponse rowClick(String instanceId, RowRequest request, boolean doubleClick) {
        return interact(instanceId, table -> {
            if (doubleClick) {
                table.onRowDoubleClick(request.rowKey());
            } else {
                table.onRowClick(request.rowKey());
            }
        });
    }

    public InteractionResponse expand(String instanceId, RowRequest request) {
        return interact(instanceId, table -> table.expandRow(request.rowKey(), !Boolean.FALSE.equals(request.expanded())));
    }

    public TableState state(String instanceId) {
        return requireInstance(instanceId).store().getState();
    }

    public List<ObservedEvent> release(String instanceId) {
        TableInstance root = requireInstance(rootId(instanceId));
        requireInstance(instanceId);
        List<TableInstance> released = instances.release(instanceId);
        log.info("Released table instance '{}' ({} nested)", instanceId, released.size() - 1);
        return root.recorder().drain();
    }

    private InteractionResponse interact(String instanceId, Consumer<RenderedTable> interaction) {
        TableInstance instance = requireInstance(instanceId);
        TableInstance root = requireInstance(rootId(instanceId));
        RenderedTable table = instance.lastRender();
        if (table == null) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Table '" + instanceId + "' has not been rendered");
        }
        try {
            interaction.accept(table);
        } catch (IllegalStateException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }

        List<ObservedEvent> events = new ArrayList<>(root.recorder().drain());
        RenderedTable rerendered = renderService.render(root.lastProps(), root.recorder());
        events.addAll(root.recorder().drain());
        return new InteractionResponse(instanceId, instance.store().getState(), events, rerendered.node());
    }

    private TableInstance requireInstance(String instanceId) {
        return instances.find(instanceId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown table instance '" + instanceId + "'"));
    }

    private static String rootId(String instanceId) {
        int separator = instanceId.indexOf(TableInstanceRegistry.CHILD_SEPARATOR);
        return separator < 0 ? instanceId : instanceId.substring(0, separator);
    }
}
