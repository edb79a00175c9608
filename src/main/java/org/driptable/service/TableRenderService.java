package org.driptable.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.driptable.adapters.DriverTableProps;
import org.driptable.adapters.ExpandableConfig;
import org.driptable.adapters.PaginationDescriptor;
import org.driptable.adapters.RowSelectionConfig;
import org.driptable.adapters.TableDriver;
import org.driptable.adapters.VirtualTableAdapter;
import org.driptable.configuration.DripTableProperties;
import org.driptable.models.render.RenderNode;
import org.driptable.models.schema.ColumnSchema;
import org.driptable.models.schema.PaginationConfig;
import org.driptable.models.schema.TableSchema;
import org.driptable.service.columns.ColumnDescriptor;
import org.driptable.service.columns.ColumnGenerationContext;
import org.driptable.service.columns.ColumnGenerator;
import org.driptable.service.columns.ColumnSchemaMigrator;
import org.driptable.service.components.ComponentRegistry;
import org.driptable.service.components.ComponentResolver;
import org.driptable.service.events.TableCallbacks;
import org.driptable.service.events.TableEventDispatcher;
import org.driptable.service.slots.SlotRenderer;
import org.driptable.service.state.TableState;
import org.driptable.service.state.TableStateStore;
import org.driptable.service.subtable.SubtableComposer;
import org.driptable.service.table.RenderedTable;
import org.driptable.service.table.RowKeys;
import org.driptable.service.table.TableDefaults;
import org.driptable.service.table.TableInformation;
import org.driptable.service.table.TableInformationTree;
import org.driptable.service.table.TableInstance;
import org.driptable.service.table.TableInstanceRegistry;
import org.driptable.service.table.TableProps;
import org.driptable.service.validation.TablePropsValidator;
import org.driptable.service.validation.ValidationError;
import org.driptable.service.validation.ValidationOptions;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Renders a table from its schema and dataset. Every render migrates deprecated columns,
 * validates, synchronizes the instance state with the host props, generates the visible
 * columns and draws the body through the driver. Expanded rows render their subtables through
 * this same service within one {@link TableInformationTree}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TableRenderService {

    private final ColumnSchemaMigrator columnSchemaMigrator;
    private final TablePropsValidator validator;
    private final ComponentRegistry componentRegistry;
    private final ColumnGenerator columnGenerator;
    private final SlotRenderer slotRenderer;
    private final SubtableComposer subtableComposer;
    private final VirtualTableAdapter virtualTableAdapter;
    private final TableInstanceRegistry instances;
    private final DripTableProperties properties;
    private final ValidationOptions defaultValidationOptions;

    public RenderedTable render(TableProps props, TableCallbacks callbacks) {
        return render(props, new TableInformationTree(), null, null, callbacks != null ? callbacks : TableCallbacks.NONE);
    }

    private RenderedTable render(TableProps input, TableInformationTree tree, TableInformation parent,
                                 Object parentRowKey, TableCallbacks callbacks) {
        TableProps props = input.toBuilder().schema(columnSchemaMigrator.migrate(input.schema())).build();
        TableInstance instance = props.instanceId() != null ? instances.acquire(props.instanceId()) : null;
        TableStateStore store = instance != null ? instance.store() : new TableStateStore();
        ComponentResolver resolver = componentRegistry.resolver(props.components());

        List<ValidationError> errors = validator.validate(props, resolver,
                props.validation() != null ? props.validation() : defaultValidationOptions);
        List<ValidationError> propErrors = errors.stream().filter(ValidationError::failsTable).toList();
        if (!propErrors.isEmpty()) {
            String message = ValidationError.join(propErrors);
            log.warn("Table '{}' not rendered, invalid props:\n{}", tableId(props), message);
            RenderNode surface = props.driver() != null
                    ? props.driver().alert(message, "error")
                    : RenderNode.element("alert", Map.of("type", "error"), RenderNode.text(message));
            RenderedTable failed = RenderedTable.failed(props.instanceId(), surface, errors, store, callbacks);
            if (instance != null) {
                instance.rendered(props, failed);
            }
            return failed;
        }

        TableSchema schema = props.schema();
        TableDriver driver = props.driver();
        String rowKey = TableDefaults.rowKeyField(schema);
        List<Map<String, Object>> rows = RowKeys.assign(props.dataSource(), rowKey);
        boolean nested = parent != null;
        TableInformation table = nested
                ? tree.child(parent, schema, rows, parentRowKey)
                : tree.root(schema, rows);
        TableState state = syncState(store, props);

        List<ColumnSchema> visible = ColumnGenerator.visibleColumns(schema.columns(), state.displayColumnKeys());
        List<ColumnDescriptor> columns = columnGenerator.generate(visible, ColumnGenerationContext.builder()
                .driver(driver)
                .resolver(resolver)
                .columnErrors(columnErrors(errors))
                .table(table)
                .dataSource(props.dataSource())
                .ext(props.ext())
                .ellipsis(Boolean.TRUE.equals(schema.ellipsis()))
                .callbacks(callbacks)
                .dispatcher(new TableEventDispatcher(callbacks))
                .build());

        Predicate<Map<String, Object>> rowExpandable = record -> subtableComposer.isExpandable(props, record, table);
        ExpandableConfig expandable = null;
        if (schema.subtable() != null || props.rowExpandable() != null || props.expandedRowRender() != null) {
            expandable = new ExpandableConfig(
                    rowExpandable,
                    (record, index) -> subtableComposer.expand(props, table, record, index, callbacks,
                            (childProps, childParent, childRowKey, childCallbacks) ->
                                    render(childProps, tree, childParent, childRowKey, childCallbacks).node()),
                    state.expandedRowKeys());
        }

        boolean selectable = schema.selectable() && !schema.virtualized();
        DriverTableProps driverProps = DriverTableProps.builder()
                .tableId(schema.id())
                .rowKey(rowKey)
                .columns(columns)
                .dataSource(rows)
                .pagination(pagination(props, state, rows))
                .loading(props.loading())
                .size(TableDefaults.tableSize(schema, nested))
                .bordered(schema.bordered())
                .showHeader(schema.showHeader())
                .sticky(TableDefaults.sticky(schema))
                .expandable(expandable)
                .rowSelection(selectable ? new RowSelectionConfig(state.selectedRowKeys()) : null)
                .title(props.title() != null ? props.title().render(table) : null)
                .footer(props.footer() != null ? props.footer().render(table) : null)
                .scroll(schema.virtualized()
                        ? new DriverTableProps.ScrollConfig(null, TableDefaults.scrollY(schema, properties.virtual().defaultScrollY()))
                        : null)
                .build();
        RenderNode body = schema.virtualized()
                ? virtualTableAdapter.render(driver, driverProps)
                : driver.table(driverProps);

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("id", schema.id());
        if (schema.className() != null) {
            attributes.put("className", schema.className());
        }
        if (schema.style() != null) {
            attributes.put("style", schema.style());
        }
        if (nested) {
            attributes.put("depth", table.depth());
        }
        RenderNode node = driver.element("drip-table", attributes,
                slotRenderer.header(driver, schema, state.displayColumnKeys()),
                body,
                slotRenderer.footer(driver, schema, state.displayColumnKeys()));

        RenderedTable rendered = new RenderedTable(props.instanceId(), node, errors, table, store, callbacks, rows,
                rowKey, selectable, rowExpandable);
        if (instance != null) {
            if (instance.rendered(props, rendered)) {
                callbacks.onMount(table);
            } else {
                callbacks.onUpdate(table);
            }
        }
        return rendered;
    }

    private static TableState syncState(TableStateStore store, TableProps props) {
        TableSchema schema = props.schema();
        store.syncPageSize(schema.pagination());
        store.syncDisplayColumns(props.displayColumnKeys(), schema.columns());
        store.syncSelectedRowKeys(props.selectedRowKeys());
        store.syncExpandedRowKeys(props.expandedRowKeys());
        store.syncCurrentPage(props.currentPage());
        return store.getState();
    }

    private static PaginationDescriptor pagination(TableProps props, TableState state, List<Map<String, Object>> rows) {
        TableSchema schema = props.schema();
        if (!schema.paginated()) {
            return null;
        }
        PaginationConfig config = schema.pagination();
        PaginationDescriptor.PaginationDescriptorBuilder builder = PaginationDescriptor.builder()
                .size(TableDefaults.paginationSize(config))
                .pageSize(state.pagination().pageSize())
                .total(TableDefaults.total(props.total(), rows))
                .current(state.pagination().current())
                .position(List.of(TableDefaults.paginationPosition(config)));
        if (config != null) {
            builder.showLessItems(config.showLessItems())
                    .showQuickJumper(config.showQuickJumper())
                    .showSizeChanger(config.showSizeChanger())
                    .hideOnSinglePage(config.hideOnSinglePage());
        }
        return builder.build();
    }

    private static Map<String, String> columnErrors(List<ValidationError> errors) {
        Map<String, String> byColumn = new LinkedHashMap<>();
        for (ValidationError error : errors) {
            if (!error.failsTable()) {
                byColumn.merge(error.columnKey(), error.message(), (first, next) -> first + "\n" + next);
            }
        }
        return byColumn;
    }

    private static String tableId(TableProps props) {
        return props.schema() != null ? props.schema().id() : null;
    }
}
