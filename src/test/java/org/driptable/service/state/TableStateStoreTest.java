package org.driptable.service.state;

import org.driptable.models.schema.ColumnSchema;
import org.driptable.models.schema.PaginationConfig;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class TableStateStoreTest {

    @Test
    void patchOverwritesTopLevelFieldsWholesale() {
        TableStateStore store = new TableStateStore();
        store.setState(TableStatePatch.builder().filters(Map.of("status", List.of("on"))).build());

        TableState state = store.setState(TableStatePatch.builder()
                .pagination(new TableState.Pagination(2, 10))
                .build());

        assertThat(state.pagination()).isEqualTo(new TableState.Pagination(2, 10));
        assertThat(state.filters()).isEqualTo(Map.of("status", List.of("on")));
    }

    @Test
    void updaterReceivesTheCurrentState() {
        TableStateStore store = new TableStateStore();
        store.setState(TableStatePatch.builder().selectedRowKeys(Set.of(1)).build());

        TableState state = store.setState(StateAction.updater(current -> TableStatePatch.builder()
                .pagination(new TableState.Pagination(current.pagination().current() + 1, current.pagination().pageSize()))
                .build()));

        assertThat(state.pagination()).isEqualTo(new TableState.Pagination(2, 10));
        assertThat(state.selectedRowKeys()).containsExactly(1);
    }

    @Test
    void emptyPatchKeepsTheState() {
        TableStateStore store = new TableStateStore();
        TableState before = store.getState();

        assertThat(store.setState(TableStatePatch.builder().build())).isEqualTo(before);
    }

    @Test
    void pageSizeFollowsTheConfigurationOnlyWhenItChanges() {
        TableStateStore store = new TableStateStore();
        store.syncPageSize(PaginationConfig.builder().enabled(true).pageSize(20).build());
        store.setState(TableStatePatch.builder().pagination(new TableState.Pagination(3, 50)).build());

        store.syncPageSize(PaginationConfig.builder().enabled(true).pageSize(20).build());
        assertThat(store.getState().pagination()).isEqualTo(new TableState.Pagination(3, 50));

        store.syncPageSize(PaginationConfig.builder().enabled(true).pageSize(5).build());
        assertThat(store.getState().pagination()).isEqualTo(new TableState.Pagination(3, 5));
    }

    @Test
    void displayColumnsDefaultToEveryHidableColumn() {
        TableStateStore store = new TableStateStore();
        List<ColumnSchema> columns = List.of(
                ColumnSchema.builder().key("id").build(),
                ColumnSchema.builder().key("name").hidable(true).build(),
                ColumnSchema.builder().key("email").hidable(true).build());

        assertThat(store.syncDisplayColumns(null, columns).displayColumnKeys()).containsExactly("name", "email");

        store.setState(TableStatePatch.builder().displayColumnKeys(Set.of("name")).build());
        assertThat(store.syncDisplayColumns(null, columns).displayColumnKeys()).containsExactly("name");

        assertThat(store.syncDisplayColumns(List.of("email"), columns).displayColumnKeys()).containsExactly("email");
    }

    @Test
    void hostSelectionIsAdoptedWhenItChanges() {
        TableStateStore store = new TableStateStore();
        store.syncSelectedRowKeys(List.of(1, 2));
        store.setState(TableStatePatch.builder().selectedRowKeys(Set.of(3)).build());

        assertThat(store.syncSelectedRowKeys(List.of(1, 2)).selectedRowKeys()).containsExactly(3);
        assertThat(store.syncSelectedRowKeys(List.of(4)).selectedRowKeys()).containsExactly(4);
        assertThat(store.syncSelectedRowKeys(null).selectedRowKeys()).containsExactly(4);
    }
}
