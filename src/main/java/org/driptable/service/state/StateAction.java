package org.driptable.service.state;

import java.util.function.Function;

/**
 * Update request for a {@link TableStateStore}: either a ready patch or a function computing
 * the patch from the current state.
 */
public interface StateAction {

    TableStatePatch toPatch(TableState current);

    static StateAction patch(TableStatePatch patch) {
        return new Patch(patch);
    }

    static StateAction updater(Function<TableState, TableStatePatch> updater) {
        return new Updater(updater);
    }

    record Patch(TableStatePatch patch) implements StateAction {
        @Override
        public TableStatePatch toPatch(TableState current) {
            return patch;
        }
    }

    record Updater(Function<TableState, TableStatePatch> updater) implements StateAction {
        @Override
        public TableStatePatch toPatch(TableState current) {
            return updater.apply(current);
        }
    }
}
