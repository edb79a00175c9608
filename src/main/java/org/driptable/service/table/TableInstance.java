package org.driptable.service.table;

import org.driptable.service.events.RecordingTableCallbacks;
import org.driptable.service.state.TableStateStore;

/**
 * A mounted table: its UI state and the outcome of its latest render.
 */
public class TableInstance {

    private final String id;
    private final TableStateStore store = new TableStateStore();
    private final RecordingTableCallbacks recorder = new RecordingTableCallbacks();
    private volatile RenderedTable lastRender;
    private volatile TableProps lastProps;
    private boolean mounted;

    TableInstance(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public TableStateStore store() {
        return store;
    }

    /**
     * Callbacks collecting notifications for clients that read them after the fact.
     */
    public RecordingTableCallbacks recorder() {
        return recorder;
    }

    public RenderedTable lastRender() {
        return lastRender;
    }

    public TableProps lastProps() {
        return lastProps;
    }

    /**
     * Stores a render result and reports whether it is the first one of this instance that drew
     * a table.
     */
    public synchronized boolean rendered(TableProps props, RenderedTable table) {
        this.lastProps = props;
        this.lastRender = table;
        if (mounted || table.failed()) {
            return false;
        }
        mounted = true;
        return true;
    }

    public synchronized boolean mounted() {
        return mounted;
    }
}
