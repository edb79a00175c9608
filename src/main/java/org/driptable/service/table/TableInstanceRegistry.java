package org.driptable.service.table;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.driptable.configuration.DripTableProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Mounted table instances by id. A nested table's id is its parent's id followed by
 * {@value #CHILD_SEPARATOR} and the row key it was expanded from. Instances left idle longer
 * than the configured timeout are dropped without notification; rendering a table touches its
 * nested instances too, so a tree expires as a whole.
 */
@Slf4j
@Component
public class TableInstanceRegistry {

    public static final String CHILD_SEPARATOR = ".";

    private final Cache<String, TableInstance> instances;

    @Autowired
    public TableInstanceRegistry(DripTableProperties properties) {
        this(properties, Ticker.systemTicker());
    }

    TableInstanceRegistry(DripTableProperties properties, Ticker ticker) {
        DripTableProperties.Instances settings = properties.instances();
        this.instances = Caffeine.newBuilder()
                .maximumSize(Math.max(1, settings.maxInstances()))
                .expireAfterAccess(settings.idleTimeout())
                .ticker(ticker)
                .executor(Runnable::run)
                .removalListener((String id, TableInstance instance, RemovalCause cause) -> {
                    if (cause.wasEvicted()) {
                        log.debug("Dropped table instance '{}' ({})", id, cause);
                    }
                })
                .build();
    }

    public TableInstance acquire(String id) {
        return instances.get(id, TableInstance::new);
    }

    public Optional<TableInstance> find(String id) {
        return Optional.ofNullable(instances.getIfPresent(id));
    }

    public static String childId(String parentId, Object rowKey) {
        return parentId + CHILD_SEPARATOR + rowKey;
    }

    /**
     * Unmounts an instance together with every table nested below it; each rendered instance is
     * notified through the callbacks of its latest render.
     */
    public List<TableInstance> release(String id) {
        List<TableInstance> released = new ArrayList<>();
        String childPrefix = id + CHILD_SEPARATOR;
        instances.asMap().entrySet().removeIf(entry -> {
            if (entry.getKey().equals(id) || entry.getKey().startsWith(childPrefix)) {
                released.add(entry.getValue());
                return true;
            }
            return false;
        });
        for (TableInstance instance : released) {
            RenderedTable last = instance.lastRender();
            if (last != null && last.table() != null) {
                last.callbacks().onUnmount(last.table());
            }
        }
        log.debug("Released {} table instance(s) under '{}'", released.size(), id);
        return released;
    }

    long size() {
        instances.cleanUp();
        return instances.estimatedSize();
    }
}
