package org.driptable.service.components;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in renderers, collected from every {@link CellRenderer} bean.
 */
@Slf4j
@Component
public class ComponentRegistry {

    private final Map<String, CellRenderer> builtIns;

    public ComponentRegistry(List<CellRenderer> renderers) {
        Map<String, CellRenderer> byName = new LinkedHashMap<>();
        for (CellRenderer renderer : renderers) {
            CellRenderer existing = byName.putIfAbsent(renderer.name(), renderer);
            if (existing != null) {
                log.warn("Ignoring duplicate built-in component '{}' ({}), keeping {}",
                        renderer.name(), renderer.getClass().getName(), existing.getClass().getName());
            }
        }
        this.builtIns = Collections.unmodifiableMap(byName);
        log.info("Registered built-in components: {}", builtIns.keySet());
    }

    public Map<String, CellRenderer> builtIns() {
        return builtIns;
    }

    public ComponentResolver resolver(Map<String, Map<String, CellRenderer>> libraries) {
        return new ComponentResolver(builtIns, libraries);
    }
}
