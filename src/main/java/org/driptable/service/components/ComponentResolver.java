package org.driptable.service.components;

import java.util.Map;
import java.util.Optional;

/**
 * Maps a component identifier to a renderer. Bare names are looked up among the built-in
 * renderers, {@code "library::name"} in the host supplied libraries. Never throws.
 */
public class ComponentResolver {

    public static final String SEPARATOR = "::";

    private final Map<String, CellRenderer> builtIns;
    private final Map<String, Map<String, CellRenderer>> libraries;

    public ComponentResolver(Map<String, CellRenderer> builtIns, Map<String, Map<String, CellRenderer>> libraries) {
        this.builtIns = builtIns != null ? builtIns : Map.of();
        this.libraries = libraries != null ? libraries : Map.of();
    }

    public Optional<CellRenderer> resolve(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return Optional.empty();
        }
        int separator = identifier.indexOf(SEPARATOR);
        if (separator < 0) {
            return Optional.ofNullable(builtIns.get(identifier));
        }
        String library = identifier.substring(0, separator);
        String name = identifier.substring(separator + SEPARATOR.length());
        if (library.isEmpty() || name.isEmpty()) {
            return Optional.empty();
        }
        Map<String, CellRenderer> components = libraries.get(library);
        return components == null ? Optional.empty() : Optional.ofNullable(components.get(name));
    }
}
