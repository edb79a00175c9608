package org.driptable.service.components;

import org.driptable.models.render.RenderNode;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ComponentResolverTest {

    private final CellRenderer text = renderer("text");
    private final CellRenderer rating = renderer("rating");
    private final ComponentResolver resolver = new ComponentResolver(
            Map.of("text", text),
            Map.of("custom", Map.of("rating", rating)));

    @Test
    void resolvesBareIdentifiersAmongBuiltIns() {
        assertThat(resolver.resolve("text")).containsSame(text);
        assertThat(resolver.resolve("rating")).isEmpty();
    }

    @Test
    void resolvesNamespacedIdentifiersInHostLibraries() {
        assertThat(resolver.resolve("custom::rating")).containsSame(rating);
        assertThat(resolver.resolve("custom::text")).isEmpty();
        assertThat(resolver.resolve("other::rating")).isEmpty();
    }

    @Test
    void neverThrowsForMalformedIdentifiers() {
        assertThat(resolver.resolve(null)).isEmpty();
        assertThat(resolver.resolve("")).isEmpty();
        assertThat(resolver.resolve("::rating")).isEmpty();
        assertThat(resolver.resolve("custom::")).isEmpty();
        assertThat(new ComponentResolver(null, null).resolve("text")).isEmpty();
    }

    private static CellRenderer renderer(String name) {
        return new CellRenderer() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public RenderNode render(CellContext context) {
                return RenderNode.text(name);
            }
        };
    }
}
