package org.driptable.utils;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DataIndexTest {

    private final Map<String, Object> record = Map.of(
            "name", "Ada",
            "address", Map.of("city", "London"),
            "tags", List.of("math", "engines"));

    @Test
    void projectsNestedFieldsAndListPositions() {
        assertThat(DataIndex.get(record, List.of("name"), null)).isEqualTo("Ada");
        assertThat(DataIndex.get(record, List.of("address", "city"), null)).isEqualTo("London");
        assertThat(DataIndex.get(record, List.of("tags", "1"), null)).isEqualTo("engines");
    }

    @Test
    void fallsBackToDefaultForMissingOrEmptyPaths() {
        assertThat(DataIndex.get(record, List.of("address", "zip"), "n/a")).isEqualTo("n/a");
        assertThat(DataIndex.get(record, List.of(), "n/a")).isEqualTo("n/a");
        assertThat(DataIndex.get(record, null, "n/a")).isEqualTo("n/a");
        assertThat(DataIndex.get(record, List.of("tags", "7"), "n/a")).isEqualTo("n/a");
    }

    @Test
    void writesIntoCopiesAlongThePath() {
        Map<String, Object> updated = DataIndex.set(record, List.of("address", "city"), "Paris");

        assertThat(DataIndex.get(updated, List.of("address", "city"), null)).isEqualTo("Paris");
        assertThat(DataIndex.get(record, List.of("address", "city"), null)).isEqualTo("London");
        assertThat(updated.get("tags")).isSameAs(record.get("tags"));
    }

    @Test
    void writesIntoListPositions() {
        Map<String, Object> updated = DataIndex.set(record, List.of("tags", "0"), "logic");

        assertThat(updated.get("tags")).isEqualTo(List.of("logic", "engines"));
        assertThat(record.get("tags")).isEqualTo(List.of("math", "engines"));
    }
}
