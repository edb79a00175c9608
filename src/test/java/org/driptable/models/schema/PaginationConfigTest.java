package org.driptable.models.schema;

import com.fasterxml.jackson.databind.JsonMappingException;
import org.driptable.EngineFixtures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PaginationConfigTest {

    @Test
    void quotedPageSizeIsRejected() {
        assertThatThrownBy(() -> read("{\"pageSize\":\"20\"}"))
                .isInstanceOf(JsonMappingException.class)
                .hasMessageContaining("pagination.pageSize must be integer");
    }

    @Test
    void mistypedFlagsAndLabelsAreRejected() {
        assertThatThrownBy(() -> read("{\"hideOnSinglePage\":\"yes\"}"))
                .isInstanceOf(JsonMappingException.class)
                .hasMessageContaining("pagination.hideOnSinglePage must be boolean");
        assertThatThrownBy(() -> read("{\"position\":1}"))
                .isInstanceOf(JsonMappingException.class)
                .hasMessageContaining("pagination.position must be string");
        assertThatThrownBy(() -> read("{\"pageSize\":2.5}"))
                .isInstanceOf(JsonMappingException.class)
                .hasMessageContaining("pagination.pageSize must be integer");
    }

    @Test
    void wellTypedSectionsStillParse() throws Exception {
        PaginationConfig config = read("{\"pageSize\":20,\"position\":\"bottomRight\",\"showSizeChanger\":null}");

        assertThat(config.enabled()).isTrue();
        assertThat(config.pageSize()).isEqualTo(20);
        assertThat(config.position()).isEqualTo("bottomRight");
        assertThat(config.showSizeChanger()).isNull();
        assertThat(read("false")).isEqualTo(PaginationConfig.DISABLED);
    }

    private static PaginationConfig read(String pagination) throws Exception {
        return EngineFixtures.MAPPER
                .readValue("{\"columns\":[],\"pagination\":" + pagination + "}", TableSchema.class)
                .pagination();
    }
}
