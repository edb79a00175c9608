package org.driptable.adapters;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PaginationDescriptor(
        String size,
        int pageSize,
        int total,
        int current,
        List<String> position,
        Boolean showLessItems,
        Boolean showQuickJumper,
        Boolean showSizeChanger,
        Boolean hideOnSinglePage
) {
}
