package org.driptable.models.dto;

import jakarta.validation.constraints.NotNull;

import java.util.List;

public record SelectionRequest(
        @NotNull(message = "selectedRowKeys is required")
        List<Object> selectedRowKeys
) {
}
