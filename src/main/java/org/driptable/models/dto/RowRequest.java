package org.driptable.models.dto;

import jakarta.validation.constraints.NotNull;

/**
 * Addresses one row by key. {@code expanded} is only read by the expand endpoint and defaults to
 * {@code true}.
 */
public record RowRequest(
        @NotNull(message = "rowKey is required")
        Object rowKey,
        Boolean expanded
) {
}
