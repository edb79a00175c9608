package org.driptable.models.dto;

import jakarta.validation.constraints.NotNull;

import java.util.List;

public record DisplayColumnsRequest(
        @NotNull(message = "displayColumnKeys is required")
        List<String> displayColumnKeys
) {
}
