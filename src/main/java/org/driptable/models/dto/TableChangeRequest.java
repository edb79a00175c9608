package org.driptable.models.dto;

import jakarta.validation.constraints.Positive;

import java.util.List;
import java.util.Map;

/**
 * Pagination and filter change; omitted fields keep their current value.
 */
public record TableChangeRequest(
        @Positive Integer current,
        @Positive Integer pageSize,
        Map<String, List<Object>> filters
) {
}
