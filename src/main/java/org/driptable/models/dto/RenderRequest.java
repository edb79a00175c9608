package org.driptable.models.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.driptable.models.schema.SubtableOverrideRule;
import org.driptable.models.schema.TableSchema;

import java.util.List;
import java.util.Map;

/**
 * Render call. {@code validation} is {@code false} to skip validation or an object with
 * {@code additionalProperties}; a missing {@code instanceId} mounts a new instance.
 */
public record RenderRequest(
        @Pattern(regexp = "^[A-Za-z0-9_-]{1,64}$", message = "instanceId may only contain letters, digits, '_' and '-'")
        String instanceId,
        TableSchema schema,
        List<Map<String, Object>> dataSource,
        List<Object> selectedRowKeys,
        List<String> displayColumnKeys,
        List<Object> expandedRowKeys,
        @Positive Integer currentPage,
        @PositiveOrZero Integer total,
        Boolean loading,
        Object ext,
        List<SubtableOverrideRule> subtableOverrides,
        JsonNode validation
) {
}
