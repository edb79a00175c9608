package org.driptable.models.dto;

public record SearchRequest(
        Object searchKey,
        String searchStr
) {
}
