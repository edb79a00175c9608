package org.driptable.service.events;

public record SearchParams(Object searchKey, String searchStr) {
}
