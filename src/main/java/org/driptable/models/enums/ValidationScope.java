package org.driptable.models.enums;

public enum ValidationScope {
    PROP,
    COLUMN
}
