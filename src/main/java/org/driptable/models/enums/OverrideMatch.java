package org.driptable.models.enums;

public enum OverrideMatch {
    DEFAULT,
    TABLE_ID,
    RECORD_KEYS,
    NONE
}
