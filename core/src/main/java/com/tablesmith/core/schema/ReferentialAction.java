package com.tablesmith.core.schema;

/**
 * Action taken on dependent rows when a referenced row is deleted or updated.
 */
public enum ReferentialAction {
    NO_ACTION,
    RESTRICT,
    CASCADE,
    SET_NULL,
    SET_DEFAULT
}
