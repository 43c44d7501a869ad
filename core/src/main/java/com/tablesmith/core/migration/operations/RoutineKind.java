package com.tablesmith.core.migration.operations;

public enum RoutineKind {
    PROCEDURE,
    SCALAR_FUNCTION,
    TABLE_FUNCTION
}
