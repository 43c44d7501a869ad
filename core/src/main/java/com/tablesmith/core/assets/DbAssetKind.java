package com.tablesmith.core.assets;

import com.tablesmith.core.migration.operations.RoutineKind;

public enum DbAssetKind {
    VIEW("views"),
    PROCEDURE("procedures"),
    SCALAR_FUNCTION("functionsscalar"),
    TABLE_FUNCTION("functionstable"),
    TRIGGER("triggers");

    private final String directory;

    DbAssetKind(String directory) {
        this.directory = directory;
    }

    /**
     * Conventional directory name for assets of this kind, matched case-insensitively.
     */
    public String directory() {
        return directory;
    }

    RoutineKind routineKind() {
        switch (this) {
            case SCALAR_FUNCTION:
                return RoutineKind.SCALAR_FUNCTION;
            case TABLE_FUNCTION:
                return RoutineKind.TABLE_FUNCTION;
            case PROCEDURE:
                return RoutineKind.PROCEDURE;
            default:
                throw new IllegalStateException(this + " is not a routine");
        }
    }
}
