package com.tablesmith.core.assets;

import com.tablesmith.core.migration.operations.CreateOrAlterRoutineOp;
import com.tablesmith.core.migration.operations.CreateOrAlterTriggerOp;
import com.tablesmith.core.migration.operations.CreateOrAlterViewOp;
import com.tablesmith.core.migration.operations.MigrationOperation;

/**
 * A programmable object (view, routine or trigger) kept as a SQL script.
 */
public record DbAsset(String schema, String name, DbAssetKind kind, String sql) {

    public String hash() {
        return AssetHasher.hash(sql);
    }

    public MigrationOperation toOperation() {
        switch (kind) {
            case VIEW:
                return new CreateOrAlterViewOp(schema, name, sql);
            case TRIGGER:
                return new CreateOrAlterTriggerOp(schema, name, sql);
            default:
                return new CreateOrAlterRoutineOp(schema, name, kind.routineKind(), sql);
        }
    }
}
