package com.tablesmith.core.migration.operations;

/**
 * One atomic, explicitly authored schema change. Operations are immutable and are consumed once
 * by a {@link com.tablesmith.core.migration.MigrationSqlGenerator}.
 */
public sealed interface MigrationOperation permits
        SqlOp,
        CreateTableOp, DropTableOp,
        AddColumnOp, DropColumnOp,
        AddPrimaryKeyOp, DropPrimaryKeyOp,
        AddUniqueOp, DropUniqueOp,
        AddCheckOp, DropCheckOp,
        CreateIndexOp, DropIndexOp,
        AddForeignKeyOp, DropForeignKeyOp,
        CreateOrAlterViewOp, DropViewOp,
        CreateOrAlterRoutineOp, DropRoutineOp,
        CreateOrAlterTriggerOp, DropTriggerOp,
        CustomOperation {
}
