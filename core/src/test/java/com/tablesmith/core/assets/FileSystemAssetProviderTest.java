package com.tablesmith.core.assets;

import com.tablesmith.core.migration.operations.CreateOrAlterRoutineOp;
import com.tablesmith.core.migration.operations.CreateOrAlterTriggerOp;
import com.tablesmith.core.migration.operations.CreateOrAlterViewOp;
import com.tablesmith.core.migration.operations.RoutineKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemAssetProviderTest {

    @TempDir
    Path root;

    @Test
    void loadsAssetsByDirectoryKindInPathOrder() throws IOException {
        write("Views/dbo.vw_Active.sql", "CREATE OR ALTER VIEW dbo.vw_Active AS SELECT 1 AS x");
        write("Procedures/sales.sp_List.sql", "CREATE OR ALTER PROCEDURE sales.sp_List AS SELECT 1");
        write("FunctionsScalar/fn_One.sql", "CREATE OR ALTER FUNCTION dbo.fn_One() RETURNS INT AS BEGIN RETURN 1 END");
        write("FunctionsTable/dbo.tf_All.sql", "CREATE OR ALTER FUNCTION dbo.tf_All() RETURNS TABLE AS RETURN SELECT 1 AS x");
        write("Triggers/dbo.tr_Audit.sql", "CREATE OR ALTER TRIGGER dbo.tr_Audit ON dbo.Users AFTER INSERT AS SELECT 1");
        write("Views/readme.txt", "not an asset");

        List<DbAsset> assets = new FileSystemAssetProvider(root).getAssets();

        assertEquals(List.of("fn_One", "tf_All", "sp_List", "tr_Audit", "vw_Active"),
                assets.stream().map(DbAsset::name).collect(Collectors.toList()));

        assertEquals(DbAssetKind.SCALAR_FUNCTION, assets.get(0).kind());
        assertEquals("dbo", assets.get(0).schema(), "name.sql uses the default schema");
        assertEquals(DbAssetKind.TABLE_FUNCTION, assets.get(1).kind());
        assertEquals(DbAssetKind.PROCEDURE, assets.get(2).kind());
        assertEquals("sales", assets.get(2).schema());
        assertEquals(DbAssetKind.TRIGGER, assets.get(3).kind());
        assertEquals(DbAssetKind.VIEW, assets.get(4).kind());
    }

    @Test
    void nestedDirectoriesUseTheNearestKnownKind() {
        assertEquals(DbAssetKind.VIEW, FileSystemAssetProvider.inferKind(Path.of("Procedures", "VIEWS", "a.sql")));
        assertEquals(DbAssetKind.TRIGGER, FileSystemAssetProvider.inferKind(Path.of("triggers", "misc", "a.sql")));
        assertEquals(DbAssetKind.PROCEDURE, FileSystemAssetProvider.inferKind(Path.of("other", "a.sql")));
        assertEquals(DbAssetKind.PROCEDURE, FileSystemAssetProvider.inferKind(Path.of("a.sql")));
    }

    @Test
    void missingDirectoryYieldsNoAssets() {
        assertTrue(new FileSystemAssetProvider(root.resolve("absent")).getAssets().isEmpty());
    }

    @Test
    void assetsTranslateToCreateOrAlterOperations() {
        String sql = "CREATE OR ALTER VIEW dbo.v AS SELECT 1 AS x";

        assertEquals(new CreateOrAlterViewOp("dbo", "v", sql),
                new DbAsset("dbo", "v", DbAssetKind.VIEW, sql).toOperation());
        assertEquals(new CreateOrAlterTriggerOp("dbo", "t", sql),
                new DbAsset("dbo", "t", DbAssetKind.TRIGGER, sql).toOperation());
        assertEquals(new CreateOrAlterRoutineOp("dbo", "f", RoutineKind.TABLE_FUNCTION, sql),
                new DbAsset("dbo", "f", DbAssetKind.TABLE_FUNCTION, sql).toOperation());
        assertEquals(new CreateOrAlterRoutineOp("dbo", "p", RoutineKind.PROCEDURE, sql),
                new DbAsset("dbo", "p", DbAssetKind.PROCEDURE, sql).toOperation());
    }

    private void write(String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
