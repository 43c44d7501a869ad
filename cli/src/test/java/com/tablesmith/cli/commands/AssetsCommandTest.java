package com.tablesmith.cli.commands;

import com.tablesmith.cli.CliTestSupport;
import com.tablesmith.core.assets.AssetHasher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AssetsCommandTest {
    private static final String VIEW = "CREATE OR ALTER VIEW dbo.vw_Active AS SELECT 1 AS x";

    @TempDir
    Path dir;

    @BeforeEach
    void setUp() throws IOException {
        Files.createDirectories(dir.resolve("Views"));
        Files.writeString(dir.resolve("Views").resolve("dbo.vw_Active.sql"), VIEW + "\nGO\n");
    }

    @Test
    void printsCreateOrAlterBatches() {
        CliTestSupport result = CliTestSupport.run("assets", "-d", dir.toString());

        assertEquals(0, result.exitCode, result.err);
        assertEquals(VIEW + "\nGO\n\n", result.out);
    }

    @Test
    void listsAssetsWithTheirHashes() {
        CliTestSupport result = CliTestSupport.run("assets", "--list", "-d", dir.toString());

        assertEquals(0, result.exitCode, result.err);
        assertEquals("VIEW\tdbo.vw_Active\t" + AssetHasher.hash(VIEW + "\nGO\n"), result.out.strip());
    }

    @Test
    void missingDirectoryPrintsNothing() {
        CliTestSupport result = CliTestSupport.run("assets", "-d", dir.resolve("absent").toString());

        assertEquals(0, result.exitCode, result.err);
        assertEquals("", result.out);
    }
}
