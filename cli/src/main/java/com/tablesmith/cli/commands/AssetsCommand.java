package com.tablesmith.cli.commands;

import com.tablesmith.core.assets.DbAsset;
import com.tablesmith.core.assets.FileSystemAssetProvider;
import com.tablesmith.core.migration.operations.MigrationOperation;
import com.tablesmith.dialects.sqlserver.SqlServerMigrationSqlGenerator;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

@Command(
        name = "assets",
        description = "Print the batches that create or alter the views, routines and triggers in an asset directory",
        mixinStandardHelpOptions = true
)
public class AssetsCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = {"--dir", "-d"}, required = true, description = "Asset root directory")
    private Path dir;

    @Option(names = {"--list"}, description = "List assets with their content hash instead of printing SQL")
    private boolean list;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            List<DbAsset> assets = new FileSystemAssetProvider(dir).getAssets();

            if (list) {
                for (DbAsset asset : assets) {
                    out.println(asset.kind() + "\t" + asset.schema() + "." + asset.name() + "\t" + asset.hash());
                }
            } else {
                List<MigrationOperation> operations = assets.stream()
                        .map(DbAsset::toOperation)
                        .collect(Collectors.toList());
                out.print(ScriptCommand.toScript(new SqlServerMigrationSqlGenerator().generate(operations)));
            }
            out.flush();
            return 0;
        } catch (RuntimeException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            spec.commandLine().getErr().flush();
            return 1;
        }
    }
}
