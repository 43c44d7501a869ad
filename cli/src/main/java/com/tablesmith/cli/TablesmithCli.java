package com.tablesmith.cli;

import com.tablesmith.cli.commands.AssetsCommand;
import com.tablesmith.cli.commands.MigrateCommand;
import com.tablesmith.cli.commands.ModelCommand;
import com.tablesmith.cli.commands.ScriptCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(
        name = "tablesmith",
        description = "Build schema models from annotated classes, generate SQL Server DDL and apply migrations",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        subcommands = {
                ScriptCommand.class,
                ModelCommand.class,
                MigrateCommand.class,
                AssetsCommand.class
        }
)
public class TablesmithCli implements Runnable {

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TablesmithCli()).execute(args);
        System.exit(exitCode);
    }
}
