package com.tablesmith.cli.commands;

import com.tablesmith.core.builder.SchemaModelBuilder;
import com.tablesmith.core.builder.SchemaModelBuilderOptions;
import com.tablesmith.core.schema.SchemaModel;
import com.tablesmith.dialects.sqlserver.SqlServerDdlGenerator;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
        name = "script",
        description = "Print an idempotent SQL Server bootstrap script for annotated entity classes",
        mixinStandardHelpOptions = true
)
public class ScriptCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = {"--entity", "-e"}, required = true, arity = "1..*",
            description = "Fully qualified entity class name (repeatable)")
    private List<String> entities;

    @Option(names = {"--default-schema"}, defaultValue = SchemaModelBuilderOptions.DEFAULT_SCHEMA,
            description = "Schema for entities without @Table(schema) (default: ${DEFAULT-VALUE})")
    private String defaultSchema;

    @Option(names = {"--require-table"}, description = "Skip classes without @Table")
    private boolean requireTable;

    @Option(names = {"--output", "-o"}, description = "Output file (default: stdout)")
    private File output;

    @Override
    public Integer call() {
        try {
            SchemaModel model = new SchemaModelBuilder(SchemaModelBuilderOptions.builder()
                    .defaultSchema(defaultSchema)
                    .requireTableAnnotation(requireTable)
                    .build())
                    .build(EntityClasses.load(entities));

            String script = toScript(new SqlServerDdlGenerator().generate(model));

            if (output != null) {
                Files.writeString(output.toPath(), script, StandardCharsets.UTF_8);
                spec.commandLine().getOut().println("Script written to " + output.getAbsolutePath());
            } else {
                spec.commandLine().getOut().print(script);
            }
            spec.commandLine().getOut().flush();
            return 0;
        } catch (RuntimeException | IOException e) {
            PrintWriter err = spec.commandLine().getErr();
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }

    static String toScript(List<String> batches) {
        StringBuilder sb = new StringBuilder();
        for (String batch : batches) {
            sb.append(batch).append("\nGO\n\n");
        }
        return sb.toString();
    }
}
