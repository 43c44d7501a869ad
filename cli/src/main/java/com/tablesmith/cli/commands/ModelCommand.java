package com.tablesmith.cli.commands;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tablesmith.core.builder.SchemaModelBuilder;
import com.tablesmith.core.builder.SchemaModelBuilderOptions;
import com.tablesmith.core.schema.SchemaModel;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
        name = "model",
        description = "Build the schema model for annotated entity classes and print it as JSON",
        mixinStandardHelpOptions = true
)
public class ModelCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = {"--entity", "-e"}, required = true, arity = "1..*",
            description = "Fully qualified entity class name (repeatable)")
    private List<String> entities;

    @Option(names = {"--default-schema"}, defaultValue = SchemaModelBuilderOptions.DEFAULT_SCHEMA,
            description = "Schema for entities without @Table(schema) (default: ${DEFAULT-VALUE})")
    private String defaultSchema;

    @Option(names = {"--output", "-o"}, description = "Output file (default: stdout)")
    private File output;

    @Override
    public Integer call() {
        try {
            SchemaModel model = new SchemaModelBuilder(SchemaModelBuilderOptions.builder()
                    .defaultSchema(defaultSchema)
                    .build())
                    .build(EntityClasses.load(entities));

            ObjectMapper mapper = objectMapper();

            if (output != null) {
                mapper.writeValue(output, model);
                spec.commandLine().getOut().println("Model written to " + output.getAbsolutePath());
            } else {
                spec.commandLine().getOut().println(mapper.writeValueAsString(model));
            }
            spec.commandLine().getOut().flush();
            return 0;
        } catch (RuntimeException | IOException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            spec.commandLine().getErr().flush();
            return 1;
        }
    }

    static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // marker types such as Int32Type carry only their "kind"
        mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        return mapper;
    }
}
