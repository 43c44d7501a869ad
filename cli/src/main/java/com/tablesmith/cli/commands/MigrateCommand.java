package com.tablesmith.cli.commands;

import com.tablesmith.core.MigrationExecutionException;
import com.tablesmith.core.TablesmithException;
import com.tablesmith.core.migration.Migration;
import com.tablesmith.core.migration.MigrationReport;
import com.tablesmith.core.migration.MigratorOptions;
import com.tablesmith.dialects.sqlserver.SqlServerConfig;
import com.tablesmith.dialects.sqlserver.SqlServerMigrationHistoryRepository;
import com.tablesmith.dialects.sqlserver.SqlServerMigrationLockProvider;
import com.tablesmith.dialects.sqlserver.SqlServerMigrationPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

@Command(
        name = "migrate",
        description = "Apply pending migrations to a SQL Server database",
        mixinStandardHelpOptions = true
)
public class MigrateCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(MigrateCommand.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"--jdbc-url"}, required = true, description = "JDBC connection URL, including databaseName")
    private String jdbcUrl;

    @Option(names = {"--username", "-u"}, description = "Database username")
    private String username;

    @Option(names = {"--password", "-p"}, description = "Database password")
    private String password;

    @Option(names = {"--scope"}, defaultValue = MigratorOptions.DEFAULT_SCOPE,
            description = "Advisory lock scope (default: ${DEFAULT-VALUE})")
    private String scope;

    @Option(names = {"--product-version"}, defaultValue = MigratorOptions.DEFAULT_PRODUCT_VERSION,
            description = "Value recorded in the history ledger (default: ${DEFAULT-VALUE})")
    private String productVersion;

    @Option(names = {"--timeout"}, defaultValue = "" + MigratorOptions.DEFAULT_COMMAND_TIMEOUT_SECONDS,
            description = "Per-batch timeout in seconds (default: ${DEFAULT-VALUE})")
    private int timeoutSeconds;

    @Option(names = {"--lock-timeout-ms"}, defaultValue = "" + SqlServerMigrationLockProvider.DEFAULT_TIMEOUT_MS,
            description = "How long to wait for the migration lock (default: ${DEFAULT-VALUE})")
    private int lockTimeoutMs;

    @Option(names = {"--history-schema"}, defaultValue = SqlServerMigrationHistoryRepository.DEFAULT_SCHEMA,
            description = "Schema of the history table (default: ${DEFAULT-VALUE})")
    private String historySchema;

    @Option(names = {"--history-table"}, defaultValue = SqlServerMigrationHistoryRepository.DEFAULT_TABLE,
            description = "Name of the history table (default: ${DEFAULT-VALUE})")
    private String historyTable;

    @Option(names = {"--create-database"}, description = "Create the target database if it is missing")
    private boolean createDatabase;

    @Option(names = {"--migration", "-m"}, arity = "1..*",
            description = "Migration class name; added to those registered with ServiceLoader")
    private List<String> migrationClasses = new ArrayList<>();

    @Override
    public Integer call() {
        SqlServerConfig config = new SqlServerConfig();
        config.jdbcUrl = jdbcUrl;
        config.username = username;
        config.password = password;
        config.lockTimeoutMs = lockTimeoutMs;
        config.historySchema = historySchema;
        config.historyTable = historyTable;
        config.createDatabase = createDatabase;

        MigratorOptions options = MigratorOptions.builder()
                .scope(scope)
                .productVersion(productVersion)
                .commandTimeoutSeconds(timeoutSeconds)
                .build();

        try (SqlServerMigrationPlugin plugin = new SqlServerMigrationPlugin()) {
            List<Migration> migrations = discover(migrationClasses);
            MigrationReport report = plugin.migrate(config, options, migrations);

            if (report.upToDate()) {
                spec.commandLine().getOut().println("Database is up to date (" + report.skipped().size()
                        + " migrations already applied)");
            } else {
                report.applied().forEach(id -> spec.commandLine().getOut().println("Applied " + id));
            }
            spec.commandLine().getOut().flush();
            return 0;
        } catch (RuntimeException e) {
            if (e instanceof MigrationExecutionException failed) {
                logger.error("Migration {} failed", failed.getMigrationId(), failed);
            }
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            spec.commandLine().getErr().flush();
            return 1;
        }
    }

    /**
     * ServiceLoader registrations first, then explicit class names. A class found both ways is
     * only used once.
     */
    static List<Migration> discover(List<String> classNames) {
        Map<String, Migration> byClass = new LinkedHashMap<>();

        for (Migration migration : ServiceLoader.load(Migration.class)) {
            byClass.putIfAbsent(migration.getClass().getName(), migration);
        }

        for (Class<?> type : EntityClasses.load(classNames)) {
            if (!Migration.class.isAssignableFrom(type)) {
                throw new TablesmithException(type.getName() + " does not extend " + Migration.class.getName());
            }
            if (!byClass.containsKey(type.getName())) {
                byClass.put(type.getName(), instantiate(type.asSubclass(Migration.class)));
            }
        }

        return new ArrayList<>(byClass.values());
    }

    private static Migration instantiate(Class<? extends Migration> type) {
        try {
            return type.getDeclaredConstructor().newInstance();
        } catch (NoSuchMethodException | InstantiationException | IllegalAccessException
                 | InvocationTargetException e) {
            throw new TablesmithException("Cannot instantiate migration " + type.getName()
                    + "; it needs a public no-argument constructor", e);
        }
    }
}
