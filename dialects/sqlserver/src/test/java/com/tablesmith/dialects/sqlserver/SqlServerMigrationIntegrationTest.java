package com.tablesmith.dialects.sqlserver;

import com.tablesmith.core.MigrationExecutionException;
import com.tablesmith.core.migration.Migration;
import com.tablesmith.core.migration.MigrationBuilder;
import com.tablesmith.core.migration.MigrationReport;
import com.tablesmith.core.migration.MigratorOptions;
import com.tablesmith.core.schema.DbColumn;
import com.tablesmith.core.schema.DbForeignKey;
import com.tablesmith.core.schema.DbPrimaryKey;
import com.tablesmith.core.schema.DbUnique;
import com.tablesmith.core.schema.ReferentialAction;
import com.tablesmith.core.schema.SchemaModel;
import com.tablesmith.core.types.ColumnType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;
import org.testcontainers.containers.MSSQLServerContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Testcontainers
@EnabledIfEnvironmentVariable(named = "TESTCONTAINERS", matches = "1")
class SqlServerMigrationIntegrationTest {

    @Container
    static MSSQLServerContainer<?> mssql = new MSSQLServerContainer<>("mcr.microsoft.com/mssql/server:2022-latest")
            .acceptLicense();

    private final SqlServerMigrationPlugin plugin = new SqlServerMigrationPlugin();

    @AfterEach
    void tearDown() {
        plugin.cleanUp();
    }

    @Test
    void bootstrapScriptCanRunTwice() throws SQLException {
        SchemaModel model = new SchemaModel();
        model.getOrAddSchema("boot").getOrAddTable("Owners", null)
                .addColumn(DbColumn.builder("Id", ColumnType.int32()).primaryKey(true).incrementalKey(null, 1L, 1L).build())
                .addColumn(DbColumn.builder("Email", ColumnType.string()).maxLength(200).nullable(false).build())
                .setPrimaryKey(new DbPrimaryKey("PK_Owners", List.of("Id")))
                .addUnique(new DbUnique("UQ_Owners_Email", List.of("Email")));
        model.getOrAddSchema("boot").getOrAddTable("Pets", null)
                .addColumn(DbColumn.builder("Id", ColumnType.guid()).primaryKey(true).build())
                .addColumn(DbColumn.builder("OwnerId", ColumnType.int32()).build())
                .setPrimaryKey(new DbPrimaryKey("PK_Pets", List.of("Id")))
                .addForeignKey(new DbForeignKey("FK_Pets_Owners_OwnerId", List.of("OwnerId"), "boot", "Owners",
                        List.of("Id"), ReferentialAction.SET_NULL, null));

        List<String> batches = new SqlServerDdlGenerator().generate(model);

        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            for (int run = 0; run < 2; run++) {
                for (String batch : batches) {
                    stmt.execute(batch);
                }
            }
            assertEquals(1, count(stmt, "SELECT COUNT(*) FROM sys.foreign_keys WHERE name = 'FK_Pets_Owners_OwnerId'"));
            assertEquals(1, count(stmt, "SELECT COUNT(*) FROM sys.key_constraints WHERE name = 'UQ_Owners_Email'"));
        }
    }

    @Test
    void appliesOnceAndRecordsHistory() throws SQLException {
        SqlServerConfig config = config();
        List<Migration> migrations = List.of(new CreateShop(), new SeedShop());

        MigrationReport first = plugin.migrate(config, MigratorOptions.defaults(), migrations);
        MigrationReport second = plugin.migrate(config, MigratorOptions.defaults(), migrations);

        assertEquals(List.of("20240101_000001_CreateShop", "20240101_000002_SeedShop"), first.applied());
        assertTrue(second.upToDate());
        assertEquals(2, second.skipped().size());

        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            assertEquals(1, count(stmt, "SELECT COUNT(*) FROM shop.Customers"));
            assertEquals(2, count(stmt, "SELECT COUNT(*) FROM dbo.__TablesmithMigrationsHistory"));
        }
    }

    @Test
    void failingMigrationLeavesNoTrace() throws SQLException {
        SqlServerConfig config = config();
        config.historyTable = "FailingHistory";

        MigrationExecutionException e = assertThrows(MigrationExecutionException.class,
                () -> plugin.migrate(config, MigratorOptions.defaults(), List.of(new Broken())));

        assertEquals(1, e.getBatchIndex());
        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            assertEquals(0, count(stmt, "SELECT COUNT(*) FROM sys.tables WHERE name = 'HalfDone'"));
            assertEquals(0, count(stmt, "SELECT COUNT(*) FROM dbo.FailingHistory"));
        }
    }

    private static SqlServerConfig config() {
        SqlServerConfig config = new SqlServerConfig();
        config.jdbcUrl = mssql.getJdbcUrl();
        config.username = mssql.getUsername();
        config.password = mssql.getPassword();
        return config;
    }

    private static Connection connect() throws SQLException {
        return DriverManager.getConnection(mssql.getJdbcUrl(), mssql.getUsername(), mssql.getPassword());
    }

    private static int count(Statement stmt, String sql) throws SQLException {
        try (ResultSet rs = stmt.executeQuery(sql)) {
            rs.next();
            return rs.getInt(1);
        }
    }

    static class CreateShop extends Migration {
        @Override
        public String id() {
            return "20240101_000001_CreateShop";
        }

        @Override
        public void up(MigrationBuilder migration) {
            migration.sql("CREATE SCHEMA shop;")
                    .createTable("shop", "Orders", t -> t
                            .identity("Id", ColumnType.int64())
                            .column("CustomerId", ColumnType.int32(), false)
                            .primaryKey("PK_Orders", "Id")
                            .foreignKey("FK_Orders_Customers", "CustomerId", "shop", "Customers", "Id",
                                    ReferentialAction.CASCADE))
                    .createTable("shop", "Customers", t -> t
                            .identity("Id", ColumnType.int32())
                            .column("Name", ColumnType.string(100), false)
                            .column("Active", ColumnType.bool(), false, true)
                            .primaryKey("PK_Customers", "Id"))
                    .createOrAlterView("shop", "ActiveCustomers",
                            "CREATE OR ALTER VIEW shop.ActiveCustomers AS SELECT Id, Name FROM shop.Customers WHERE Active = 1");
        }
    }

    static class SeedShop extends Migration {
        @Override
        public String id() {
            return "20240101_000002_SeedShop";
        }

        @Override
        public void up(MigrationBuilder migration) {
            migration.sql("INSERT INTO shop.Customers (Name) VALUES (N'Ada');");
        }
    }

    static class Broken extends Migration {
        @Override
        public String id() {
            return "20240101_000003_Broken";
        }

        @Override
        public void up(MigrationBuilder migration) {
            migration.sql("CREATE TABLE dbo.HalfDone (Id INT);")
                    .sql("INSERT INTO dbo.NoSuchTable VALUES (1);");
        }
    }
}
