package com.tablesmith.core.builder;

import com.tablesmith.core.SchemaDefinitionException;
import com.tablesmith.core.schema.DbCheck;
import com.tablesmith.core.schema.DbColumn;
import com.tablesmith.core.schema.DbForeignKey;
import com.tablesmith.core.schema.DbTable;
import com.tablesmith.core.schema.ReferentialAction;
import com.tablesmith.core.schema.SchemaModel;
import com.tablesmith.core.types.ColumnType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SchemaModelBuilderTest {

    private final SchemaModelBuilder builder = new SchemaModelBuilder();

    @Test
    void mapsTableAndSchemaNames() {
        SchemaModel model = builder.build(SampleEntities.User.class, SampleEntities.Order.class, SampleEntities.OrderLine.class);

        assertTrue(model.findTable("dbo", "Users").isPresent());
        assertTrue(model.findTable("sales", "Orders").isPresent());
        assertTrue(model.findTable("DBO", "orderline").isPresent(), "lookups ignore case");
        assertEquals(3, model.allTables().size());
    }

    @Test
    void columnsFollowDeclarationOrderWithSuperclassFirst() {
        DbTable users = users();

        List<String> names = users.columns().stream().map(DbColumn::name).collect(Collectors.toList());
        assertEquals(List.of("createdAt", "id", "Email", "country", "Balance", "age", "score", "active", "settings"), names);
    }

    @Test
    void ignoredTransientAndStaticFieldsAreNotMapped() {
        DbTable users = users();

        assertTrue(users.findColumn("scratch").isEmpty());
        assertTrue(users.findColumn("cache").isEmpty());
        assertTrue(users.findColumn("instances").isEmpty());
    }

    @Test
    void nullabilityComesFromAnnotationsOnly() {
        DbTable users = users();

        assertFalse(column(users, "id").nullable(), "primary key");
        assertFalse(column(users, "Email").nullable(), "@NotNull");
        assertFalse(column(users, "createdAt").nullable(), "inherited @NotNull");
        assertTrue(column(users, "age").nullable());
        assertTrue(column(users, "score").nullable(), "primitive without @NotNull stays nullable");
    }

    @Test
    void typesAreRefinedByLengthAndPrecision() {
        DbTable users = users();

        assertEquals(new ColumnType.StringType(200, null, true), column(users, "Email").type());
        assertEquals(new ColumnType.StringType(null, 2, true), column(users, "country").type());
        assertEquals(new ColumnType.DecimalType(10, 2), column(users, "Balance").type());
        assertEquals(ColumnType.json(), column(users, "settings").type());
        assertEquals(ColumnType.int32(), column(users, "score").type());
        assertEquals(ColumnType.dateTime(), column(users, "createdAt").type());
    }

    @Test
    void incrementalKeyAndDefaults() {
        DbTable users = users();

        DbColumn id = column(users, "id");
        assertTrue(id.incrementalKey());
        assertEquals(1L, id.startWith());
        assertEquals(1L, id.incrementBy());
        assertNull(id.sequenceName());

        assertEquals(Boolean.TRUE, column(users, "active").defaultValue());
    }

    @Test
    void primaryKeyUsesConventionalName() {
        DbTable users = users();

        assertEquals("PK_Users", users.primaryKey().name());
        assertEquals(List.of("id"), users.primaryKey().columns());
    }

    @Test
    void compositePrimaryKeyIsOrderedAndKeepsExplicitName() {
        DbTable lines = builder.build(SampleEntities.OrderLine.class).findTable("dbo", "OrderLine").orElseThrow();

        assertEquals("PK_Lines", lines.primaryKey().name());
        assertEquals(List.of("orderId", "lineNo"), lines.primaryKey().columns());
    }

    @Test
    void uniqueGroupsAreCaseInsensitiveAndOrdered() {
        DbTable orders = builder.build(SampleEntities.Order.class, SampleEntities.User.class)
                .findTable("sales", "Orders").orElseThrow();

        assertEquals(1, orders.uniques().size());
        assertEquals("UQ_OrderNumber", orders.uniques().get(0).name());
        assertEquals(List.of("number", "region"), orders.uniques().get(0).columns());
    }

    @Test
    void checksAreClassLevelFirst() {
        DbTable users = users();

        assertEquals(2, users.checks().size());
        assertEquals("CK_Users_1", users.checks().get(0).name());
        assertEquals("[Balance] >= 0", users.checks().get(0).expression());
        assertEquals("CK_Users_age", users.checks().get(1).name());
    }

    @Test
    void indexColumnsResolveFieldNamesToColumnNames() {
        DbTable users = users();

        assertEquals(1, users.indexes().size());
        assertEquals("IX_Users_Email_createdAt", users.indexes().get(0).name());
        assertEquals(List.of("Email", "createdAt"), users.indexes().get(0).columns());
        assertFalse(users.indexes().get(0).unique());
    }

    @Test
    void foreignKeyResolvesReferencedTable() {
        DbTable orders = builder.build(SampleEntities.Order.class, SampleEntities.User.class)
                .findTable("sales", "Orders").orElseThrow();

        DbForeignKey fk = orders.foreignKeys().get(0);
        assertEquals("FK_Orders_Users_userId", fk.name());
        assertEquals(List.of("userId"), fk.columns());
        assertEquals("dbo", fk.refSchema());
        assertEquals("Users", fk.refTable());
        assertEquals(List.of("id"), fk.refColumns());
        assertEquals(ReferentialAction.CASCADE, fk.onDelete());
        assertEquals(ReferentialAction.NO_ACTION, fk.onUpdate());
    }

    @Test
    void conventionalNamesCanBeTurnedOff() {
        SchemaModelBuilder plain = new SchemaModelBuilder(SchemaModelBuilderOptions.builder()
                .conventionalConstraintNames(false)
                .build());
        SchemaModel model = plain.build(SampleEntities.User.class, SampleEntities.Order.class);

        DbTable users = model.findTable("dbo", "Users").orElseThrow();
        DbTable orders = model.findTable("sales", "Orders").orElseThrow();
        assertEquals("PK", users.primaryKey().name());
        assertEquals("CK", users.checks().get(0).name());
        assertEquals("OrderNumber", orders.uniques().get(0).name());
        assertEquals("FK", orders.foreignKeys().get(0).name());
    }

    @Test
    void defaultSchemaIsConfigurable() {
        SchemaModel model = new SchemaModelBuilder(SchemaModelBuilderOptions.builder().defaultSchema("app").build())
                .build(SampleEntities.OrderLine.class);

        assertTrue(model.findTable("app", "OrderLine").isPresent());
    }

    @Test
    void requireTableAnnotationSkipsUntaggedClasses() {
        SchemaModelBuilder strict = new SchemaModelBuilder(SchemaModelBuilderOptions.builder()
                .requireTableAnnotation(true)
                .build());

        SchemaModel model = strict.build(SampleEntities.User.class, SampleEntities.OrderLine.class);

        assertEquals(1, model.allTables().size());
        assertEquals("Users", model.allTables().get(0).name());
    }

    @Test
    void requireTableAnnotationRejectsForeignKeyToUntaggedClass() {
        SchemaModelBuilder strict = new SchemaModelBuilder(SchemaModelBuilderOptions.builder()
                .requireTableAnnotation(true)
                .build());

        SchemaDefinitionException e = assertThrows(SchemaDefinitionException.class,
                () -> strict.build(SampleEntities.PointsAtUntagged.class));
        assertTrue(e.getMessage().contains("Untagged"), e.getMessage());
    }

    @Test
    void lengthOnNonStringFails() {
        assertFailsNaming(SampleEntities.LengthOnInt.class, "LengthOnInt.count");
    }

    @Test
    void maxLengthAndFixedLengthAreMutuallyExclusive() {
        assertFailsNaming(SampleEntities.BothLengths.class, "BothLengths.code");
    }

    @Test
    void precisionOnNonDecimalFails() {
        assertFailsNaming(SampleEntities.PrecisionOnDouble.class, "PrecisionOnDouble.ratio");
    }

    @Test
    void scaleLargerThanPrecisionFails() {
        assertFailsNaming(SampleEntities.ScaleTooLarge.class, "ScaleTooLarge.amount");
    }

    @Test
    void nonPositiveLengthFails() {
        assertFailsNaming(SampleEntities.NegativeLength.class, "NegativeLength.name");
    }

    @Test
    void missingForeignKeyTargetFieldFails() {
        assertFailsNaming(SampleEntities.MissingReference.class, "User.nope");
    }

    @Test
    void unknownIndexColumnFails() {
        assertFailsNaming(SampleEntities.BadIndex.class, "missing");
    }

    @Test
    void repeatedFieldChecksGetDistinctNames() {
        DbTable products = builder.build(SampleEntities.Product.class).findTable("dbo", "Products").orElseThrow();

        assertEquals(List.of("CK_Products_price", "CK_Products_price_2"),
                products.checks().stream().map(DbCheck::name).collect(Collectors.toList()));
        assertEquals("[price] < 1000000", products.checks().get(1).expression());
    }

    @Test
    void fallbackNamesStayDistinctWhenConventionsAreOff() {
        SchemaModelBuilder plain = new SchemaModelBuilder(SchemaModelBuilderOptions.builder()
                .conventionalConstraintNames(false)
                .build());
        DbTable products = plain.build(SampleEntities.Product.class).findTable("dbo", "Products").orElseThrow();

        assertEquals(List.of("CK", "CK_2"),
                products.checks().stream().map(DbCheck::name).collect(Collectors.toList()));
    }

    @Test
    void explicitConstraintNameClashFails() {
        assertFailsNaming(SampleEntities.ClashingChecks.class, "ck_range");
    }

    @Test
    void unparsableDefaultFails() {
        assertFailsNaming(SampleEntities.BadDefault.class, "BadDefault.count");
        assertFailsNaming(SampleEntities.NotANumberDefault.class, "NotANumberDefault.ratio");
        assertFailsNaming(SampleEntities.InfiniteDefault.class, "InfiniteDefault.ratio");
    }

    @Test
    void duplicateColumnNamesFail() {
        assertFailsNaming(SampleEntities.DuplicateColumns.class, "DuplicateColumns.second");
    }

    private DbTable users() {
        return builder.build(SampleEntities.User.class).findTable("dbo", "Users").orElseThrow();
    }

    private static DbColumn column(DbTable table, String name) {
        return table.findColumn(name).orElseThrow(() -> new AssertionError("no column " + name));
    }

    private void assertFailsNaming(Class<?> entity, String fragment) {
        SchemaDefinitionException e = assertThrows(SchemaDefinitionException.class, () -> builder.build(entity));
        assertTrue(e.getMessage().contains(fragment), "expected '" + fragment + "' in: " + e.getMessage());
    }
}
