package com.tablesmith.core.builder;

import com.tablesmith.core.SchemaDefinitionException;
import com.tablesmith.core.annotations.Check;
import com.tablesmith.core.annotations.Default;
import com.tablesmith.core.annotations.FixedLength;
import com.tablesmith.core.annotations.ForeignKey;
import com.tablesmith.core.annotations.IncrementalKey;
import com.tablesmith.core.annotations.Index;
import com.tablesmith.core.annotations.Json;
import com.tablesmith.core.annotations.MaxLength;
import com.tablesmith.core.annotations.NotNull;
import com.tablesmith.core.annotations.Precision;
import com.tablesmith.core.annotations.PrimaryKey;
import com.tablesmith.core.annotations.Table;
import com.tablesmith.core.annotations.Unique;
import com.tablesmith.core.schema.DbCheck;
import com.tablesmith.core.schema.DbColumn;
import com.tablesmith.core.schema.DbForeignKey;
import com.tablesmith.core.schema.DbIndex;
import com.tablesmith.core.schema.DbPrimaryKey;
import com.tablesmith.core.schema.DbTable;
import com.tablesmith.core.schema.DbUnique;
import com.tablesmith.core.schema.SchemaModel;
import com.tablesmith.core.types.ColumnType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Field;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds a {@link SchemaModel} from annotated entity classes.
 *
 * <p>Columns are nullable unless the field is marked {@link NotNull}, is part of the
 * {@link PrimaryKey} or is an {@link IncrementalKey}; the Java type's own nullability is not
 * consulted. Invalid annotation combinations fail immediately with a
 * {@link SchemaDefinitionException} naming the entity and field.
 */
public class SchemaModelBuilder {
    private static final Logger logger = LoggerFactory.getLogger(SchemaModelBuilder.class);

    private final SchemaModelBuilderOptions options;

    public SchemaModelBuilder(SchemaModelBuilderOptions options) {
        this.options = options;
    }

    public SchemaModelBuilder() {
        this(SchemaModelBuilderOptions.defaults());
    }

    public SchemaModel build(Class<?>... entities) {
        return build(Arrays.asList(entities));
    }

    public SchemaModel build(Collection<Class<?>> entities) {
        SchemaModel model = new SchemaModel();

        for (Class<?> entity : entities) {
            Table tableAnnotation = entity.getAnnotation(Table.class);
            if (options.requireTableAnnotation() && tableAnnotation == null) {
                logger.debug("Skipping {}: no @Table annotation", entity.getName());
                continue;
            }

            String schemaName = schemaName(entity);
            String tableName = tableName(entity);

            DbTable table = model.getOrAddSchema(schemaName).getOrAddTable(tableName, entity);
            buildColumns(table, entity);
            buildConstraints(table, entity);

            logger.debug("Mapped {} to {} ({} columns)", entity.getName(), table.qualifiedName(), table.columns().size());
        }

        logger.info("Built schema model: {}", model);
        return model;
    }

    private String schemaName(Class<?> entity) {
        Table t = entity.getAnnotation(Table.class);
        return t != null && !t.schema().isBlank() ? t.schema() : options.defaultSchema();
    }

    private String tableName(Class<?> entity) {
        Table t = entity.getAnnotation(Table.class);
        return t != null && !t.name().isBlank() ? t.name() : entity.getSimpleName();
    }

    private void buildColumns(DbTable table, Class<?> entity) {
        for (Field field : EntityFields.mappable(entity)) {
            String where = EntityFields.describe(field);
            Class<?> javaType = field.getType();

            MaxLength maxLength = field.getAnnotation(MaxLength.class);
            FixedLength fixedLength = field.getAnnotation(FixedLength.class);
            Precision precision = field.getAnnotation(Precision.class);

            boolean isString = javaType == String.class;
            boolean isDecimal = javaType == BigDecimal.class;

            if ((maxLength != null || fixedLength != null) && !isString) {
                throw new SchemaDefinitionException("@MaxLength/@FixedLength only apply to String. "
                        + where + " is " + javaType.getSimpleName() + ".");
            }
            if (maxLength != null && fixedLength != null) {
                throw new SchemaDefinitionException("Use either @MaxLength or @FixedLength, not both: " + where + ".");
            }
            if (precision != null && !isDecimal) {
                throw new SchemaDefinitionException("@Precision only applies to BigDecimal. "
                        + where + " is " + javaType.getSimpleName() + ".");
            }
            if (maxLength != null && maxLength.value() <= 0) {
                throw new SchemaDefinitionException("@MaxLength must be positive: " + where);
            }
            if (fixedLength != null && fixedLength.value() <= 0) {
                throw new SchemaDefinitionException("@FixedLength must be positive: " + where);
            }
            if (precision != null && (precision.precision() <= 0 || precision.scale() < 0
                    || precision.scale() > precision.precision())) {
                throw new SchemaDefinitionException("@Precision(" + precision.precision() + ", " + precision.scale()
                        + ") is invalid on " + where + ": scale must be between 0 and precision");
            }

            IncrementalKey incremental = field.getAnnotation(IncrementalKey.class);
            PrimaryKey primaryKey = field.getAnnotation(PrimaryKey.class);
            if (primaryKey != null && primaryKey.order() < 0) {
                throw new SchemaDefinitionException("@PrimaryKey order must not be negative: " + where);
            }

            ColumnType type = field.isAnnotationPresent(Json.class)
                    ? ColumnType.json()
                    : options.typeMapper().map(javaType);

            DbColumn.Builder column = DbColumn.builder(EntityFields.columnName(field), type)
                    .sourceName(field.getName())
                    .nullable(!field.isAnnotationPresent(NotNull.class))
                    .primaryKey(primaryKey != null)
                    .maxLength(maxLength == null ? null : maxLength.value())
                    .fixedLength(fixedLength == null ? null : fixedLength.value());

            if (precision != null) {
                column.precision(precision.precision(), precision.scale());
            }
            if (incremental != null) {
                column.incrementalKey(
                        incremental.sequenceName().isBlank() ? null : incremental.sequenceName(),
                        incremental.startWith(),
                        incremental.incrementBy());
            }

            Default defaultValue = field.getAnnotation(Default.class);
            if (defaultValue != null) {
                try {
                    column.defaultValue(DefaultValues.parse(type, defaultValue.value()));
                } catch (RuntimeException e) {
                    throw new SchemaDefinitionException("@Default(\"" + defaultValue.value() + "\") on " + where
                            + " does not fit column type " + type, e);
                }
            }

            try {
                table.addColumn(column.build());
            } catch (SchemaDefinitionException e) {
                throw new SchemaDefinitionException(where + ": " + e.getMessage(), e);
            }
        }
    }

    private void buildConstraints(DbTable table, Class<?> entity) {
        List<Field> fields = EntityFields.mappable(entity);

        buildPrimaryKey(table, fields);
        buildUniques(table, fields);
        buildChecks(table, entity, fields);
        buildIndexes(table, entity, fields);
        buildForeignKeys(table, fields);
    }

    private void buildPrimaryKey(DbTable table, List<Field> fields) {
        List<Field> keyFields = fields.stream()
                .filter(f -> f.isAnnotationPresent(PrimaryKey.class))
                .sorted(Comparator.comparingInt(f -> f.getAnnotation(PrimaryKey.class).order()))
                .collect(Collectors.toList());

        if (keyFields.isEmpty()) {
            return;
        }

        String explicitName = keyFields.stream()
                .map(f -> f.getAnnotation(PrimaryKey.class).name())
                .filter(n -> !n.isBlank())
                .findFirst()
                .orElse(null);

        String name = explicitName != null
                ? explicitName
                : conventional("PK_" + table.name(), "PK");

        List<String> columns = keyFields.stream().map(EntityFields::columnName).collect(Collectors.toList());
        table.setPrimaryKey(new DbPrimaryKey(name, columns));
    }

    private void buildUniques(DbTable table, List<Field> fields) {
        // group name (case-insensitive) -> members in first-seen order
        Map<String, List<UniqueMember>> groups = new LinkedHashMap<>();
        Map<String, String> displayNames = new LinkedHashMap<>();

        for (Field f : fields) {
            for (Unique uq : f.getAnnotationsByType(Unique.class)) {
                if (uq.value().isBlank()) {
                    throw new SchemaDefinitionException("@Unique group name must not be blank: " + EntityFields.describe(f));
                }
                String key = uq.value().toLowerCase(Locale.ROOT);
                displayNames.putIfAbsent(key, uq.value());
                groups.computeIfAbsent(key, k -> new ArrayList<>()).add(new UniqueMember(f, uq.order()));
            }
        }

        for (Map.Entry<String, List<UniqueMember>> group : groups.entrySet()) {
            List<String> columns = group.getValue().stream()
                    .sorted(Comparator.comparingInt(UniqueMember::order))
                    .map(m -> EntityFields.columnName(m.field()))
                    .collect(Collectors.toList());
            table.addUnique(new DbUnique(uniqueName(displayNames.get(group.getKey())), columns));
        }
    }

    private String uniqueName(String group) {
        if (!options.conventionalConstraintNames() || group.regionMatches(true, 0, "UQ_", 0, 3)) {
            return group;
        }
        return "UQ_" + group;
    }

    private void buildChecks(DbTable table, Class<?> entity, List<Field> fields) {
        for (Check check : entity.getAnnotationsByType(Check.class)) {
            String name = !check.name().isBlank()
                    ? check.name()
                    : freeName(conventional("CK_" + table.name() + "_" + (table.checks().size() + 1), "CK"),
                    checkNames(table));
            table.addCheck(new DbCheck(name, requireExpression(check, entity.getSimpleName())));
        }

        for (Field f : fields) {
            for (Check check : f.getAnnotationsByType(Check.class)) {
                String name = !check.name().isBlank()
                        ? check.name()
                        : freeName(conventional("CK_" + table.name() + "_" + EntityFields.columnName(f), "CK"),
                        checkNames(table));
                table.addCheck(new DbCheck(name, requireExpression(check, EntityFields.describe(f))));
            }
        }
    }

    private static String requireExpression(Check check, String where) {
        if (check.value().isBlank()) {
            throw new SchemaDefinitionException("@Check expression must not be blank: " + where);
        }
        return check.value();
    }

    private void buildIndexes(DbTable table, Class<?> entity, List<Field> fields) {
        for (Index index : entity.getAnnotationsByType(Index.class)) {
            if (index.columns().length == 0) {
                throw new SchemaDefinitionException("@Index on " + entity.getSimpleName() + " declares no columns");
            }
            List<String> columns = new ArrayList<>();
            for (String ref : index.columns()) {
                columns.add(resolveIndexColumn(table, entity, fields, ref));
            }
            String name = !index.name().isBlank()
                    ? index.name()
                    : freeName(conventional("IX_" + table.name() + "_" + String.join("_", columns), "IX"),
                    table.indexes().stream().map(DbIndex::name).collect(Collectors.toList()));
            table.addIndex(new DbIndex(name, columns, index.unique()));
        }
    }

    private static String resolveIndexColumn(DbTable table, Class<?> entity, List<Field> fields, String ref) {
        for (Field f : fields) {
            if (f.getName().equals(ref)) {
                return EntityFields.columnName(f);
            }
        }
        return table.findColumn(ref)
                .map(DbColumn::name)
                .orElseThrow(() -> new SchemaDefinitionException(
                        "@Index on " + entity.getSimpleName() + " names unknown column '" + ref + "'"));
    }

    private void buildForeignKeys(DbTable table, List<Field> fields) {
        for (Field f : fields) {
            ForeignKey fk = f.getAnnotation(ForeignKey.class);
            if (fk == null) {
                continue;
            }

            Class<?> target = fk.entity();
            if (options.requireTableAnnotation() && !target.isAnnotationPresent(Table.class)) {
                throw new SchemaDefinitionException("@ForeignKey on " + EntityFields.describe(f) + " references "
                        + target.getSimpleName() + ", which has no @Table annotation");
            }

            Field refField = EntityFields.find(target, fk.field())
                    .orElseThrow(() -> new SchemaDefinitionException("ForeignKey reference field not found: "
                            + target.getSimpleName() + "." + fk.field() + " (declared on " + EntityFields.describe(f) + ")"));

            String refTable = tableName(target);
            String column = EntityFields.columnName(f);
            String name = !fk.name().isBlank()
                    ? fk.name()
                    : freeName(conventional("FK_" + table.name() + "_" + refTable + "_" + column, "FK"),
                    table.foreignKeys().stream().map(DbForeignKey::name).collect(Collectors.toList()));

            table.addForeignKey(new DbForeignKey(
                    name,
                    List.of(column),
                    schemaName(target),
                    refTable,
                    List.of(EntityFields.columnName(refField)),
                    fk.onDelete(),
                    fk.onUpdate()
            ));
        }
    }

    private String conventional(String conventionalName, String fallback) {
        return options.conventionalConstraintNames() ? conventionalName : fallback;
    }

    private static List<String> checkNames(DbTable table) {
        return table.checks().stream().map(DbCheck::name).collect(Collectors.toList());
    }

    /**
     * Generated names get a {@code _2}, {@code _3}... suffix when the table already uses them.
     * Explicit names are never rewritten.
     */
    static String freeName(String candidate, Collection<String> taken) {
        String name = candidate;
        for (int n = 2; containsIgnoreCase(taken, name); n++) {
            name = candidate + "_" + n;
        }
        return name;
    }

    private static boolean containsIgnoreCase(Collection<String> names, String name) {
        return names.stream().anyMatch(name::equalsIgnoreCase);
    }

    private record UniqueMember(Field field, int order) {}
}
