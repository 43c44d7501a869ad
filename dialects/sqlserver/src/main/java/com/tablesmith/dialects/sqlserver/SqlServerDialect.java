package com.tablesmith.dialects.sqlserver;

import com.tablesmith.core.migration.operations.AddColumnOp;
import com.tablesmith.core.schema.ReferentialAction;
import com.tablesmith.core.types.ColumnType;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

/**
 * T-SQL quoting, literal and type rules shared by the generators, the history ledger and the lock.
 */
public final class SqlServerDialect {
    static final int MAX_NVARCHAR_LENGTH = 4000;
    static final int MAX_VARCHAR_LENGTH = 8000;
    static final int MAX_VARBINARY_LENGTH = 8000;

    public static final DateTimeFormatter DATETIME2_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSSS");
    private static final DateTimeFormatter DATETIMEOFFSET_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSSSxxx");

    private SqlServerDialect() {
    }

    /**
     * Bracket-quotes an identifier, doubling any closing bracket.
     */
    public static String quote(String identifier) {
        return "[" + identifier.replace("]", "]]") + "]";
    }

    public static String qualify(String schema, String name) {
        return quote(schema) + "." + quote(name);
    }

    public static String quoteAll(List<String> identifiers) {
        return identifiers.stream().map(SqlServerDialect::quote).collect(Collectors.joining(", "));
    }

    public static String escapeLiteral(String text) {
        return text.replace("'", "''");
    }

    /**
     * A Unicode string literal: {@code N'...'}.
     */
    public static String literal(String text) {
        return "N'" + escapeLiteral(text) + "'";
    }

    public static String typeName(ColumnType type) {
        if (type instanceof ColumnType.Int32Type) {
            return "INT";
        }
        if (type instanceof ColumnType.Int64Type) {
            return "BIGINT";
        }
        if (type instanceof ColumnType.BoolType) {
            return "BIT";
        }
        if (type instanceof ColumnType.DateTimeType) {
            return "DATETIME2";
        }
        if (type instanceof ColumnType.DateTimeOffsetType) {
            return "DATETIMEOFFSET";
        }
        if (type instanceof ColumnType.GuidType) {
            return "UNIQUEIDENTIFIER";
        }
        if (type instanceof ColumnType.DecimalType d) {
            return "DECIMAL(" + d.precision() + "," + d.scale() + ")";
        }
        if (type instanceof ColumnType.DoubleType) {
            return "FLOAT";
        }
        if (type instanceof ColumnType.StringType s) {
            return stringTypeName(s);
        }
        if (type instanceof ColumnType.BytesType b) {
            return b.maxLength() == null || b.maxLength() > MAX_VARBINARY_LENGTH
                    ? "VARBINARY(MAX)"
                    : "VARBINARY(" + b.maxLength() + ")";
        }
        // JSON is stored as text
        return "NVARCHAR(MAX)";
    }

    private static String stringTypeName(ColumnType.StringType s) {
        String prefix = s.unicode() ? "N" : "";
        int limit = s.unicode() ? MAX_NVARCHAR_LENGTH : MAX_VARCHAR_LENGTH;

        if (s.fixedLength() != null) {
            return prefix + "CHAR(" + s.fixedLength() + ")";
        }
        if (s.maxLength() == null || s.maxLength() > limit) {
            return prefix + "VARCHAR(MAX)";
        }
        return prefix + "VARCHAR(" + s.maxLength() + ")";
    }

    public static String formatDefault(Object value) {
        if (value instanceof Boolean b) {
            return b ? "1" : "0";
        }
        if (value instanceof String s) {
            return literal(s);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return value.toString();
        }
        if (value instanceof BigDecimal d) {
            return d.toPlainString();
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (!Double.isFinite(d)) {
                throw new IllegalArgumentException("Default value has no T-SQL literal: " + value);
            }
            return BigDecimal.valueOf(d).toPlainString();
        }
        if (value instanceof LocalDateTime dt) {
            return "'" + DATETIME2_FORMAT.format(dt) + "'";
        }
        if (value instanceof LocalDate d) {
            return "'" + DATETIME2_FORMAT.format(d.atStartOfDay()) + "'";
        }
        if (value instanceof Instant i) {
            return "'" + DATETIME2_FORMAT.format(LocalDateTime.ofInstant(i, ZoneOffset.UTC)) + "'";
        }
        if (value instanceof OffsetDateTime odt) {
            return "'" + DATETIMEOFFSET_FORMAT.format(odt) + "'";
        }
        if (value instanceof ZonedDateTime zdt) {
            return "'" + DATETIMEOFFSET_FORMAT.format(zdt.toOffsetDateTime()) + "'";
        }
        return literal(String.valueOf(value));
    }

    /**
     * Renders a column for {@code CREATE TABLE} or {@code ALTER TABLE ... ADD}.
     *
     * @param defaultConstraintName name for the default constraint, or {@code null} to leave it to the server
     */
    public static String columnDefinition(AddColumnOp column, String defaultConstraintName) {
        StringBuilder sql = new StringBuilder()
                .append(quote(column.name()))
                .append(' ')
                .append(typeName(column.type()));

        if (column.incrementalKey()
                && (column.type() instanceof ColumnType.Int32Type || column.type() instanceof ColumnType.Int64Type)) {
            long seed = column.startWith() == null ? 1 : column.startWith();
            long increment = column.incrementBy() == null ? 1 : column.incrementBy();
            sql.append(" IDENTITY(").append(seed).append(',').append(increment).append(')');
        }

        sql.append(column.nullable() ? " NULL" : " NOT NULL");

        if (column.defaultValue() != null) {
            if (defaultConstraintName != null) {
                sql.append(" CONSTRAINT ").append(quote(defaultConstraintName));
            }
            sql.append(" DEFAULT ").append(formatDefault(column.defaultValue()));
        }
        return sql.toString();
    }

    /**
     * @return the {@code ON DELETE|UPDATE ...} clause, or an empty string for NO_ACTION
     */
    public static String referentialAction(ReferentialAction action, String event) {
        switch (action) {
            case CASCADE:
                return "ON " + event + " CASCADE";
            case SET_NULL:
                return "ON " + event + " SET NULL";
            case SET_DEFAULT:
                return "ON " + event + " SET DEFAULT";
            case RESTRICT:
                return "ON " + event + " NO ACTION";
            default:
                return "";
        }
    }

    static String foreignKeyClause(String name, List<String> columns, String refSchema, String refTable,
                                   List<String> refColumns, ReferentialAction onDelete, ReferentialAction onUpdate) {
        StringBuilder sql = new StringBuilder()
                .append("ADD CONSTRAINT ").append(quote(name))
                .append(" FOREIGN KEY (").append(quoteAll(columns)).append(")")
                .append(" REFERENCES ").append(qualify(refSchema, refTable))
                .append(" (").append(quoteAll(refColumns)).append(")");
        String delete = referentialAction(onDelete, "DELETE");
        if (!delete.isEmpty()) {
            sql.append(' ').append(delete);
        }
        String update = referentialAction(onUpdate, "UPDATE");
        if (!update.isEmpty()) {
            sql.append(' ').append(update);
        }
        return sql.toString();
    }
}
