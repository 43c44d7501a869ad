package com.tablesmith.core.builder;

import com.tablesmith.core.types.ColumnType;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Turns the text of a {@code @Default} annotation into a value of the column's logical type.
 */
final class DefaultValues {
    private DefaultValues() {}

    static Object parse(ColumnType type, String raw) {
        if (type instanceof ColumnType.Int32Type) {
            return Integer.valueOf(raw.trim());
        }
        if (type instanceof ColumnType.Int64Type) {
            return Long.valueOf(raw.trim());
        }
        if (type instanceof ColumnType.BoolType) {
            String v = raw.trim();
            if (v.equalsIgnoreCase("true") || v.equals("1")) {
                return Boolean.TRUE;
            }
            if (v.equalsIgnoreCase("false") || v.equals("0")) {
                return Boolean.FALSE;
            }
            throw new IllegalArgumentException("not a boolean: " + raw);
        }
        if (type instanceof ColumnType.DecimalType) {
            return new BigDecimal(raw.trim());
        }
        if (type instanceof ColumnType.DoubleType) {
            double value = Double.parseDouble(raw.trim());
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("not a finite number: " + raw);
            }
            return value;
        }
        if (type instanceof ColumnType.GuidType) {
            return UUID.fromString(raw.trim());
        }
        if (type instanceof ColumnType.DateTimeType) {
            return LocalDateTime.parse(raw.trim());
        }
        if (type instanceof ColumnType.DateTimeOffsetType) {
            return OffsetDateTime.parse(raw.trim());
        }
        return raw;
    }
}
