package com.tablesmith.core.types;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.UUID;

/**
 * Maps the common JDK value types onto logical column types.
 * Anything it does not recognise becomes an unbounded unicode string.
 */
public class DefaultTypeMapper implements TypeMapper {
    public static final int DEFAULT_DECIMAL_PRECISION = 18;
    public static final int DEFAULT_DECIMAL_SCALE = 2;

    @Override
    public ColumnType map(Class<?> javaType) {
        if (javaType == int.class || javaType == Integer.class
                || javaType == short.class || javaType == Short.class
                || javaType == byte.class || javaType == Byte.class) {
            return ColumnType.int32();
        }
        if (javaType == long.class || javaType == Long.class || javaType == BigInteger.class) {
            return ColumnType.int64();
        }
        if (javaType == boolean.class || javaType == Boolean.class) {
            return ColumnType.bool();
        }
        if (javaType == LocalDateTime.class || javaType == LocalDate.class || javaType == Instant.class
                || Date.class.isAssignableFrom(javaType)) {
            return ColumnType.dateTime();
        }
        if (javaType == OffsetDateTime.class || javaType == ZonedDateTime.class) {
            return ColumnType.dateTimeOffset();
        }
        if (javaType == UUID.class) {
            return ColumnType.guid();
        }
        if (javaType == BigDecimal.class) {
            return ColumnType.decimal(DEFAULT_DECIMAL_PRECISION, DEFAULT_DECIMAL_SCALE);
        }
        if (javaType == double.class || javaType == Double.class
                || javaType == float.class || javaType == Float.class) {
            return ColumnType.float64();
        }
        if (javaType == byte[].class) {
            return ColumnType.bytes();
        }
        return ColumnType.string();
    }
}
