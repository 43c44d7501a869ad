package com.tablesmith.core.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Dialect-neutral logical column type. Each dialect decides the physical type name.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ColumnType.Int32Type.class, name = "int32"),
        @JsonSubTypes.Type(value = ColumnType.Int64Type.class, name = "int64"),
        @JsonSubTypes.Type(value = ColumnType.BoolType.class, name = "bool"),
        @JsonSubTypes.Type(value = ColumnType.DateTimeType.class, name = "datetime"),
        @JsonSubTypes.Type(value = ColumnType.DateTimeOffsetType.class, name = "datetimeoffset"),
        @JsonSubTypes.Type(value = ColumnType.GuidType.class, name = "guid"),
        @JsonSubTypes.Type(value = ColumnType.DecimalType.class, name = "decimal"),
        @JsonSubTypes.Type(value = ColumnType.DoubleType.class, name = "double"),
        @JsonSubTypes.Type(value = ColumnType.StringType.class, name = "string"),
        @JsonSubTypes.Type(value = ColumnType.BytesType.class, name = "bytes"),
        @JsonSubTypes.Type(value = ColumnType.JsonType.class, name = "json")
})
public sealed interface ColumnType {

    record Int32Type() implements ColumnType {}

    record Int64Type() implements ColumnType {}

    record BoolType() implements ColumnType {}

    record DateTimeType() implements ColumnType {}

    record DateTimeOffsetType() implements ColumnType {}

    record GuidType() implements ColumnType {}

    record DecimalType(
            @JsonProperty("precision") int precision,
            @JsonProperty("scale") int scale
    ) implements ColumnType {
        public DecimalType {
            if (precision <= 0) {
                throw new IllegalArgumentException("Decimal precision must be positive: " + precision);
            }
            if (scale < 0 || scale > precision) {
                throw new IllegalArgumentException("Decimal scale must be between 0 and " + precision + ": " + scale);
            }
        }
    }

    record DoubleType() implements ColumnType {}

    /**
     * Character data. {@code maxLength} and {@code fixedLength} are mutually exclusive; both null means unbounded.
     */
    record StringType(
            @JsonProperty("maxLength") Integer maxLength,
            @JsonProperty("fixedLength") Integer fixedLength,
            @JsonProperty("unicode") boolean unicode
    ) implements ColumnType {
        public StringType {
            if (maxLength != null && fixedLength != null) {
                throw new IllegalArgumentException("maxLength and fixedLength are mutually exclusive");
            }
        }
    }

    record BytesType(@JsonProperty("maxLength") Integer maxLength) implements ColumnType {}

    record JsonType() implements ColumnType {}

    static ColumnType int32() {
        return new Int32Type();
    }

    static ColumnType int64() {
        return new Int64Type();
    }

    static ColumnType bool() {
        return new BoolType();
    }

    static ColumnType dateTime() {
        return new DateTimeType();
    }

    static ColumnType dateTimeOffset() {
        return new DateTimeOffsetType();
    }

    static ColumnType guid() {
        return new GuidType();
    }

    static ColumnType decimal(int precision, int scale) {
        return new DecimalType(precision, scale);
    }

    static ColumnType float64() {
        return new DoubleType();
    }

    static ColumnType string() {
        return new StringType(null, null, true);
    }

    static ColumnType string(int maxLength) {
        return new StringType(maxLength, null, true);
    }

    static ColumnType fixedString(int length) {
        return new StringType(null, length, true);
    }

    static ColumnType bytes() {
        return new BytesType(null);
    }

    static ColumnType bytes(int maxLength) {
        return new BytesType(maxLength);
    }

    static ColumnType json() {
        return new JsonType();
    }
}
