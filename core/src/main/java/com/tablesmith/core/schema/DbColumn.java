package com.tablesmith.core.schema;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tablesmith.core.SchemaDefinitionException;
import com.tablesmith.core.types.ColumnType;

/**
 * A physical column. Instances are created through {@link #builder(String, ColumnType)} which
 * enforces the size/precision rules for the column's type family.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class DbColumn {
    private final String name;
    private final String sourceName;
    private final ColumnType type;
    private final boolean nullable;
    private final boolean incrementalKey;
    private final String sequenceName;
    private final Long startWith;
    private final Long incrementBy;
    private final Integer maxLength;
    private final Integer fixedLength;
    private final Integer precision;
    private final Integer scale;
    private final Object defaultValue;

    private DbColumn(Builder b) {
        if (b.name == null || b.name.isBlank()) {
            throw new SchemaDefinitionException("Column name must not be blank (source: " + b.sourceName + ")");
        }
        if (b.type == null) {
            throw new SchemaDefinitionException("Column " + b.name + " has no type");
        }
        if (b.maxLength != null && b.fixedLength != null) {
            throw new SchemaDefinitionException("Column " + b.name + " cannot have both a max length and a fixed length");
        }
        if ((b.maxLength != null || b.fixedLength != null) && !(b.type instanceof ColumnType.StringType)) {
            throw new SchemaDefinitionException("Column " + b.name + ": lengths only apply to string columns");
        }
        if ((b.precision != null || b.scale != null) && !(b.type instanceof ColumnType.DecimalType)) {
            throw new SchemaDefinitionException("Column " + b.name + ": precision/scale only apply to decimal columns");
        }
        this.name = b.name;
        this.sourceName = b.sourceName == null ? b.name : b.sourceName;
        this.type = refine(b);
        this.incrementalKey = b.incrementalKey;
        // key columns are never nullable, whatever the source said
        this.nullable = b.nullable && !b.primaryKey && !b.incrementalKey;
        this.sequenceName = b.sequenceName;
        this.startWith = b.startWith;
        this.incrementBy = b.incrementBy;
        this.maxLength = b.maxLength;
        this.fixedLength = b.fixedLength;
        this.precision = b.precision;
        this.scale = b.scale;
        this.defaultValue = b.defaultValue;
    }

    private static ColumnType refine(Builder b) {
        if (b.type instanceof ColumnType.StringType s && (b.maxLength != null || b.fixedLength != null)) {
            return new ColumnType.StringType(b.maxLength, b.fixedLength, s.unicode());
        }
        if (b.type instanceof ColumnType.DecimalType && b.precision != null) {
            return new ColumnType.DecimalType(b.precision, b.scale == null ? 0 : b.scale);
        }
        return b.type;
    }

    public static Builder builder(String name, ColumnType type) {
        return new Builder(name, type);
    }

    @JsonProperty("name")
    public String name() {
        return name;
    }

    @JsonProperty("sourceName")
    public String sourceName() {
        return sourceName;
    }

    @JsonProperty("type")
    public ColumnType type() {
        return type;
    }

    @JsonProperty("nullable")
    public boolean nullable() {
        return nullable;
    }

    @JsonProperty("incrementalKey")
    public boolean incrementalKey() {
        return incrementalKey;
    }

    @JsonProperty("sequenceName")
    public String sequenceName() {
        return sequenceName;
    }

    @JsonProperty("startWith")
    public Long startWith() {
        return startWith;
    }

    @JsonProperty("incrementBy")
    public Long incrementBy() {
        return incrementBy;
    }

    @JsonProperty("maxLength")
    public Integer maxLength() {
        return maxLength;
    }

    @JsonProperty("fixedLength")
    public Integer fixedLength() {
        return fixedLength;
    }

    @JsonProperty("precision")
    public Integer precision() {
        return precision;
    }

    @JsonProperty("scale")
    public Integer scale() {
        return scale;
    }

    @JsonProperty("defaultValue")
    public Object defaultValue() {
        return defaultValue;
    }

    @Override
    public String toString() {
        return "DbColumn[" + name + " " + type + (nullable ? " NULL" : " NOT NULL") + "]";
    }

    public static class Builder {
        private final String name;
        private final ColumnType type;
        private String sourceName;
        private boolean nullable = true;
        private boolean primaryKey;
        private boolean incrementalKey;
        private String sequenceName;
        private Long startWith;
        private Long incrementBy;
        private Integer maxLength;
        private Integer fixedLength;
        private Integer precision;
        private Integer scale;
        private Object defaultValue;

        private Builder(String name, ColumnType type) {
            this.name = name;
            this.type = type;
        }

        public Builder sourceName(String sourceName) {
            this.sourceName = sourceName;
            return this;
        }

        public Builder nullable(boolean nullable) {
            this.nullable = nullable;
            return this;
        }

        /**
         * Marks the column as part of the primary key, which forces it non-nullable.
         */
        public Builder primaryKey(boolean primaryKey) {
            this.primaryKey = primaryKey;
            return this;
        }

        public Builder incrementalKey(String sequenceName, Long startWith, Long incrementBy) {
            this.incrementalKey = true;
            this.sequenceName = sequenceName;
            this.startWith = startWith;
            this.incrementBy = incrementBy;
            return this;
        }

        public Builder maxLength(Integer maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        public Builder fixedLength(Integer fixedLength) {
            this.fixedLength = fixedLength;
            return this;
        }

        public Builder precision(Integer precision, Integer scale) {
            this.precision = precision;
            this.scale = scale;
            return this;
        }

        public Builder defaultValue(Object defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public DbColumn build() {
            return new DbColumn(this);
        }
    }
}
