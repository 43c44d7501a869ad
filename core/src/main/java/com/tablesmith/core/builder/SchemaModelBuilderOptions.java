package com.tablesmith.core.builder;

import com.tablesmith.core.types.DefaultTypeMapper;
import com.tablesmith.core.types.TypeMapper;

public record SchemaModelBuilderOptions(
        String defaultSchema,
        TypeMapper typeMapper,
        boolean requireTableAnnotation,
        boolean conventionalConstraintNames
) {
    public static final String DEFAULT_SCHEMA = "dbo";

    public static SchemaModelBuilderOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String defaultSchema = DEFAULT_SCHEMA;
        private TypeMapper typeMapper = new DefaultTypeMapper();
        private boolean requireTableAnnotation = false;
        private boolean conventionalConstraintNames = true;

        public Builder defaultSchema(String defaultSchema) {
            this.defaultSchema = defaultSchema;
            return this;
        }

        public Builder typeMapper(TypeMapper typeMapper) {
            this.typeMapper = typeMapper;
            return this;
        }

        /**
         * Skip classes that carry no {@code @Table} annotation.
         */
        public Builder requireTableAnnotation(boolean requireTableAnnotation) {
            this.requireTableAnnotation = requireTableAnnotation;
            return this;
        }

        public Builder conventionalConstraintNames(boolean conventionalConstraintNames) {
            this.conventionalConstraintNames = conventionalConstraintNames;
            return this;
        }

        public SchemaModelBuilderOptions build() {
            return new SchemaModelBuilderOptions(
                    defaultSchema,
                    typeMapper,
                    requireTableAnnotation,
                    conventionalConstraintNames
            );
        }
    }
}
