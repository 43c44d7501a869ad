package com.tablesmith.core.types;

/**
 * Resolves the logical column type of an entity field from its Java type.
 */
@FunctionalInterface
public interface TypeMapper {
    ColumnType map(Class<?> javaType);
}
