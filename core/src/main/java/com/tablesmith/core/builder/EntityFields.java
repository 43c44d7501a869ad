package com.tablesmith.core.builder;

import com.tablesmith.core.annotations.Column;
import com.tablesmith.core.annotations.Ignore;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Reflection helpers for the fields an entity maps to columns.
 */
final class EntityFields {
    private EntityFields() {}

    /**
     * Instance fields of the class and its superclasses, superclass fields first, in declaration order.
     */
    static List<Field> mappable(Class<?> entity) {
        Deque<Class<?>> hierarchy = new ArrayDeque<>();
        for (Class<?> c = entity; c != null && c != Object.class; c = c.getSuperclass()) {
            hierarchy.push(c);
        }
        List<Field> result = new ArrayList<>();
        for (Class<?> c : hierarchy) {
            for (Field f : c.getDeclaredFields()) {
                int mod = f.getModifiers();
                if (Modifier.isStatic(mod) || Modifier.isTransient(mod) || f.isSynthetic()) {
                    continue;
                }
                if (f.isAnnotationPresent(Ignore.class)) {
                    continue;
                }
                result.add(f);
            }
        }
        return result;
    }

    static Optional<Field> find(Class<?> entity, String fieldName) {
        return mappable(entity).stream()
                .filter(f -> f.getName().equals(fieldName))
                .findFirst();
    }

    static String columnName(Field field) {
        Column column = field.getAnnotation(Column.class);
        if (column != null && !column.value().isBlank()) {
            return column.value();
        }
        return field.getName();
    }

    static String describe(Field field) {
        return field.getDeclaringClass().getSimpleName() + "." + field.getName();
    }
}
