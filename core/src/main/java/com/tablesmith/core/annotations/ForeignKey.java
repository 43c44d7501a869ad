package com.tablesmith.core.annotations;

import com.tablesmith.core.schema.ReferentialAction;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * References a field of another entity. The target's table and column names are resolved
 * with the same rules as the target's own mapping.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface ForeignKey {
    Class<?> entity();

    String field();

    String name() default "";

    ReferentialAction onDelete() default ReferentialAction.NO_ACTION;

    ReferentialAction onUpdate() default ReferentialAction.NO_ACTION;
}
