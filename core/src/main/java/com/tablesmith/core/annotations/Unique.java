package com.tablesmith.core.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Places the field in a named unique group. Members sharing a group form one constraint,
 * ordered by {@link #order()}.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
@Repeatable(Uniques.class)
public @interface Unique {
    String value();

    int order() default 0;
}
