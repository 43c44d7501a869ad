package com.tablesmith.cli.commands;

import com.tablesmith.core.TablesmithException;

import java.util.ArrayList;
import java.util.List;

final class EntityClasses {

    private EntityClasses() {
    }

    static List<Class<?>> load(List<String> classNames) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        List<Class<?>> classes = new ArrayList<>();
        for (String name : classNames) {
            try {
                classes.add(Class.forName(name, true, loader));
            } catch (ClassNotFoundException e) {
                throw new TablesmithException("Class not found on the classpath: " + name, e);
            }
        }
        return classes;
    }
}
