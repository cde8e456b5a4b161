/*
 * Copyright (c) 2025 Langmatch
 * Licensed under the Apache License, Version 2.0
 */
package com.langmatch.runtime.model;

import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;
import it.unimi.dsi.fastutil.objects.ObjectSet;
import it.unimi.dsi.fastutil.objects.ObjectSets;

import java.io.Serializable;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * Named sets of subtag values referenced by {@code $name} and
 * {@code $!name} pattern slots. Names are stored without the {@code $} sigil.
 *
 * <p>Immutable once built and safe to share between threads.
 */
public final class VariableTable implements Serializable {
    private static final long serialVersionUID = 1L;

    private static final VariableTable EMPTY = new VariableTable(new Object2ObjectOpenHashMap<>());

    private final Map<String, ObjectSet<String>> variables;

    private VariableTable(Object2ObjectOpenHashMap<String, ObjectSet<String>> variables) {
        variables.trim();
        this.variables = Collections.unmodifiableMap(variables);
    }

    public static VariableTable empty() {
        return EMPTY;
    }

    /**
     * Builds a table from name to value sets. The input is copied.
     */
    public static VariableTable of(Map<String, ? extends Collection<String>> variables) {
        Object2ObjectOpenHashMap<String, ObjectSet<String>> copy = new Object2ObjectOpenHashMap<>(variables.size());
        variables.forEach((name, values) -> copy.put(name, ObjectSets.unmodifiable(new ObjectOpenHashSet<>(values))));
        return new VariableTable(copy);
    }

    /**
     * Tests membership of a subtag value in a variable.
     *
     * @throws IllegalStateException if the variable is not defined
     */
    public boolean contains(String name, String value) {
        return values(name).contains(value);
    }

    /**
     * Returns the value set of a variable.
     *
     * @throws IllegalStateException if the variable is not defined
     */
    public Set<String> values(String name) {
        ObjectSet<String> values = variables.get(name);
        if (values == null) {
            throw new IllegalStateException("Undefined match variable: $" + name);
        }
        return values;
    }

    public boolean isDefined(String name) {
        return variables.containsKey(name);
    }

    public Set<String> names() {
        return variables.keySet();
    }

    public int size() {
        return variables.size();
    }

    @Override
    public String toString() {
        return "VariableTable" + variables;
    }
}
