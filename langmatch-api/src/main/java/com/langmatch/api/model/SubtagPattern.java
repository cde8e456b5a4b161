/*
 * Copyright (c) 2025 Langmatch
 * Licensed under the Apache License, Version 2.0
 */
package com.langmatch.api.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Pattern for a single subtag slot of a {@link TagPattern}.
 *
 * <p>The variant set is closed:
 * <ul>
 *   <li>{@link Literal} - {@code en}, {@code Hant}, {@code GB}</li>
 *   <li>{@link VariableRef} - {@code $enUS}, a member of the named variable</li>
 *   <li>{@link ExcludedVariableRef} - {@code $!enUS}, not a member of the named variable</li>
 *   <li>{@link Any} - {@code *}, present or absent alike</li>
 * </ul>
 */
public sealed interface SubtagPattern extends Serializable
        permits SubtagPattern.Literal, SubtagPattern.VariableRef,
                SubtagPattern.ExcludedVariableRef, SubtagPattern.Any {

    String WILDCARD = "*";
    String VARIABLE_PREFIX = "$";
    String EXCLUDED_VARIABLE_PREFIX = "$!";

    /**
     * Parses one slot of a pattern string.
     *
     * @throws IllegalArgumentException if the slot is empty or names an empty variable
     */
    static SubtagPattern parse(String slot) {
        if (slot == null || slot.isEmpty()) {
            throw new IllegalArgumentException("Subtag pattern must not be empty");
        }
        if (WILDCARD.equals(slot)) {
            return Any.INSTANCE;
        }
        if (slot.startsWith(EXCLUDED_VARIABLE_PREFIX)) {
            return new ExcludedVariableRef(slot.substring(EXCLUDED_VARIABLE_PREFIX.length()));
        }
        if (slot.startsWith(VARIABLE_PREFIX)) {
            return new VariableRef(slot.substring(VARIABLE_PREFIX.length()));
        }
        return new Literal(slot);
    }

    record Literal(String value) implements SubtagPattern {
        public Literal {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String toString() {
            return value;
        }
    }

    record VariableRef(String name) implements SubtagPattern {
        public VariableRef {
            requireName(name);
        }

        @Override
        public String toString() {
            return VARIABLE_PREFIX + name;
        }
    }

    record ExcludedVariableRef(String name) implements SubtagPattern {
        public ExcludedVariableRef {
            requireName(name);
        }

        @Override
        public String toString() {
            return EXCLUDED_VARIABLE_PREFIX + name;
        }
    }

    record Any() implements SubtagPattern {
        public static final Any INSTANCE = new Any();

        @Override
        public String toString() {
            return WILDCARD;
        }
    }

    private static void requireName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Variable reference must name a variable");
        }
    }
}
