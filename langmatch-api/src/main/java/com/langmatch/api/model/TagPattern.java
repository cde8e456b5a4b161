/*
 * Copyright (c) 2025 Langmatch
 * Licensed under the Apache License, Version 2.0
 */
package com.langmatch.api.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Pattern over a whole language identifier, written in the rule table as
 * up to three {@code _}-separated slots: {@code en}, {@code zh_Hant},
 * {@code en_*_$!enUS}.
 *
 * <p>A null script or region slot only matches an identifier that lacks that
 * subtag, so the number of slots decides which distance pass a rule can
 * take part in.
 *
 * @param language language slot, never null
 * @param script   script slot, or null when the pattern has one slot
 * @param region   region slot, or null when the pattern has fewer than three slots
 */
public record TagPattern(
        SubtagPattern language,
        SubtagPattern script,
        SubtagPattern region
) implements Serializable {

    public static final char SEPARATOR = '_';

    public TagPattern {
        Objects.requireNonNull(language, "language pattern must not be null");
        if (region != null && script == null) {
            throw new IllegalArgumentException("A region slot requires a script slot");
        }
    }

    /**
     * Parses a rule-table pattern string.
     *
     * @throws IllegalArgumentException if the pattern has more than three slots
     *                                  or an empty slot
     */
    public static TagPattern parse(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            throw new IllegalArgumentException("Tag pattern must not be empty");
        }
        String[] slots = pattern.split(String.valueOf(SEPARATOR), -1);
        if (slots.length > 3) {
            throw new IllegalArgumentException(
                    "Tag pattern '" + pattern + "' has " + slots.length + " slots, at most 3 allowed");
        }
        try {
            SubtagPattern language = SubtagPattern.parse(slots[0]);
            SubtagPattern script = slots.length > 1 ? SubtagPattern.parse(slots[1]) : null;
            SubtagPattern region = slots.length > 2 ? SubtagPattern.parse(slots[2]) : null;
            return new TagPattern(language, script, region);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid tag pattern '" + pattern + "': " + e.getMessage(), e);
        }
    }

    /**
     * Number of slots written in the pattern (1 to 3).
     */
    public int slotCount() {
        if (region != null) {
            return 3;
        }
        return script != null ? 2 : 1;
    }

    /**
     * True when every slot is a wildcard. Such a pattern matches any
     * identifier, with or without script and region.
     */
    public boolean matchesEverything() {
        return language instanceof SubtagPattern.Any
                && script instanceof SubtagPattern.Any
                && region instanceof SubtagPattern.Any;
    }

    /**
     * Names of all variables referenced by this pattern, in slot order.
     */
    public List<String> variableNames() {
        List<String> names = new ArrayList<>(3);
        collectVariable(language, names);
        collectVariable(script, names);
        collectVariable(region, names);
        return names;
    }

    private static void collectVariable(SubtagPattern slot, List<String> names) {
        if (slot instanceof SubtagPattern.VariableRef ref) {
            names.add(ref.name());
        } else if (slot instanceof SubtagPattern.ExcludedVariableRef ref) {
            names.add(ref.name());
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(language.toString());
        if (script != null) {
            sb.append(SEPARATOR).append(script);
        }
        if (region != null) {
            sb.append(SEPARATOR).append(region);
        }
        return sb.toString();
    }
}
