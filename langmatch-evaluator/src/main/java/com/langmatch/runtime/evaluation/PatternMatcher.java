/*
 * Copyright (c) 2025 Langmatch
 * Licensed under the Apache License, Version 2.0
 */
package com.langmatch.runtime.evaluation;

import com.langmatch.api.model.LanguageIdentifier;
import com.langmatch.api.model.SubtagPattern;
import com.langmatch.api.model.TagPattern;
import com.langmatch.runtime.model.VariableTable;

/**
 * Matches rule-table patterns against identifiers.
 *
 * <p>A null pattern stands for a slot the pattern does not write; it matches
 * only an absent subtag. {@link SubtagPattern.Any} matches a subtag whether
 * it is present or not. Every other pattern needs a present subtag.
 */
public final class PatternMatcher {

    private PatternMatcher() {
    }

    /**
     * @throws IllegalStateException if a variable reference names an undefined variable
     */
    public static boolean matches(SubtagPattern pattern, String subtag, VariableTable variables) {
        if (pattern == null) {
            return subtag == null;
        }
        if (pattern instanceof SubtagPattern.Any) {
            return true;
        }
        if (subtag == null) {
            return false;
        }
        if (pattern instanceof SubtagPattern.Literal literal) {
            return literal.value().equals(subtag);
        }
        if (pattern instanceof SubtagPattern.VariableRef ref) {
            return variables.contains(ref.name(), subtag);
        }
        if (pattern instanceof SubtagPattern.ExcludedVariableRef excluded) {
            return !variables.contains(excluded.name(), subtag);
        }
        throw new IllegalStateException("Unknown subtag pattern type: " + pattern.getClass().getName());
    }

    public static boolean matches(TagPattern pattern, LanguageIdentifier identifier, VariableTable variables) {
        return matches(pattern.language(), identifier.language(), variables)
                && matches(pattern.script(), identifier.script(), variables)
                && matches(pattern.region(), identifier.region(), variables);
    }
}
