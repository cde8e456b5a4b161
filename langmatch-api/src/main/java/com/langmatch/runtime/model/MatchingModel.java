/*
 * Copyright (c) 2025 Langmatch
 * Licensed under the Apache License, Version 2.0
 */
package com.langmatch.runtime.model;

import com.langmatch.api.exceptions.CompilationException;
import com.langmatch.api.model.LanguageIdentifier;
import com.langmatch.api.model.MatchRule;
import com.langmatch.api.model.TableStats;
import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;
import it.unimi.dsi.fastutil.objects.ObjectSets;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The compiled, executable representation of a language matching table.
 *
 * This class holds the ordered rule table, the variable table and the set of
 * maximized paradigm locales. It is immutable and thread-safe; one instance
 * is built at start-up and shared by every matcher that uses it.
 *
 * Rule order is significant: lookups scan {@link #getRules()} front to back
 * and the first matching rule decides. The model is never re-sorted.
 *
 * A model can only be built if it contains a universal fallback rule and
 * every variable referenced by a rule is defined, so rule lookup against a
 * built model always terminates with a match.
 */
public final class MatchingModel implements Serializable {
    private static final long serialVersionUID = 1L;

    private final List<MatchRule> rules;
    private final VariableTable variables;
    private final Set<LanguageIdentifier> paradigmLocales;
    private final int universalRuleIndex;
    private final TableStats stats;

    private MatchingModel(Builder builder, int universalRuleIndex) {
        this.rules = List.copyOf(builder.rules);
        this.variables = builder.variables;
        this.paradigmLocales = ObjectSets.unmodifiable(new ObjectOpenHashSet<>(builder.paradigmLocales));
        this.universalRuleIndex = universalRuleIndex;
        this.stats = builder.stats != null ? builder.stats : new TableStats(
                rules.size(), variables.size(), paradigmLocales.size(), 0L, Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<MatchRule> getRules() {
        return rules;
    }

    public MatchRule getRule(int index) {
        return rules.get(index);
    }

    public int getRuleCount() {
        return rules.size();
    }

    public VariableTable getVariables() {
        return variables;
    }

    public Set<LanguageIdentifier> getParadigmLocales() {
        return paradigmLocales;
    }

    public boolean isParadigm(LanguageIdentifier identifier) {
        return paradigmLocales.contains(identifier);
    }

    /**
     * Index of the first rule whose patterns match any identifier. Rules
     * after it can never be selected.
     */
    public int getUniversalRuleIndex() {
        return universalRuleIndex;
    }

    public TableStats getStats() {
        return stats;
    }

    @Override
    public String toString() {
        return "MatchingModel{rules=" + rules.size()
                + ", variables=" + variables.size()
                + ", paradigmLocales=" + paradigmLocales.size() + '}';
    }

    public static final class Builder {
        private final List<MatchRule> rules = new ArrayList<>();
        private final List<LanguageIdentifier> paradigmLocales = new ArrayList<>();
        private VariableTable variables = VariableTable.empty();
        private TableStats stats;

        private Builder() {
        }

        public Builder addRule(MatchRule rule) {
            rules.add(Objects.requireNonNull(rule, "rule"));
            return this;
        }

        public Builder addRules(Collection<MatchRule> rules) {
            rules.forEach(this::addRule);
            return this;
        }

        public Builder withVariables(VariableTable variables) {
            this.variables = Objects.requireNonNull(variables, "variables");
            return this;
        }

        /**
         * Adds a paradigm locale. It must already be maximized.
         */
        public Builder addParadigmLocale(LanguageIdentifier locale) {
            Objects.requireNonNull(locale, "locale");
            if (!locale.isMaximized()) {
                throw new IllegalArgumentException("Paradigm locale must be maximized: " + locale);
            }
            paradigmLocales.add(locale);
            return this;
        }

        public Builder withStats(TableStats stats) {
            this.stats = stats;
            return this;
        }

        public int getRuleCount() {
            return rules.size();
        }

        /**
         * Builds the model.
         *
         * @throws CompilationException if a rule references an undefined
         *                              variable or no universal fallback rule exists
         */
        public MatchingModel build() {
            int universalIndex = -1;
            for (int i = 0; i < rules.size(); i++) {
                MatchRule rule = rules.get(i);
                for (String name : rule.desired().variableNames()) {
                    requireVariable(i, rule, name);
                }
                for (String name : rule.supported().variableNames()) {
                    requireVariable(i, rule, name);
                }
                if (universalIndex < 0 && rule.isUniversal()) {
                    universalIndex = i;
                }
            }
            if (universalIndex < 0) {
                throw new CompilationException(
                        "Rule table has no universal fallback rule (desired=\"*_*_*\" supported=\"*_*_*\")");
            }
            return new MatchingModel(this, universalIndex);
        }

        private void requireVariable(int index, MatchRule rule, String name) {
            if (!variables.isDefined(name)) {
                throw new CompilationException(
                        "Rule #" + index + " [" + rule + "] references undefined variable $" + name);
            }
        }
    }
}
