/*
 * Copyright (c) 2025 Langmatch
 * Licensed under the Apache License, Version 2.0
 */
package com.langmatch.compiler.analysis;

import com.langmatch.api.model.MatchRule;
import com.langmatch.runtime.model.MatchingModel;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds rules in an ordered rule table that can never decide a lookup.
 *
 * <p>Lookups stop at the first matching rule, so a rule is dead when an
 * earlier rule matches every identifier pair it matches:
 * <ul>
 *   <li>every rule after the universal fallback rule ({@code *_*_*} on both sides)</li>
 *   <li>a rule repeating the patterns of an earlier rule in the same direction,
 *       unless the earlier rule is one-way and the later one is symmetric</li>
 *   <li>a rule repeating the patterns of an earlier symmetric rule with the
 *       sides swapped</li>
 * </ul>
 *
 * <p>The analysis is O(N²) in the number of rules. CLDR tables hold a few
 * hundred rules, so it runs at every compilation.
 *
 * <h2>Usage</h2>
 * <pre>
 * ShadowReport report = new RuleShadowAnalyzer().analyze(model);
 * for (ShadowedRule shadowed : report.shadowedRules()) {
 *     System.out.printf("rule #%d %s is hidden by rule #%d (%s)%n",
 *         shadowed.ruleIndex(), shadowed.rule(), shadowed.shadowedBy(), shadowed.reason());
 * }
 * </pre>
 */
public class RuleShadowAnalyzer {

    public ShadowReport analyze(MatchingModel model) {
        return analyze(model.getRules());
    }

    public ShadowReport analyze(List<MatchRule> rules) {
        List<ShadowedRule> shadowed = new ArrayList<>();
        int universalIndex = -1;

        for (int i = 0; i < rules.size(); i++) {
            MatchRule rule = rules.get(i);
            if (universalIndex >= 0) {
                shadowed.add(new ShadowedRule(i, rule, universalIndex, Reason.AFTER_UNIVERSAL_RULE));
                continue;
            }
            int repeated = findCoveringRule(rules, i);
            if (repeated >= 0) {
                shadowed.add(new ShadowedRule(i, rule, repeated, Reason.REPEATS_EARLIER_RULE));
            }
            if (rule.isUniversal()) {
                universalIndex = i;
            }
        }

        return new ShadowReport(shadowed, universalIndex);
    }

    private int findCoveringRule(List<MatchRule> rules, int index) {
        MatchRule rule = rules.get(index);
        for (int j = 0; j < index; j++) {
            MatchRule earlier = rules.get(j);
            boolean sameDirection = earlier.desired().equals(rule.desired())
                    && earlier.supported().equals(rule.supported());
            if (sameDirection && (!earlier.oneWay() || rule.oneWay())) {
                return j;
            }
            boolean swapped = earlier.desired().equals(rule.supported())
                    && earlier.supported().equals(rule.desired());
            if (swapped && !earlier.oneWay()) {
                return j;
            }
        }
        return -1;
    }

    public enum Reason {
        AFTER_UNIVERSAL_RULE,
        REPEATS_EARLIER_RULE
    }

    /**
     * A rule that never decides a lookup.
     *
     * @param ruleIndex  position of the dead rule
     * @param rule       the dead rule
     * @param shadowedBy position of the earlier rule that hides it
     * @param reason     why it is hidden
     */
    public record ShadowedRule(
        int ruleIndex,
        MatchRule rule,
        int shadowedBy,
        Reason reason
    ) implements Serializable {
    }

    /**
     * Report containing the shadowed rules of a table.
     *
     * @param shadowedRules      shadowed rules in table order
     * @param universalRuleIndex index of the first universal rule, or -1 if the table has none
     */
    public record ShadowReport(
        List<ShadowedRule> shadowedRules,
        int universalRuleIndex
    ) implements Serializable {

        public ShadowReport {
            shadowedRules = List.copyOf(shadowedRules);
        }

        public boolean hasShadowedRules() {
            return !shadowedRules.isEmpty();
        }

        public int shadowedCount() {
            return shadowedRules.size();
        }

        public IntList ruleIndices() {
            IntList indices = new IntArrayList(shadowedRules.size());
            shadowedRules.forEach(s -> indices.add(s.ruleIndex()));
            return indices;
        }
    }
}
