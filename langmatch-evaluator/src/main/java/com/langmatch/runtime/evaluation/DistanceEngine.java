/*
 * Copyright (c) 2025 Langmatch
 * Licensed under the Apache License, Version 2.0
 */
package com.langmatch.runtime.evaluation;

import com.langmatch.api.model.DistanceTrace;
import com.langmatch.api.model.DistanceTrace.Dimension;
import com.langmatch.api.model.DistanceTrace.DimensionScore;
import com.langmatch.api.model.LanguageIdentifier;
import com.langmatch.api.model.MatchRule;
import com.langmatch.runtime.model.MatchingModel;
import com.langmatch.runtime.model.VariableTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scores two maximized identifiers against a compiled {@link MatchingModel}.
 *
 * <h2>Algorithm</h2>
 * <p>The distance is the sum of up to three passes, run in this order:
 * <ol>
 * <li><b>Region:</b> if the regions differ, look up the full identifiers,
 * then drop the region on both sides.</li>
 * <li><b>Script:</b> if the scripts differ, look up the region-less
 * identifiers, then drop the script on both sides.</li>
 * <li><b>Language:</b> if the languages differ, look up the bare languages.</li>
 * </ol>
 * A lookup takes the first rule in table order whose desired pattern matches
 * the desired identifier and whose supported pattern matches the supported
 * one; symmetric rules are also tried with the sides swapped. The rule
 * contributes ten times its base distance, one less when exactly one of the
 * two identifiers of that pass is a paradigm locale.
 *
 * <p>The order of the passes and the clearing between them decide which
 * rules can match. Clearing builds new identifiers; inputs are never modified.
 *
 * <h2>Thread Safety</h2>
 * <p>Stateless apart from the immutable model; safe for concurrent use.
 */
public final class DistanceEngine {
    private static final Logger logger = Logger.getLogger(DistanceEngine.class.getName());

    private static final int DISTANCE_SCALE = 10;
    private static final int PARADIGM_DISCOUNT = 1;

    private final MatchingModel model;
    private final VariableTable variables;

    public DistanceEngine(MatchingModel model) {
        this.model = Objects.requireNonNull(model, "model");
        this.variables = model.getVariables();
    }

    public MatchingModel getModel() {
        return model;
    }

    /**
     * Distance between two maximized identifiers.
     *
     * @throws IllegalArgumentException if either identifier lacks script or region
     * @throws IllegalStateException    if no rule matches a pass
     */
    public int distance(LanguageIdentifier desired, LanguageIdentifier supported) {
        requireMaximized(desired, "desired");
        requireMaximized(supported, "supported");

        int total = 0;
        LanguageIdentifier d = desired;
        LanguageIdentifier s = supported;

        if (!Objects.equals(d.region(), s.region())) {
            total += score(lookup(d, s), d, s);
        }
        d = d.withoutRegion();
        s = s.withoutRegion();

        if (!Objects.equals(d.script(), s.script())) {
            total += score(lookup(d, s), d, s);
        }
        d = d.withoutScript();
        s = s.withoutScript();

        if (!d.language().equals(s.language())) {
            total += score(lookup(d, s), d, s);
        }

        if (logger.isLoggable(Level.FINE)) {
            logger.fine("distance(" + desired + ", " + supported + ") = " + total);
        }
        return total;
    }

    /**
     * Runs the same passes as {@link #distance} and records which rule
     * decided each of them.
     */
    public DistanceTrace explain(LanguageIdentifier desired, LanguageIdentifier supported) {
        requireMaximized(desired, "desired");
        requireMaximized(supported, "supported");

        List<DimensionScore> scores = new ArrayList<>(3);
        LanguageIdentifier d = desired;
        LanguageIdentifier s = supported;

        if (!Objects.equals(d.region(), s.region())) {
            scores.add(trace(Dimension.REGION, d, s));
        }
        d = d.withoutRegion();
        s = s.withoutRegion();

        if (!Objects.equals(d.script(), s.script())) {
            scores.add(trace(Dimension.SCRIPT, d, s));
        }
        d = d.withoutScript();
        s = s.withoutScript();

        if (!d.language().equals(s.language())) {
            scores.add(trace(Dimension.LANGUAGE, d, s));
        }

        int total = scores.stream().mapToInt(DimensionScore::distance).sum();
        return new DistanceTrace(desired, supported, scores, total);
    }

    private DimensionScore trace(Dimension dimension, LanguageIdentifier desired, LanguageIdentifier supported) {
        RuleHit hit = lookup(desired, supported);
        boolean discounted = isDiscounted(desired, supported);
        return new DimensionScore(dimension, hit.index(), hit.rule(), hit.swapped(), discounted,
                score(hit, desired, supported));
    }

    private RuleHit lookup(LanguageIdentifier desired, LanguageIdentifier supported) {
        List<MatchRule> rules = model.getRules();
        for (int i = 0; i < rules.size(); i++) {
            MatchRule rule = rules.get(i);
            if (PatternMatcher.matches(rule.desired(), desired, variables)
                    && PatternMatcher.matches(rule.supported(), supported, variables)) {
                return new RuleHit(i, rule, false);
            }
            if (!rule.oneWay()
                    && PatternMatcher.matches(rule.desired(), supported, variables)
                    && PatternMatcher.matches(rule.supported(), desired, variables)) {
                return new RuleHit(i, rule, true);
            }
        }
        throw new IllegalStateException("No rule matches " + desired + " / " + supported
                + " in a table of " + rules.size() + " rules");
    }

    private int score(RuleHit hit, LanguageIdentifier desired, LanguageIdentifier supported) {
        int distance = hit.rule().baseDistance() * DISTANCE_SCALE;
        if (isDiscounted(desired, supported)) {
            distance -= PARADIGM_DISCOUNT;
        }
        return Math.max(distance, 0);
    }

    private boolean isDiscounted(LanguageIdentifier desired, LanguageIdentifier supported) {
        return model.isParadigm(desired) != model.isParadigm(supported);
    }

    private static void requireMaximized(LanguageIdentifier identifier, String role) {
        Objects.requireNonNull(identifier, role);
        if (!identifier.isMaximized()) {
            throw new IllegalArgumentException(
                    role + " identifier must have script and region before scoring: " + identifier);
        }
    }

    private record RuleHit(int index, MatchRule rule, boolean swapped) {
    }
}
