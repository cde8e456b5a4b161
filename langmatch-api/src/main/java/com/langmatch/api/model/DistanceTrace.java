/*
 * Copyright (c) 2025 Langmatch
 * Licensed under the Apache License, Version 2.0
 */
package com.langmatch.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * Breakdown of a distance computation, one entry per dimension that
 * differed between the two identifiers.
 *
 * <p>Dimensions are scored in the order region, script, language. Each
 * score records the rule that decided it, so a surprising distance can be
 * traced back to a line of the rule table.
 *
 * <h2>Usage</h2>
 * <pre>
 * DistanceTrace trace = matcher.explainDistance(
 *     LanguageIdentifier.parse("en-US"), LanguageIdentifier.parse("en-CA"));
 *
 * for (DimensionScore score : trace.scores()) {
 *     System.out.printf("%s: %d via rule #%d %s%n",
 *         score.dimension(), score.distance(), score.ruleIndex(), score.rule());
 * }
 * </pre>
 *
 * @param desired   maximized desired identifier
 * @param supported maximized supported identifier
 * @param scores    contributions of the dimensions that differed, in pass order
 * @param total     sum of the contributions
 */
public record DistanceTrace(
        @JsonProperty("desired") LanguageIdentifier desired,
        @JsonProperty("supported") LanguageIdentifier supported,
        @JsonProperty("scores") List<DimensionScore> scores,
        @JsonProperty("total") int total
) implements Serializable {

    public DistanceTrace {
        scores = List.copyOf(scores);
    }

    public Optional<DimensionScore> score(Dimension dimension) {
        return scores.stream()
                .filter(s -> s.dimension() == dimension)
                .findFirst();
    }

    /**
     * Contribution of one dimension; zero when it did not differ.
     */
    public int distanceOf(Dimension dimension) {
        return score(dimension).map(DimensionScore::distance).orElse(0);
    }

    public enum Dimension {
        REGION,
        SCRIPT,
        LANGUAGE
    }

    /**
     * Contribution of a single distance pass.
     *
     * @param dimension        the dimension being scored
     * @param ruleIndex        position of the deciding rule in the table
     * @param rule             the deciding rule
     * @param swapped          true if the rule matched with desired and supported swapped
     * @param paradigmAdjusted true if the paradigm discount was applied
     * @param distance         the contribution to the total
     */
    public record DimensionScore(
            @JsonProperty("dimension") Dimension dimension,
            @JsonProperty("rule_index") int ruleIndex,
            @JsonProperty("rule") MatchRule rule,
            @JsonProperty("swapped") boolean swapped,
            @JsonProperty("paradigm_adjusted") boolean paradigmAdjusted,
            @JsonProperty("distance") int distance
    ) implements Serializable {
    }
}
