/*
 * Copyright (c) 2025 Langmatch
 * Licensed under the Apache License, Version 2.0
 */
package com.langmatch.api.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * One entry of the ordered rule table.
 *
 * <p>A symmetric rule also matches with the desired and supported
 * identifiers swapped; a one-way rule does not.
 *
 * @param desired      pattern for the desired identifier
 * @param supported    pattern for the supported identifier
 * @param baseDistance distance in table units, 0 to 100
 * @param oneWay       true if the rule only applies in the written direction
 */
public record MatchRule(
        TagPattern desired,
        TagPattern supported,
        int baseDistance,
        boolean oneWay
) implements Serializable {

    public static final int MAX_BASE_DISTANCE = 100;

    public MatchRule {
        Objects.requireNonNull(desired, "desired pattern must not be null");
        Objects.requireNonNull(supported, "supported pattern must not be null");
        if (baseDistance < 0 || baseDistance > MAX_BASE_DISTANCE) {
            throw new IllegalArgumentException(
                    "Base distance must be between 0 and " + MAX_BASE_DISTANCE + ", got: " + baseDistance);
        }
    }

    public static MatchRule of(String desired, String supported, int baseDistance) {
        return new MatchRule(TagPattern.parse(desired), TagPattern.parse(supported), baseDistance, false);
    }

    public static MatchRule oneWay(String desired, String supported, int baseDistance) {
        return new MatchRule(TagPattern.parse(desired), TagPattern.parse(supported), baseDistance, true);
    }

    /**
     * True for the catch-all rule whose patterns match any identifier.
     */
    public boolean isUniversal() {
        return desired.matchesEverything() && supported.matchesEverything();
    }

    @Override
    public String toString() {
        return desired + (oneWay ? " -> " : " <-> ") + supported + " (" + baseDistance + ")";
    }
}
