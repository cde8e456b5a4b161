/*
 * Copyright (c) 2025 Langmatch
 * Licensed under the Apache License, Version 2.0
 */
package com.langmatch.api;

import com.langmatch.api.model.DistanceTrace;
import com.langmatch.api.model.LanguageIdentifier;
import com.langmatch.api.model.LocaleMatch;

import java.util.List;
import java.util.Optional;

/**
 * Contract for scoring language identifiers against each other with the
 * CLDR enhanced language matching algorithm.
 *
 * <p>Distances are ten times the table distance, minus one when exactly one
 * side of a scored pass is a paradigm locale. Lower is better; values of
 * 1000 and above mean the two identifiers are not an acceptable match.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ILanguageMatcher matcher = LanguageMatchers.createDefault();
 *
 * matcher.distance(LanguageIdentifier.parse("en-US"), LanguageIdentifier.parse("en-CA")); // 39
 *
 * List<LanguageIdentifier> available = List.of(
 *     LanguageIdentifier.parse("en"),
 *     LanguageIdentifier.parse("zh-Hans"),
 *     LanguageIdentifier.parse("zh-Hant"));
 *
 * matcher.bestMatch(LanguageIdentifier.parse("zh-TW"), available)
 *     .ifPresent(m -> System.out.println(m.supported())); // zh-Hant
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations are immutable after construction and can be shared
 * freely between threads.
 */
public interface ILanguageMatcher {

    /**
     * Distance between two identifiers. Both are maximized first; the
     * arguments are not modified. Some rules are one-way, so the order of
     * the arguments matters.
     *
     * @param desired   the identifier the user asked for
     * @param supported an identifier the application can serve
     * @return the distance, 0 for an exact match
     * @throws IllegalArgumentException if either identifier cannot be maximized
     */
    int distance(LanguageIdentifier desired, LanguageIdentifier supported);

    /**
     * Distance between two language tags, parsed with {@link LanguageIdentifier#parse(String)}.
     */
    default int distance(String desired, String supported) {
        return distance(LanguageIdentifier.parse(desired), LanguageIdentifier.parse(supported));
    }

    /**
     * Picks the candidate closest to the desired identifier.
     *
     * <p>Ties go to the candidate that comes first in the list. The returned
     * match holds the caller's own candidate instance, not its maximized form.
     *
     * @param desired    the identifier the user asked for
     * @param candidates identifiers the application can serve
     * @return the closest candidate, or empty if there are no candidates or
     *         none is closer than the no-match threshold
     */
    Optional<LocaleMatch> bestMatch(LanguageIdentifier desired, List<LanguageIdentifier> candidates);

    /**
     * Explains how {@link #distance(LanguageIdentifier, LanguageIdentifier)}
     * arrives at its result.
     *
     * @param desired   the identifier the user asked for
     * @param supported an identifier the application can serve
     * @return per-dimension breakdown; its total equals the distance
     */
    default DistanceTrace explainDistance(LanguageIdentifier desired, LanguageIdentifier supported) {
        throw new UnsupportedOperationException("explainDistance not implemented");
    }
}
