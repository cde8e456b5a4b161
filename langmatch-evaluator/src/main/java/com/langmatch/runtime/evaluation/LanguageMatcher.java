/*
 * Copyright (c) 2025 Langmatch
 * Licensed under the Apache License, Version 2.0
 */
package com.langmatch.runtime.evaluation;

import com.langmatch.api.ILanguageMatcher;
import com.langmatch.api.ILocaleExpander;
import com.langmatch.api.model.DistanceTrace;
import com.langmatch.api.model.LanguageIdentifier;
import com.langmatch.api.model.LocaleMatch;
import com.langmatch.runtime.model.MatchingModel;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Language matcher backed by a compiled {@link MatchingModel}.
 *
 * <p>Identifiers are maximized with the configured {@link ILocaleExpander}
 * before they reach the {@link DistanceEngine}. The expander result is
 * checked: an identifier that comes back without script or region is
 * rejected with {@link IllegalArgumentException}.
 *
 * <h2>Thread Safety</h2>
 * <p>Immutable after construction; safe for concurrent use.
 */
public final class LanguageMatcher implements ILanguageMatcher {
    private static final Logger logger = Logger.getLogger(LanguageMatcher.class.getName());

    /** Distances at or above this value are not an acceptable match. */
    public static final int DEFAULT_NO_MATCH_THRESHOLD = 1000;

    private final DistanceEngine engine;
    private final ILocaleExpander expander;
    private final int noMatchThreshold;
    private final Tracer tracer;

    public LanguageMatcher(MatchingModel model, ILocaleExpander expander) {
        this(model, expander, DEFAULT_NO_MATCH_THRESHOLD, OpenTelemetry.noop().getTracer("langmatch"));
    }

    public LanguageMatcher(MatchingModel model, ILocaleExpander expander, int noMatchThreshold, Tracer tracer) {
        if (noMatchThreshold <= 0) {
            throw new IllegalArgumentException("noMatchThreshold must be positive: " + noMatchThreshold);
        }
        this.engine = new DistanceEngine(model);
        this.expander = Objects.requireNonNull(expander, "expander");
        this.noMatchThreshold = noMatchThreshold;
        this.tracer = Objects.requireNonNull(tracer, "tracer");
    }

    @Override
    public int distance(LanguageIdentifier desired, LanguageIdentifier supported) {
        return engine.distance(maximize(desired), maximize(supported));
    }

    @Override
    public DistanceTrace explainDistance(LanguageIdentifier desired, LanguageIdentifier supported) {
        return engine.explain(maximize(desired), maximize(supported));
    }

    @Override
    public Optional<LocaleMatch> bestMatch(LanguageIdentifier desired, List<LanguageIdentifier> candidates) {
        Objects.requireNonNull(candidates, "candidates");
        Span span = tracer.spanBuilder("best-match").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("desired", String.valueOf(desired));
            span.setAttribute("candidateCount", candidates.size());
            if (candidates.isEmpty()) {
                return Optional.empty();
            }

            LanguageIdentifier maximizedDesired = maximize(desired);
            LanguageIdentifier best = null;
            int bestDistance = Integer.MAX_VALUE;
            for (LanguageIdentifier candidate : candidates) {
                int distance = engine.distance(maximizedDesired, maximize(candidate));
                if (distance < bestDistance) {
                    best = candidate;
                    bestDistance = distance;
                }
            }

            span.setAttribute("bestDistance", bestDistance);
            if (bestDistance >= noMatchThreshold) {
                if (logger.isLoggable(Level.FINE)) {
                    logger.fine("No acceptable match for " + desired + " among " + candidates.size()
                            + " candidates (best distance " + bestDistance + ")");
                }
                return Optional.empty();
            }
            return Optional.of(new LocaleMatch(best, bestDistance));
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    public int getNoMatchThreshold() {
        return noMatchThreshold;
    }

    public MatchingModel getModel() {
        return engine.getModel();
    }

    private LanguageIdentifier maximize(LanguageIdentifier identifier) {
        Objects.requireNonNull(identifier, "identifier");
        LanguageIdentifier maximized = expander.maximize(identifier);
        if (maximized == null || !maximized.isMaximized()) {
            throw new IllegalArgumentException("Cannot maximize language identifier: " + identifier);
        }
        return maximized;
    }
}
