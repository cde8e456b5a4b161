/*
 * Copyright (c) 2025 Langmatch
 * Licensed under the Apache License, Version 2.0
 */
package com.langmatch.runtime;

import com.langmatch.api.ILanguageMatcher;
import com.langmatch.api.ILocaleExpander;
import com.langmatch.api.exceptions.CompilationException;
import com.langmatch.api.model.DataFormat;
import com.langmatch.compiler.RuleTableCompiler;
import com.langmatch.runtime.config.MatcherConfig;
import com.langmatch.runtime.evaluation.LanguageMatcher;
import com.langmatch.runtime.expansion.IcuLocaleExpander;
import com.langmatch.runtime.model.MatchingModel;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Factory for {@link ILanguageMatcher} instances.
 *
 * <pre>{@code
 * ILanguageMatcher matcher = LanguageMatchers.createDefault();
 * int d = matcher.distance("zh-TW", "zh-Hant"); // 0
 * }</pre>
 */
public final class LanguageMatchers {
    private static final Logger logger = Logger.getLogger(LanguageMatchers.class.getName());

    /** Classpath location of the bundled CLDR table. */
    public static final String BUNDLED_DATA = "cldr/languageInfo.xml";

    private LanguageMatchers() {
    }

    /**
     * Matcher over the bundled CLDR table with the ICU expander.
     *
     * @throws UncheckedIOException if the bundled table cannot be read
     */
    public static ILanguageMatcher createDefault() {
        try {
            return create(MatcherConfig.defaults(), OpenTelemetry.noop().getTracer("langmatch"));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load bundled language matching table", e);
        }
    }

    /**
     * Matcher configured by {@code config}, with the ICU expander.
     *
     * @throws IOException          if the table cannot be read or parsed
     * @throws CompilationException if the table is invalid
     */
    public static ILanguageMatcher create(MatcherConfig config, Tracer tracer) throws IOException {
        return create(config, tracer, new IcuLocaleExpander());
    }

    public static ILanguageMatcher create(MatcherConfig config, Tracer tracer, ILocaleExpander expander)
            throws IOException {
        Objects.requireNonNull(config, "config");
        MatchingModel model = loadModel(config, tracer, expander);
        return new LanguageMatcher(model, expander, config.getNoMatchThreshold(), tracer);
    }

    static MatchingModel loadModel(MatcherConfig config, Tracer tracer, ILocaleExpander expander) throws IOException {
        RuleTableCompiler compiler = new RuleTableCompiler(tracer, expander);
        if (config.getDataPath().isPresent()) {
            logger.info("Loading language matching table from " + config.getDataPath().get());
            return compiler.compile(config.getDataPath().get());
        }

        logger.info("Loading bundled language matching table " + BUNDLED_DATA);
        try (InputStream input = LanguageMatchers.class.getClassLoader().getResourceAsStream(BUNDLED_DATA)) {
            if (input == null) {
                throw new IOException("Bundled language matching table not found on classpath: " + BUNDLED_DATA);
            }
            return compiler.compile(input, DataFormat.XML);
        }
    }
}
