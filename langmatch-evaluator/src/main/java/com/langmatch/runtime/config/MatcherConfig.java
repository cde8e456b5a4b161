/*
 * Copyright (c) 2025 Langmatch
 * Licensed under the Apache License, Version 2.0
 */
package com.langmatch.runtime.config;

import com.langmatch.runtime.evaluation.LanguageMatcher;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configuration of a language matcher.
 *
 * <p><b>Environment Variable Override:</b>
 * Every property can be overridden via environment variables:
 * <pre>
 * LANGMATCH_DATA_PATH=/etc/langmatch/languageInfo.xml
 * LANGMATCH_NO_MATCH_THRESHOLD=800
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * // Bundled CLDR table, default threshold
 * MatcherConfig config = MatcherConfig.defaults();
 *
 * // Custom config
 * MatcherConfig config = MatcherConfig.builder()
 *     .dataPath(Path.of("languageInfo.json"))
 *     .noMatchThreshold(500)
 *     .build();
 *
 * ILanguageMatcher matcher = LanguageMatchers.create(config, tracer);
 * }</pre>
 */
public final class MatcherConfig {

    private static final Logger logger = Logger.getLogger(MatcherConfig.class.getName());

    public static final String PROPERTY_DATA_PATH = "langmatch.data.path";
    public static final String PROPERTY_NO_MATCH_THRESHOLD = "langmatch.no-match.threshold";

    static final String ENV_DATA_PATH = "LANGMATCH_DATA_PATH";
    static final String ENV_NO_MATCH_THRESHOLD = "LANGMATCH_NO_MATCH_THRESHOLD";

    public static final int DEFAULT_NO_MATCH_THRESHOLD = LanguageMatcher.DEFAULT_NO_MATCH_THRESHOLD;

    // null means the bundled table
    private final Path dataPath;
    private final int noMatchThreshold;

    private MatcherConfig(Builder builder) {
        this.dataPath = builder.dataPath;
        this.noMatchThreshold = builder.noMatchThreshold;

        validate();
    }

    /**
     * Bundled table and default threshold, ignoring the environment.
     */
    public static MatcherConfig defaults() {
        return new Builder(Map.of()).build();
    }

    /**
     * Create configuration from environment variables only.
     */
    public static MatcherConfig fromEnvironment() {
        return builder().build();
    }

    /**
     * Create configuration from properties. Environment variables take
     * precedence over property values.
     *
     * <pre>
     * langmatch.data.path=/etc/langmatch/languageInfo.xml
     * langmatch.no-match.threshold=1000
     * </pre>
     */
    public static MatcherConfig fromProperties(Properties props) {
        return fromProperties(props, System.getenv());
    }

    static MatcherConfig fromProperties(Properties props, Map<String, String> environment) {
        Builder builder = new Builder(Map.of());

        String dataPath = props.getProperty(PROPERTY_DATA_PATH);
        if (dataPath != null && !dataPath.isBlank()) {
            builder.dataPath = Path.of(dataPath.trim());
        }

        String threshold = props.getProperty(PROPERTY_NO_MATCH_THRESHOLD);
        if (threshold != null) {
            builder.noMatchThreshold = parseThreshold(PROPERTY_NO_MATCH_THRESHOLD, threshold);
        }

        builder.applyEnvironment(environment);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder(System.getenv());
    }

    static Builder builder(Map<String, String> environment) {
        return new Builder(environment);
    }

    public Builder toBuilder() {
        Builder builder = new Builder(Map.of());
        builder.dataPath = this.dataPath;
        builder.noMatchThreshold = this.noMatchThreshold;
        return builder;
    }

    /**
     * Path of the rule table, empty when the bundled table is used.
     */
    public Optional<Path> getDataPath() {
        return Optional.ofNullable(dataPath);
    }

    public int getNoMatchThreshold() {
        return noMatchThreshold;
    }

    private void validate() {
        if (noMatchThreshold <= 0) {
            throw new IllegalArgumentException("noMatchThreshold must be positive: " + noMatchThreshold);
        }
    }

    private static int parseThreshold(String source, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + source + ": '" + value + "' is not an integer", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MatcherConfig)) {
            return false;
        }
        MatcherConfig that = (MatcherConfig) o;
        return noMatchThreshold == that.noMatchThreshold && Objects.equals(dataPath, that.dataPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dataPath, noMatchThreshold);
    }

    @Override
    public String toString() {
        return "MatcherConfig{dataPath=" + (dataPath != null ? dataPath : "<bundled>")
                + ", noMatchThreshold=" + noMatchThreshold + '}';
    }

    public static final class Builder {
        private Path dataPath;
        private int noMatchThreshold = DEFAULT_NO_MATCH_THRESHOLD;

        private Builder(Map<String, String> environment) {
            applyEnvironment(environment);
        }

        private void applyEnvironment(Map<String, String> environment) {
            String dataPath = environment.get(ENV_DATA_PATH);
            if (dataPath != null && !dataPath.isBlank()) {
                logger.fine("Using " + ENV_DATA_PATH + "=" + dataPath);
                this.dataPath = Path.of(dataPath.trim());
            }
            String threshold = environment.get(ENV_NO_MATCH_THRESHOLD);
            if (threshold != null && !threshold.isBlank()) {
                this.noMatchThreshold = parseThreshold(ENV_NO_MATCH_THRESHOLD, threshold);
            }
        }

        /**
         * @param dataPath {@code .xml} or {@code .json} table, or null for the bundled table
         */
        public Builder dataPath(Path dataPath) {
            this.dataPath = dataPath;
            return this;
        }

        public Builder noMatchThreshold(int threshold) {
            this.noMatchThreshold = threshold;
            return this;
        }

        public MatcherConfig build() {
            return new MatcherConfig(this);
        }
    }
}
