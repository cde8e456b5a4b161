/*
 * Copyright (c) 2025 Langmatch
 * Licensed under the Apache License, Version 2.0
 */
package com.langmatch.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Locale;
import java.util.Objects;

/**
 * A language identifier reduced to the three subtags the matcher scores:
 * language, optional script and optional region.
 *
 * <p>Instances are immutable. Subtags are stored in canonical case
 * (language lower case, script title case, region upper case) so that
 * identifiers compare with plain {@link #equals(Object)}.
 *
 * <h2>Usage</h2>
 * <pre>
 * LanguageIdentifier zhHant = LanguageIdentifier.parse("zh-Hant");
 * LanguageIdentifier enGb = LanguageIdentifier.parse("en_GB");
 * LanguageIdentifier full = LanguageIdentifier.of("sr", "Latn", "RS");
 * </pre>
 *
 * @param language language subtag, never null
 * @param script   script subtag, or null when absent
 * @param region   region subtag, or null when absent
 */
public record LanguageIdentifier(
        @JsonProperty("language") String language,
        @JsonProperty("script") String script,
        @JsonProperty("region") String region
) implements Serializable {

    public LanguageIdentifier {
        Objects.requireNonNull(language, "language must not be null");
        if (language.isEmpty()) {
            throw new IllegalArgumentException("language must not be empty");
        }
        if (script != null && script.isEmpty()) {
            script = null;
        }
        if (region != null && region.isEmpty()) {
            region = null;
        }
    }

    public static LanguageIdentifier of(String language) {
        return new LanguageIdentifier(language, null, null);
    }

    public static LanguageIdentifier of(String language, String script, String region) {
        return new LanguageIdentifier(language, script, region);
    }

    /**
     * Parses a language tag such as {@code zh-Hant-TW}, {@code en_GB} or
     * {@code es-419}. Both {@code -} and {@code _} separate subtags. Variant
     * and extension subtags following the region are ignored.
     *
     * @param tag the tag to parse
     * @return the normalized identifier
     * @throws IllegalArgumentException if the tag is empty or malformed
     */
    public static LanguageIdentifier parse(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("Language tag must not be empty");
        }
        String[] parts = tag.trim().split("[-_]", -1);
        String language = parts[0];
        if (!isLanguage(language)) {
            throw new IllegalArgumentException("Invalid language subtag '" + language + "' in tag: " + tag);
        }

        String script = null;
        String region = null;
        int index = 1;
        if (index < parts.length && isScript(parts[index])) {
            script = parts[index++];
        }
        if (index < parts.length && isRegion(parts[index])) {
            region = parts[index++];
        }
        for (; index < parts.length; index++) {
            if (!isTrailingSubtag(parts[index])) {
                throw new IllegalArgumentException("Invalid subtag '" + parts[index] + "' in tag: " + tag);
            }
        }

        return new LanguageIdentifier(
                language.toLowerCase(Locale.ROOT),
                script == null ? null : titleCase(script),
                region == null ? null : region.toUpperCase(Locale.ROOT));
    }

    public boolean hasScript() {
        return script != null;
    }

    public boolean hasRegion() {
        return region != null;
    }

    /**
     * Returns true when both script and region are present, which is the
     * precondition for distance computation.
     */
    @JsonIgnore
    public boolean isMaximized() {
        return script != null && region != null;
    }

    public LanguageIdentifier withoutRegion() {
        return region == null ? this : new LanguageIdentifier(language, script, null);
    }

    public LanguageIdentifier withoutScript() {
        return script == null ? this : new LanguageIdentifier(language, null, region);
    }

    /**
     * Returns the BCP 47 form of this identifier, e.g. {@code zh-Hant-TW}.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(language);
        if (script != null) {
            sb.append('-').append(script);
        }
        if (region != null) {
            sb.append('-').append(region);
        }
        return sb.toString();
    }

    private static boolean isLanguage(String s) {
        int length = s.length();
        return ((length >= 2 && length <= 3) || (length >= 5 && length <= 8)) && isAlpha(s);
    }

    private static boolean isScript(String s) {
        return s.length() == 4 && isAlpha(s);
    }

    private static boolean isRegion(String s) {
        if (s.length() == 2) {
            return isAlpha(s);
        }
        return s.length() == 3 && s.chars().allMatch(c -> c >= '0' && c <= '9');
    }

    private static boolean isTrailingSubtag(String s) {
        return !s.isEmpty() && s.length() <= 8
                && s.chars().allMatch(c -> (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9'));
    }

    private static boolean isAlpha(String s) {
        return s.chars().allMatch(c -> (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z'));
    }

    private static String titleCase(String s) {
        return s.substring(0, 1).toUpperCase(Locale.ROOT) + s.substring(1).toLowerCase(Locale.ROOT);
    }
}
