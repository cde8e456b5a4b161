/*
 * Copyright (c) 2025 Langmatch
 * Licensed under the Apache License, Version 2.0
 */
package com.langmatch.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Serialized representation of the CLDR language matching table.
 * This is a Data Transfer Object used only for loading; the compiler turns
 * it into an immutable {@link com.langmatch.runtime.model.MatchingModel}.
 *
 * <p>The class tree follows the XML element tree of CLDR's
 * {@code languageInfo.xml}:
 * <pre>
 * &lt;supplementalData&gt;
 *   &lt;languageMatching&gt;
 *     &lt;languageMatches type="written_new"&gt;
 *       &lt;paradigmLocales locales="en en-GB es es-419 pt-BR pt-PT"/&gt;
 *       &lt;matchVariable id="$enUS" value="AS+CA+GU+MH+MP+PH+PR+UM+US+VI"/&gt;
 *       &lt;languageMatch desired="en_*_$!enUS" supported="en_*_GB" distance="3"/&gt;
 *       ...
 * </pre>
 * The JSON form uses the same names:
 * {@code {"languageMatching": {"languageMatches": {"paradigmLocales": {...},
 * "matchVariable": [...], "languageMatch": [...]}}}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LanguageMatchingDefinition {

    @JsonProperty("languageMatching")
    private LanguageMatching languageMatching;

    public LanguageMatchingDefinition() {
    }

    public LanguageMatchingDefinition(LanguageMatching languageMatching) {
        this.languageMatching = languageMatching;
    }

    public LanguageMatching languageMatching() {
        return languageMatching;
    }

    /**
     * Shortcut to the single {@code languageMatches} section, or null if absent.
     */
    public LanguageMatches languageMatches() {
        return languageMatching != null ? languageMatching.languageMatches() : null;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LanguageMatching {

        @JsonProperty("languageMatches")
        private LanguageMatches languageMatches;

        public LanguageMatching() {
        }

        public LanguageMatching(LanguageMatches languageMatches) {
            this.languageMatches = languageMatches;
        }

        public LanguageMatches languageMatches() {
            return languageMatches;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LanguageMatches {

        @JsonProperty("type")
        private String type;

        @JsonProperty("paradigmLocales")
        private ParadigmLocales paradigmLocales;

        @JsonProperty("matchVariable")
        @JacksonXmlElementWrapper(useWrapping = false)
        private List<MatchVariable> matchVariables = new ArrayList<>();

        @JsonProperty("languageMatch")
        @JacksonXmlElementWrapper(useWrapping = false)
        private List<LanguageMatch> languageMatches = new ArrayList<>();

        public LanguageMatches() {
        }

        public LanguageMatches(String type,
                               ParadigmLocales paradigmLocales,
                               List<MatchVariable> matchVariables,
                               List<LanguageMatch> languageMatches) {
            this.type = type;
            this.paradigmLocales = paradigmLocales;
            this.matchVariables = matchVariables;
            this.languageMatches = languageMatches;
        }

        public String type() {
            return type;
        }

        public ParadigmLocales paradigmLocales() {
            return paradigmLocales;
        }

        public List<MatchVariable> matchVariables() {
            return matchVariables != null ? matchVariables : List.of();
        }

        public List<LanguageMatch> languageMatches() {
            return languageMatches != null ? languageMatches : List.of();
        }
    }

    /**
     * Space separated list of paradigm locale tags.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ParadigmLocales {

        @JsonProperty("locales")
        private String locales;

        public ParadigmLocales() {
        }

        public ParadigmLocales(String locales) {
            this.locales = locales;
        }

        public String locales() {
            return locales;
        }
    }

    /**
     * A named region set. {@code id} carries the {@code $} sigil; {@code value}
     * is a {@code +}/{@code -} expression of region codes.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MatchVariable {

        @JsonProperty("id")
        private String id;

        @JsonProperty("value")
        private String value;

        public MatchVariable() {
        }

        public MatchVariable(String id, String value) {
            this.id = id;
            this.value = value;
        }

        public String id() {
            return id;
        }

        public String value() {
            return value;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LanguageMatch {

        @JsonProperty("desired")
        private String desired;

        @JsonProperty("supported")
        private String supported;

        @JsonProperty("distance")
        private Integer distance;

        @JsonProperty("oneway")
        private Boolean oneway;

        public LanguageMatch() {
        }

        public LanguageMatch(String desired, String supported, Integer distance, Boolean oneway) {
            this.desired = desired;
            this.supported = supported;
            this.distance = distance;
            this.oneway = oneway;
        }

        public String desired() {
            return desired;
        }

        public String supported() {
            return supported;
        }

        public Integer distance() {
            return distance;
        }

        public boolean oneway() {
            return oneway != null && oneway;
        }
    }
}
