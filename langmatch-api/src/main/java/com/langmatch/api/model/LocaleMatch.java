/*
 * Copyright (c) 2025 Langmatch
 * Licensed under the Apache License, Version 2.0
 */
package com.langmatch.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Outcome of a best-match selection.
 *
 * @param supported the chosen candidate, the same instance the caller passed in
 * @param distance  its distance from the desired identifier
 */
public record LocaleMatch(
        @JsonProperty("supported") LanguageIdentifier supported,
        @JsonProperty("distance") int distance
) implements Serializable {

    public LocaleMatch {
        Objects.requireNonNull(supported, "supported must not be null");
    }
}
