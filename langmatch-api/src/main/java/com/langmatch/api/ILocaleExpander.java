/*
 * Copyright (c) 2025 Langmatch
 * Licensed under the Apache License, Version 2.0
 */
package com.langmatch.api;

import com.langmatch.api.model.LanguageIdentifier;

/**
 * Fills in the likely script and region of a partial language identifier
 * ("maximization" in CLDR terms), e.g. {@code zh-TW} to {@code zh-Hant-TW}.
 *
 * <p>Implementations must be safe for concurrent use. A result without both
 * script and region is treated by the matcher as a failure to maximize.
 */
@FunctionalInterface
public interface ILocaleExpander {

    /**
     * Returns the maximized form of the identifier. The argument is not modified.
     *
     * @param identifier the identifier to expand
     * @return a new identifier with script and region filled in where known
     * @throws IllegalArgumentException if the identifier cannot be expanded
     */
    LanguageIdentifier maximize(LanguageIdentifier identifier);
}
