/*
 * Copyright (c) 2025 Langmatch
 * Licensed under the Apache License, Version 2.0
 */
package com.langmatch.runtime.expansion;

import com.ibm.icu.util.IllformedLocaleException;
import com.ibm.icu.util.ULocale;
import com.langmatch.api.ILocaleExpander;
import com.langmatch.api.model.LanguageIdentifier;

import java.util.Objects;

/**
 * Maximizes identifiers with ICU's likely-subtags data.
 *
 * <p>{@code zh-TW} becomes {@code zh-Hant-TW}, {@code en} becomes
 * {@code en-Latn-US}. When ICU has no data for a language the result may
 * still lack script or region; callers check the outcome.
 */
public final class IcuLocaleExpander implements ILocaleExpander {

    @Override
    public LanguageIdentifier maximize(LanguageIdentifier identifier) {
        Objects.requireNonNull(identifier, "identifier");
        ULocale locale;
        try {
            locale = new ULocale.Builder()
                    .setLanguage(identifier.language())
                    .setScript(identifier.script())
                    .setRegion(identifier.region())
                    .build();
        } catch (IllformedLocaleException e) {
            throw new IllegalArgumentException("Malformed language identifier: " + identifier, e);
        }

        ULocale maximized = ULocale.addLikelySubtags(locale);
        // empty script or country becomes null in LanguageIdentifier
        return new LanguageIdentifier(maximized.getLanguage(), maximized.getScript(), maximized.getCountry());
    }
}
