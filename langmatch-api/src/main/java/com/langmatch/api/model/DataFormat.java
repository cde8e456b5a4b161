/*
 * Copyright (c) 2025 Langmatch
 * Licensed under the Apache License, Version 2.0
 */
package com.langmatch.api.model;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Serialized forms of the language matching table.
 */
public enum DataFormat {
    /** CLDR supplemental data XML ({@code languageInfo.xml}). */
    XML,

    /** JSON document with the same element tree as the XML form. */
    JSON;

    /**
     * Picks the format from a file extension.
     *
     * @throws IllegalArgumentException for anything other than {@code .xml} or {@code .json}
     */
    public static DataFormat fromPath(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".xml")) {
            return XML;
        }
        if (name.endsWith(".json")) {
            return JSON;
        }
        throw new IllegalArgumentException("Cannot determine data format of " + path + " (expected .xml or .json)");
    }
}
