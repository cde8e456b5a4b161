/*
 * Copyright (c) 2025 Langmatch
 * Licensed under the Apache License, Version 2.0
 */
package com.langmatch.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Map;

public record TableStats(
        @JsonProperty("rule_count") int ruleCount,
        @JsonProperty("variable_count") int variableCount,
        @JsonProperty("paradigm_count") int paradigmCount,
        @JsonProperty("compilation_time_nanos") long compilationTimeNanos,
        @JsonProperty("metadata") Map<String, Object> metadata
) implements Serializable {

    public TableStats {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
