/*
 * Copyright (c) 2025 Langmatch
 * Licensed under the Apache License, Version 2.0
 */
package com.langmatch.api;

import java.util.Map;

/**
 * Callback interface for compilation stage events.
 *
 * <p>The compilation pipeline consists of 5 stages:
 * <ol>
 *   <li>PARSING - Read the XML or JSON table</li>
 *   <li>VALIDATION - Check variables, patterns and the fallback rule</li>
 *   <li>VARIABLE_EXPANSION - Evaluate variable expressions into region sets</li>
 *   <li>PARADIGM_EXPANSION - Maximize the paradigm locales</li>
 *   <li>MODEL_BUILDING - Assemble the immutable model</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * compiler.setCompilationListener(new CompilationListener() {
 *     {@literal @}Override
 *     public void onStageStart(String stageName, int stageNumber, int totalStages) {
 *         System.out.printf("Starting %s (%d/%d)%n", stageName, stageNumber, totalStages);
 *     }
 *
 *     {@literal @}Override
 *     public void onStageComplete(String stageName, StageResult result) {
 *         System.out.printf("Completed %s in %d ms%n", stageName, result.durationMillis());
 *     }
 *
 *     {@literal @}Override
 *     public void onError(String stageName, Exception error) {
 *         System.err.printf("Error in %s: %s%n", stageName, error.getMessage());
 *     }
 * });
 * </pre>
 */
public interface CompilationListener {

    /**
     * Called when a compilation stage starts.
     *
     * @param stageName Name of the stage (e.g., "PARSING", "VALIDATION")
     * @param stageNumber Current stage number (1-based)
     * @param totalStages Total number of stages
     */
    void onStageStart(String stageName, int stageNumber, int totalStages);

    /**
     * Called when a compilation stage completes successfully.
     *
     * @param stageName Name of the stage
     * @param result Result containing duration and stage-specific metrics
     */
    void onStageComplete(String stageName, StageResult result);

    /**
     * Called when a compilation stage encounters an error.
     *
     * @param stageName Name of the stage that failed
     * @param error The exception that occurred
     */
    void onError(String stageName, Exception error);

    /**
     * Result of a single compilation stage.
     *
     * @param stageName Name of the stage
     * @param durationNanos Duration in nanoseconds
     * @param metrics Stage-specific metrics (e.g., "ruleCount", "variableCount")
     */
    record StageResult(
        String stageName,
        long durationNanos,
        Map<String, Object> metrics
    ) {
        public long durationMillis() {
            return durationNanos / 1_000_000;
        }
    }
}
