/*
 * Copyright (c) 2025 Langmatch
 * Licensed under the Apache License, Version 2.0
 */
package com.langmatch.api.exceptions;

/**
 * Exception thrown when a language matching table cannot be compiled into
 * a usable model: malformed patterns, undefined variables, a missing
 * universal fallback rule and similar data faults.
 *
 * This is a RuntimeException; an invalid table is a deployment fault, not a
 * condition callers are expected to recover from.
 */
public class CompilationException extends RuntimeException {

    public CompilationException(String message) {
        super(message);
    }

    public CompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
