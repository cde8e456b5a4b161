/*
 * Copyright (c) 2025 Langmatch
 * Licensed under the Apache License, Version 2.0
 */
package com.langmatch.api;

import com.langmatch.api.exceptions.CompilationException;
import com.langmatch.api.model.DataFormat;
import com.langmatch.runtime.model.MatchingModel;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Contract for compiling a serialized language matching table into an
 * immutable {@link MatchingModel}.
 */
public interface IRuleTableCompiler {

    /**
     * Compiles a table from a file; the format follows the file extension.
     *
     * @param dataPath path to a {@code .xml} or {@code .json} table
     * @return compiled model
     * @throws IOException          if the file cannot be read or parsed
     * @throws CompilationException if the table is invalid
     */
    MatchingModel compile(Path dataPath) throws IOException;

    /**
     * Compiles a table from a stream. The stream is not closed.
     *
     * @param input  serialized table
     * @param format serialization format of {@code input}
     * @return compiled model
     * @throws IOException          if the stream cannot be read or parsed
     * @throws CompilationException if the table is invalid
     */
    MatchingModel compile(InputStream input, DataFormat format) throws IOException;

    /**
     * Sets a compilation listener for tracking compilation progress.
     *
     * @param listener the compilation listener (null to disable)
     */
    default void setCompilationListener(CompilationListener listener) {
    }
}
