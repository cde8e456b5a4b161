/*
 * Copyright (c) 2025 Langmatch
 * Licensed under the Apache License, Version 2.0
 */
package com.langmatch.compiler;

import com.langmatch.api.exceptions.CompilationException;
import com.langmatch.api.model.DataFormat;
import com.langmatch.api.model.LanguageIdentifier;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleTableCompilerValidationTest {

    private static final String FALLBACK = "{\"desired\": \"*_*_*\", \"supported\": \"*_*_*\", \"distance\": 4}";

    @TempDir
    Path tempDir;

    private RuleTableCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new RuleTableCompiler(OpenTelemetry.noop().getTracer("test"), TestExpanders.fixed());
    }

    private Path writeTable(String variables, String rules) throws IOException {
        String json = """
                {"languageMatching": {"languageMatches": {
                    "paradigmLocales": {"locales": "en"},
                    "matchVariable": [%s],
                    "languageMatch": [%s]
                }}}
                """.formatted(variables, rules);
        Path file = tempDir.resolve("languageInfo.json");
        Files.writeString(file, json);
        return file;
    }

    @Test
    @DisplayName("Should throw exception for a document without languageMatches")
    void shouldThrowForMissingSection() throws IOException {
        Path file = tempDir.resolve("empty.json");
        Files.writeString(file, "{\"languageMatching\": {}}");

        assertThatThrownBy(() -> compiler.compile(file))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("no languageMatching/languageMatches section");
    }

    @Test
    @DisplayName("Should throw exception for an empty rule table")
    void shouldThrowForEmptyRules() throws IOException {
        Path file = writeTable("", "");

        assertThatThrownBy(() -> compiler.compile(file))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("no languageMatch rules");
    }

    @Test
    @DisplayName("Should throw exception when the universal fallback rule is missing")
    void shouldThrowForMissingFallback() throws IOException {
        Path file = writeTable("", "{\"desired\": \"*\", \"supported\": \"*\", \"distance\": 80}");

        assertThatThrownBy(() -> compiler.compile(file))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("no universal fallback rule");
    }

    @Test
    @DisplayName("Should throw exception for a rule without distance")
    void shouldThrowForMissingDistance() throws IOException {
        Path file = writeTable("", "{\"desired\": \"en\", \"supported\": \"fr\"}, " + FALLBACK);

        assertThatThrownBy(() -> compiler.compile(file))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("index 0")
                .hasMessageContaining("has no distance");
    }

    @Test
    @DisplayName("Should throw exception for a distance outside 0..100")
    void shouldThrowForDistanceOutOfRange() throws IOException {
        Path file = writeTable("", "{\"desired\": \"en\", \"supported\": \"fr\", \"distance\": 101}, " + FALLBACK);

        assertThatThrownBy(() -> compiler.compile(file))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("outside 0..100");
    }

    @Test
    @DisplayName("Should throw exception for a rule without supported pattern")
    void shouldThrowForMissingPattern() throws IOException {
        Path file = writeTable("", "{\"desired\": \"en\", \"distance\": 5}, " + FALLBACK);

        assertThatThrownBy(() -> compiler.compile(file))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("missing desired or supported");
    }

    @Test
    @DisplayName("Should throw exception for a pattern with four slots")
    void shouldThrowForTooManySlots() throws IOException {
        Path file = writeTable("", "{\"desired\": \"en_*_*_*\", \"supported\": \"en\", \"distance\": 5}, " + FALLBACK);

        assertThatThrownBy(() -> compiler.compile(file))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("languageMatch at index 0")
                .hasMessageContaining("at most 3 allowed")
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should throw exception for a pattern with an empty slot")
    void shouldThrowForEmptySlot() throws IOException {
        Path file = writeTable("", "{\"desired\": \"en__US\", \"supported\": \"en\", \"distance\": 5}, " + FALLBACK);

        assertThatThrownBy(() -> compiler.compile(file))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Invalid tag pattern 'en__US'");
    }

    @Test
    @DisplayName("Should throw exception for a reference to an undeclared variable")
    void shouldThrowForUndeclaredVariable() throws IOException {
        Path file = writeTable(
                "{\"id\": \"$enUS\", \"value\": \"US\"}",
                "{\"desired\": \"en_*_$!cnsar\", \"supported\": \"en_*_*\", \"distance\": 4}, " + FALLBACK);

        assertThatThrownBy(() -> compiler.compile(file))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("undefined variable $cnsar");
    }

    @Test
    @DisplayName("Should throw exception for a variable id without the $ sigil")
    void shouldThrowForVariableWithoutSigil() throws IOException {
        Path file = writeTable("{\"id\": \"enUS\", \"value\": \"US\"}", FALLBACK);

        assertThatThrownBy(() -> compiler.compile(file))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("must be '$' followed by a name");
    }

    @Test
    @DisplayName("Should throw exception for a duplicate variable id")
    void shouldThrowForDuplicateVariable() throws IOException {
        Path file = writeTable(
                "{\"id\": \"$enUS\", \"value\": \"US\"}, {\"id\": \"$enUS\", \"value\": \"PR\"}",
                FALLBACK);

        assertThatThrownBy(() -> compiler.compile(file))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Duplicate matchVariable id: $enUS");
    }

    @Test
    @DisplayName("Should throw exception for a variable without value")
    void shouldThrowForVariableWithoutValue() throws IOException {
        Path file = writeTable("{\"id\": \"$enUS\", \"value\": \" \"}", FALLBACK);

        assertThatThrownBy(() -> compiler.compile(file))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("matchVariable $enUS has no value");
    }

    @Test
    @DisplayName("Should throw exception for an empty operand in a variable expression")
    void shouldThrowForEmptyOperand() throws IOException {
        Path file = writeTable("{\"id\": \"$enUS\", \"value\": \"US++PR\"}", FALLBACK);

        assertThatThrownBy(() -> compiler.compile(file))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("empty operand");
    }

    @Test
    @DisplayName("Should throw exception for a variable expression using a later variable")
    void shouldThrowForForwardVariableReference() throws IOException {
        Path file = writeTable(
                "{\"id\": \"$all\", \"value\": \"$enUS+GB\"}, {\"id\": \"$enUS\", \"value\": \"US\"}",
                FALLBACK);

        assertThatThrownBy(() -> compiler.compile(file))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("references $enUS before it is defined");
    }

    @Test
    @DisplayName("Should throw exception for a paradigm locale that cannot be maximized")
    void shouldThrowForUnmaximizableParadigm() throws IOException {
        RuleTableCompiler strict = new RuleTableCompiler(
                OpenTelemetry.noop().getTracer("test"), LanguageIdentifier::withoutRegion);
        Path file = writeTable("", FALLBACK);

        assertThatThrownBy(() -> strict.compile(file))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Paradigm locale 'en' could not be maximized");
    }

    @Test
    @DisplayName("Should throw exception for a malformed paradigm locale")
    void shouldThrowForMalformedParadigm() {
        String xml = """
                <supplementalData>
                  <languageMatching>
                    <languageMatches type="written_new">
                      <paradigmLocales locales="en 1234"/>
                      <languageMatch desired="*_*_*" supported="*_*_*" distance="4"/>
                    </languageMatches>
                  </languageMatching>
                </supplementalData>
                """;

        assertThatThrownBy(() -> compiler.compile(
                new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)), DataFormat.XML))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Invalid paradigm locale '1234'");
    }

    @Test
    @DisplayName("Should propagate malformed JSON as IOException")
    void shouldThrowIOExceptionForMalformedJson() throws IOException {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{\"languageMatching\": ");

        assertThatThrownBy(() -> compiler.compile(file))
                .isInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("Should reject a file with an unknown extension")
    void shouldRejectUnknownExtension() throws IOException {
        Path file = tempDir.resolve("languageInfo.yaml");
        Files.writeString(file, "languageMatching: {}");

        assertThatThrownBy(() -> compiler.compile(file))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
