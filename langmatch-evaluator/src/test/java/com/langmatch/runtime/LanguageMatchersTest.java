/*
 * Copyright (c) 2025 Langmatch
 * Licensed under the Apache License, Version 2.0
 */
package com.langmatch.runtime;

import com.langmatch.api.ILanguageMatcher;
import com.langmatch.api.exceptions.CompilationException;
import com.langmatch.api.model.DistanceTrace;
import com.langmatch.api.model.LanguageIdentifier;
import com.langmatch.api.model.LocaleMatch;
import com.langmatch.runtime.config.MatcherConfig;
import com.langmatch.runtime.evaluation.LanguageMatcher;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LanguageMatchersTest {

    private static ILanguageMatcher matcher;

    @BeforeAll
    static void loadBundledTable() {
        matcher = LanguageMatchers.createDefault();
    }

    @Nested
    @DisplayName("Bundled CLDR table")
    class BundledTable {

        @Test
        @DisplayName("Script implied by the region should not add distance")
        void shouldMatchImpliedScript() {
            assertThat(matcher.distance("zh-CN", "zh-Hans")).isZero();
            assertThat(matcher.distance("zh-TW", "zh-Hant")).isZero();
        }

        @Test
        @DisplayName("Regions in the same variable should be close")
        void shouldScoreRegionVariables() {
            assertThat(matcher.distance("zh-HK", "zh-MO")).isEqualTo(40);
            assertThat(matcher.distance("zh-HK", "zh-Hant")).isEqualTo(50);
            assertThat(matcher.distance("en-US", "en-CA")).isEqualTo(39);
            assertThat(matcher.distance("en-US", "en-GB")).isEqualTo(50);
            assertThat(matcher.distance("en-AU", "en-GB")).isEqualTo(29);
            assertThat(matcher.distance("es-MX", "es-419")).isEqualTo(39);
            assertThat(matcher.distance("es-AR", "es-MX")).isEqualTo(40);
            assertThat(matcher.distance("pt-BR", "pt-PT")).isEqualTo(50);
            assertThat(matcher.distance("pt-AO", "pt-PT")).isEqualTo(39);
        }

        @Test
        @DisplayName("Unrelated languages should fall through to the wildcard rules")
        void shouldFallThroughForUnrelatedLanguages() {
            assertThat(matcher.distance("zh-TW", "en")).isEqualTo(1339);
            assertThat(matcher.distance("zh-TW", "zh-Hans")).isEqualTo(230);
        }

        @Test
        @DisplayName("Minority languages should fall back one-way to their major language")
        void shouldApplyOneWayFallbackRules() {
            assertThat(matcher.distance("ab", "ru")).isEqualTo(340);
            assertThat(matcher.distance("ru", "ab")).isEqualTo(840);
            assertThat(matcher.distance("ak", "en")).isEqualTo(339);
            assertThat(matcher.distance("az", "ru")).isEqualTo(440);
        }

        @Test
        @DisplayName("Symmetric language rules should score both directions")
        void shouldApplySymmetricRulesBothWays() {
            assertThat(matcher.distance("nn", "nb")).isEqualTo(200);
            assertThat(matcher.distance("nb", "nn")).isEqualTo(200);
            assertThat(matcher.distance("nb", "no")).isEqualTo(10);
        }

        @Test
        @DisplayName("Should pick the matching Chinese script")
        void shouldPickBestChineseVariant() {
            List<LanguageIdentifier> accepts = List.of(
                    LanguageIdentifier.parse("en"),
                    LanguageIdentifier.parse("ja"),
                    LanguageIdentifier.parse("zh-Hans"),
                    LanguageIdentifier.parse("zh-Hant"));

            assertThat(matcher.bestMatch(LanguageIdentifier.parse("zh-CN"), accepts))
                    .contains(new LocaleMatch(accepts.get(2), 0));
            assertThat(matcher.bestMatch(LanguageIdentifier.parse("zh-TW"), accepts))
                    .contains(new LocaleMatch(accepts.get(3), 0));
        }

        @Test
        @DisplayName("Should find no acceptable match across unrelated languages")
        void shouldReturnEmptyForUnrelatedLanguages() {
            List<LanguageIdentifier> accepts = List.of(
                    LanguageIdentifier.parse("ja"),
                    LanguageIdentifier.parse("ko"));

            assertThat(matcher.bestMatch(LanguageIdentifier.parse("en-GB"), accepts)).isEmpty();
        }

        @Test
        @DisplayName("Should explain a distance per dimension")
        void shouldExplainDistance() {
            DistanceTrace trace = matcher.explainDistance(
                    LanguageIdentifier.parse("zh-TW"), LanguageIdentifier.parse("en"));

            assertThat(trace.distanceOf(DistanceTrace.Dimension.REGION)).isEqualTo(39);
            assertThat(trace.distanceOf(DistanceTrace.Dimension.SCRIPT)).isEqualTo(500);
            assertThat(trace.distanceOf(DistanceTrace.Dimension.LANGUAGE)).isEqualTo(800);
            assertThat(trace.total()).isEqualTo(1339);
        }

        @Test
        @DisplayName("Should load every rule, variable and paradigm locale of the bundled table")
        void shouldLoadWholeTable() {
            LanguageMatcher languageMatcher = (LanguageMatcher) matcher;

            assertThat(languageMatcher.getModel().getRuleCount()).isEqualTo(375);
            assertThat(languageMatcher.getModel().getVariables().size()).isEqualTo(4);
            assertThat(languageMatcher.getModel().getVariables().values("americas"))
                    .contains("419", "MX", "US", "CA", "PR")
                    .doesNotContain("AS", "GU", "PH", "UM", "GB");
            assertThat(languageMatcher.getModel().getParadigmLocales()).hasSize(6);
            assertThat(languageMatcher.getModel().getStats().metadata()).containsEntry("shadowedRules", 0);
        }
    }

    @Nested
    @DisplayName("Configured tables")
    class ConfiguredTables {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("Should load the table from the configured path with the configured threshold")
        void shouldLoadConfiguredTable() throws IOException {
            Path table = tempDir.resolve("languageInfo.json");
            Files.writeString(table, """
                    {"languageMatching": {"languageMatches": {
                        "paradigmLocales": {"locales": "en"},
                        "languageMatch": [
                            {"desired": "*", "supported": "*", "distance": 10},
                            {"desired": "*_*", "supported": "*_*", "distance": 10},
                            {"desired": "*_*_*", "supported": "*_*_*", "distance": 1}
                        ]
                    }}}
                    """);
            MatcherConfig config = MatcherConfig.defaults().toBuilder()
                    .dataPath(table)
                    .noMatchThreshold(100)
                    .build();

            ILanguageMatcher custom = LanguageMatchers.create(config, OpenTelemetry.noop().getTracer("test"));

            // region 10 - 1 (en is a paradigm), script 100, language 100
            assertThat(custom.distance("en", "ja")).isEqualTo(209);
            assertThat(custom.bestMatch(LanguageIdentifier.parse("en"), List.of(LanguageIdentifier.parse("ja"))))
                    .isEmpty();
            assertThat(custom.bestMatch(LanguageIdentifier.parse("en"), List.of(LanguageIdentifier.parse("en-CA"))))
                    .contains(new LocaleMatch(LanguageIdentifier.parse("en-CA"), 9));
        }

        @Test
        @DisplayName("Should fail on a configured table without fallback rule")
        void shouldRejectInvalidConfiguredTable() throws IOException {
            Path table = tempDir.resolve("languageInfo.json");
            Files.writeString(table, """
                    {"languageMatching": {"languageMatches": {
                        "languageMatch": [{"desired": "*", "supported": "*", "distance": 80}]
                    }}}
                    """);
            MatcherConfig config = MatcherConfig.defaults().toBuilder().dataPath(table).build();

            assertThatThrownBy(() -> LanguageMatchers.create(config, OpenTelemetry.noop().getTracer("test")))
                    .isInstanceOf(CompilationException.class)
                    .hasMessageContaining("universal fallback rule");
        }

        @Test
        @DisplayName("Should propagate a missing table file as IOException")
        void shouldFailForMissingFile() {
            MatcherConfig config = MatcherConfig.defaults().toBuilder()
                    .dataPath(tempDir.resolve("missing.xml"))
                    .build();

            assertThatThrownBy(() -> LanguageMatchers.create(config, OpenTelemetry.noop().getTracer("test")))
                    .isInstanceOf(IOException.class);
        }
    }
}
