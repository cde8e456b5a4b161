/*
 * Copyright (c) 2025 Langmatch
 * Licensed under the Apache License, Version 2.0
 */
package com.langmatch.compiler;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.langmatch.api.CompilationListener;
import com.langmatch.api.ILocaleExpander;
import com.langmatch.api.IRuleTableCompiler;
import com.langmatch.api.exceptions.CompilationException;
import com.langmatch.api.model.DataFormat;
import com.langmatch.api.model.LanguageIdentifier;
import com.langmatch.api.model.LanguageMatchingDefinition;
import com.langmatch.api.model.LanguageMatchingDefinition.LanguageMatch;
import com.langmatch.api.model.LanguageMatchingDefinition.LanguageMatches;
import com.langmatch.api.model.LanguageMatchingDefinition.MatchVariable;
import com.langmatch.api.model.MatchRule;
import com.langmatch.api.model.TableStats;
import com.langmatch.api.model.TagPattern;
import com.langmatch.compiler.analysis.RuleShadowAnalyzer;
import com.langmatch.runtime.model.MatchingModel;
import com.langmatch.runtime.model.VariableTable;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectLinkedOpenHashSet;
import it.unimi.dsi.fastutil.objects.ObjectSet;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Compiles the CLDR language matching table into an immutable {@link MatchingModel}.
 *
 * <p>The compilation process runs five stages:
 * <ol>
 *   <li>PARSING - read the XML or JSON document with Jackson</li>
 *   <li>VALIDATION - parse every pattern, check distances, variable ids,
 *       variable references and the presence of the universal fallback rule</li>
 *   <li>VARIABLE_EXPANSION - evaluate {@code +}/{@code -} variable expressions</li>
 *   <li>PARADIGM_EXPANSION - maximize the paradigm locales</li>
 *   <li>MODEL_BUILDING - report shadowed rules and assemble the model</li>
 * </ol>
 *
 * Any data fault aborts compilation with a {@link CompilationException};
 * a model is never built from a partially valid table.
 */
public class RuleTableCompiler implements IRuleTableCompiler {
    private static final Logger logger = Logger.getLogger(RuleTableCompiler.class.getName());

    private static final int TOTAL_STAGES = 5;
    private static final String VARIABLE_SIGIL = "$";

    private final ObjectMapper jsonMapper;
    private final XmlMapper xmlMapper;
    private final Tracer tracer;
    private final ILocaleExpander expander;
    private final RuleShadowAnalyzer shadowAnalyzer = new RuleShadowAnalyzer();
    private volatile CompilationListener listener;

    /**
     * @param tracer   tracer for compilation spans
     * @param expander maximizes the paradigm locales
     */
    public RuleTableCompiler(Tracer tracer, ILocaleExpander expander) {
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.expander = Objects.requireNonNull(expander, "expander");
        this.jsonMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.xmlMapper = XmlMapper.builder()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .build();
    }

    @Override
    public void setCompilationListener(CompilationListener listener) {
        this.listener = listener;
    }

    @Override
    public MatchingModel compile(Path dataPath) throws IOException {
        DataFormat format = DataFormat.fromPath(dataPath);
        Span span = tracer.spanBuilder("compile-language-matching").startSpan();
        try (Scope scope = span.makeCurrent(); InputStream input = Files.newInputStream(dataPath)) {
            span.setAttribute("dataPath", dataPath.toString());
            return compileInternal(input, format, span);
        } catch (IOException | CompilationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public MatchingModel compile(InputStream input, DataFormat format) throws IOException {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(format, "format");
        Span span = tracer.spanBuilder("compile-language-matching").startSpan();
        try (Scope scope = span.makeCurrent()) {
            return compileInternal(input, format, span);
        } catch (IOException | CompilationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private MatchingModel compileInternal(InputStream input, DataFormat format, Span span) throws IOException {
        long startTime = System.nanoTime();
        span.setAttribute("format", format.name());

        LanguageMatchingDefinition definition = runStage("PARSING", 1,
                () -> read(input, format), d -> Map.of());

        ValidatedTable table = runStage("VALIDATION", 2,
                () -> validate(definition),
                t -> Map.of("ruleCount", t.rules().size(), "variableCount", t.variables().size()));
        span.setAttribute("ruleCount", table.rules().size());

        VariableTable variables = runStage("VARIABLE_EXPANSION", 3,
                () -> expandVariables(table.variables()),
                v -> Map.of("variableCount", v.size()));

        List<LanguageIdentifier> paradigms = runStage("PARADIGM_EXPANSION", 4,
                () -> expandParadigmLocales(table.paradigmLocales()),
                p -> Map.of("paradigmCount", p.size()));

        MatchingModel model = runStage("MODEL_BUILDING", 5,
                () -> buildModel(table, variables, paradigms, startTime),
                m -> Map.of("shadowedRules", m.getStats().metadata().get("shadowedRules")));

        long compilationTime = System.nanoTime() - startTime;
        span.setAttribute("compilationTimeMs", TimeUnit.NANOSECONDS.toMillis(compilationTime));
        logger.info(String.format("Compiled language matching table: %d rules, %d variables, %d paradigm locales in %d ms",
                model.getRuleCount(), variables.size(), paradigms.size(),
                TimeUnit.NANOSECONDS.toMillis(compilationTime)));
        return model;
    }

    private LanguageMatchingDefinition read(InputStream input, DataFormat format) throws IOException {
        ObjectMapper mapper = format == DataFormat.XML ? xmlMapper : jsonMapper;
        LanguageMatchingDefinition definition = mapper.readValue(input, LanguageMatchingDefinition.class);
        if (definition == null) {
            throw new CompilationException("Language matching document is empty");
        }
        return definition;
    }

    /**
     * Validates the parsed document and converts rule patterns.
     *
     * Checks, in order:
     * - the languageMatches section exists and has at least one languageMatch;
     * - variable ids are present, start with '$', are unique and have a value;
     * - every rule has desired, supported and a distance in 0..100;
     * - every pattern parses and references only declared variables;
     * - a universal fallback rule is present.
     */
    private ValidatedTable validate(LanguageMatchingDefinition definition) {
        LanguageMatches matches = definition.languageMatches();
        if (matches == null) {
            throw new CompilationException("Document has no languageMatching/languageMatches section");
        }
        if (matches.languageMatches().isEmpty()) {
            throw new CompilationException("Language matching table has no languageMatch rules");
        }

        Set<String> declared = new HashSet<>();
        for (int i = 0; i < matches.matchVariables().size(); i++) {
            MatchVariable variable = matches.matchVariables().get(i);
            String id = variable.id();
            if (id == null || id.isBlank()) {
                throw new CompilationException("matchVariable at index " + i + " has missing or empty id");
            }
            if (!id.startsWith(VARIABLE_SIGIL) || id.length() == VARIABLE_SIGIL.length()) {
                throw new CompilationException("matchVariable id must be '$' followed by a name, got: " + id);
            }
            if (variable.value() == null || variable.value().isBlank()) {
                throw new CompilationException("matchVariable " + id + " has no value");
            }
            if (!declared.add(id.substring(VARIABLE_SIGIL.length()))) {
                throw new CompilationException("Duplicate matchVariable id: " + id);
            }
        }

        List<MatchRule> rules = new ArrayList<>(matches.languageMatches().size());
        boolean hasUniversal = false;
        for (int i = 0; i < matches.languageMatches().size(); i++) {
            MatchRule rule = toRule(i, matches.languageMatches().get(i));
            for (String name : rule.desired().variableNames()) {
                requireDeclared(i, name, declared);
            }
            for (String name : rule.supported().variableNames()) {
                requireDeclared(i, name, declared);
            }
            hasUniversal |= rule.isUniversal();
            rules.add(rule);
        }
        if (!hasUniversal) {
            throw new CompilationException(
                    "Language matching table has no universal fallback rule (desired=\"*_*_*\" supported=\"*_*_*\")");
        }

        String paradigmLocales = matches.paradigmLocales() != null ? matches.paradigmLocales().locales() : null;
        return new ValidatedTable(matches.type(), rules, matches.matchVariables(), paradigmLocales);
    }

    private MatchRule toRule(int index, LanguageMatch match) {
        if (match.desired() == null || match.supported() == null) {
            throw new CompilationException("languageMatch at index " + index + " has missing desired or supported pattern");
        }
        if (match.distance() == null) {
            throw new CompilationException("languageMatch at index " + index + " ("
                    + match.desired() + " / " + match.supported() + ") has no distance");
        }
        if (match.distance() < 0 || match.distance() > MatchRule.MAX_BASE_DISTANCE) {
            throw new CompilationException("languageMatch at index " + index + " has distance "
                    + match.distance() + " outside 0.." + MatchRule.MAX_BASE_DISTANCE);
        }
        try {
            return new MatchRule(
                    TagPattern.parse(match.desired()),
                    TagPattern.parse(match.supported()),
                    match.distance(),
                    match.oneway());
        } catch (IllegalArgumentException e) {
            throw new CompilationException("languageMatch at index " + index + ": " + e.getMessage(), e);
        }
    }

    private void requireDeclared(int index, String name, Set<String> declared) {
        if (!declared.contains(name)) {
            throw new CompilationException("languageMatch at index " + index + " references undefined variable $" + name);
        }
    }

    /**
     * Evaluates variable values left to right: {@code +} adds, {@code -}
     * removes. A {@code $name} operand stands for the set of a variable
     * defined earlier in the table.
     */
    private VariableTable expandVariables(List<MatchVariable> definitions) {
        Map<String, ObjectSet<String>> expanded = new Object2ObjectLinkedOpenHashMap<>();
        for (MatchVariable definition : definitions) {
            String name = definition.id().substring(VARIABLE_SIGIL.length());
            expanded.put(name, evaluateExpression(definition, expanded));
        }
        return VariableTable.of(expanded);
    }

    private ObjectSet<String> evaluateExpression(MatchVariable definition, Map<String, ObjectSet<String>> defined) {
        ObjectSet<String> values = new ObjectLinkedOpenHashSet<>();
        String expression = definition.value().trim();
        boolean adding = true;
        int start = 0;
        for (int i = 0; i <= expression.length(); i++) {
            boolean atEnd = i == expression.length();
            char c = atEnd ? 0 : expression.charAt(i);
            if (!atEnd && c != '+' && c != '-') {
                continue;
            }
            String operand = expression.substring(start, i).trim();
            if (operand.isEmpty()) {
                throw new CompilationException("matchVariable " + definition.id()
                        + " has an empty operand in value: " + definition.value());
            }
            Set<String> operandValues = resolveOperand(definition, operand, defined);
            if (adding) {
                values.addAll(operandValues);
            } else {
                values.removeAll(operandValues);
            }
            adding = c == '+';
            start = i + 1;
        }
        if (values.isEmpty()) {
            logger.warning("matchVariable " + definition.id() + " evaluates to an empty set");
        }
        return values;
    }

    private Set<String> resolveOperand(MatchVariable definition, String operand, Map<String, ObjectSet<String>> defined) {
        if (!operand.startsWith(VARIABLE_SIGIL)) {
            return Set.of(operand);
        }
        ObjectSet<String> referenced = defined.get(operand.substring(VARIABLE_SIGIL.length()));
        if (referenced == null) {
            throw new CompilationException("matchVariable " + definition.id()
                    + " references " + operand + " before it is defined");
        }
        return referenced;
    }

    private List<LanguageIdentifier> expandParadigmLocales(String locales) {
        List<LanguageIdentifier> paradigms = new ArrayList<>();
        if (locales == null || locales.isBlank()) {
            logger.warning("Language matching table declares no paradigm locales");
            return paradigms;
        }
        Set<LanguageIdentifier> seen = new HashSet<>();
        for (String tag : locales.trim().split("\\s+")) {
            LanguageIdentifier maximized;
            try {
                maximized = expander.maximize(LanguageIdentifier.parse(tag));
            } catch (IllegalArgumentException e) {
                throw new CompilationException("Invalid paradigm locale '" + tag + "': " + e.getMessage(), e);
            }
            if (maximized == null || !maximized.isMaximized()) {
                throw new CompilationException("Paradigm locale '" + tag + "' could not be maximized, got: " + maximized);
            }
            if (seen.add(maximized)) {
                paradigms.add(maximized);
            }
        }
        return paradigms;
    }

    private MatchingModel buildModel(ValidatedTable table,
                                     VariableTable variables,
                                     List<LanguageIdentifier> paradigms,
                                     long startTime) {
        RuleShadowAnalyzer.ShadowReport report = shadowAnalyzer.analyze(table.rules());
        for (RuleShadowAnalyzer.ShadowedRule shadowed : report.shadowedRules()) {
            logger.warning("Rule #" + shadowed.ruleIndex() + " [" + shadowed.rule() + "] can never match: "
                    + shadowed.reason() + " (rule #" + shadowed.shadowedBy() + ")");
        }

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("type", table.type() != null ? table.type() : "");
        metadata.put("universalRuleIndex", report.universalRuleIndex());
        metadata.put("shadowedRules", report.shadowedCount());

        TableStats stats = new TableStats(
                table.rules().size(),
                variables.size(),
                paradigms.size(),
                System.nanoTime() - startTime,
                metadata);

        MatchingModel.Builder builder = MatchingModel.builder()
                .addRules(table.rules())
                .withVariables(variables)
                .withStats(stats);
        paradigms.forEach(builder::addParadigmLocale);
        return builder.build();
    }

    private <T> T runStage(String stageName,
                           int stageNumber,
                           StageAction<T> action,
                           Function<T, Map<String, Object>> metrics) throws IOException {
        CompilationListener current = listener;
        Span span = tracer.spanBuilder(stageName.toLowerCase().replace('_', '-')).startSpan();
        try (Scope scope = span.makeCurrent()) {
            if (current != null) {
                current.onStageStart(stageName, stageNumber, TOTAL_STAGES);
            }
            long start = System.nanoTime();
            T result = action.run();
            if (current != null) {
                current.onStageComplete(stageName, new CompilationListener.StageResult(
                        stageName, System.nanoTime() - start, metrics.apply(result)));
            }
            return result;
        } catch (IOException | CompilationException e) {
            span.recordException(e);
            if (current != null) {
                current.onError(stageName, e);
            }
            throw e;
        } finally {
            span.end();
        }
    }

    @FunctionalInterface
    private interface StageAction<T> {
        T run() throws IOException;
    }

    private record ValidatedTable(
            String type,
            List<MatchRule> rules,
            List<MatchVariable> variables,
            String paradigmLocales
    ) {
    }
}
