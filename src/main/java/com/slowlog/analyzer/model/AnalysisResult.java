package com.slowlog.analyzer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.slowlog.analyzer.ParseDiagnostics;
import com.slowlog.analyzer.accumulator.Accumulator;
import com.slowlog.analyzer.accumulator.GlobalSummary;
import com.slowlog.analyzer.accumulator.TemplateKey;
import com.slowlog.analyzer.accumulator.TemplateStats;

/**
 * Outcome of analyzing one or more slow logs.
 * <p>
 * Records are kept in parse order. Template statistics and the global summary are always derived from the records
 * by a single fold and are never updated independently.
 */
public class AnalysisResult {

    private final String name;
    private final List<AnalyzedQuery> records;
    private final Map<TemplateKey, TemplateStats> templateStats;
    private final GlobalSummary globalSummary;
    private final List<String> sourceFiles;
    private final ParseDiagnostics diagnostics;
    private final AnalysisMetadata metadata;

    private AnalysisResult(String name, List<AnalyzedQuery> records, Accumulator accumulator,
            List<String> sourceFiles, ParseDiagnostics diagnostics, AnalysisMetadata metadata) {
        this.name = name;
        this.records = records;
        this.templateStats = accumulator.getTemplateStats();
        this.globalSummary = accumulator.getGlobalSummary();
        this.sourceFiles = sourceFiles;
        this.diagnostics = diagnostics;
        this.metadata = metadata;
    }

    /**
     * Folds the records into a new result.
     */
    public static AnalysisResult fromRecords(String name, List<AnalyzedQuery> records, List<String> sourceFiles,
            ParseDiagnostics diagnostics, AnalysisMetadata metadata, double[] histogramBounds) {
        List<AnalyzedQuery> copy = Collections.unmodifiableList(new ArrayList<>(records));
        Accumulator accumulator = new Accumulator(histogramBounds);
        accumulator.accumulateAll(copy);
        return new AnalysisResult(name, copy, accumulator,
                Collections.unmodifiableList(new ArrayList<>(sourceFiles)),
                diagnostics != null ? diagnostics : new ParseDiagnostics(), metadata);
    }

    public String getName() {
        return name;
    }

    public List<AnalyzedQuery> getRecords() {
        return records;
    }

    public Map<TemplateKey, TemplateStats> getTemplateStats() {
        return templateStats;
    }

    public GlobalSummary getGlobalSummary() {
        return globalSummary;
    }

    public List<String> getSourceFiles() {
        return sourceFiles;
    }

    public ParseDiagnostics getDiagnostics() {
        return diagnostics;
    }

    public AnalysisMetadata getMetadata() {
        return metadata;
    }

    public long getTotalQueries() {
        return records.size();
    }

    public long getTotalTemplates() {
        return templateStats.size();
    }

    public List<AnalyzedQuery> recordsForTemplate(TemplateKey key) {
        List<AnalyzedQuery> result = new ArrayList<>();
        for (AnalyzedQuery query : records) {
            if (query.getKey().equals(key)) {
                result.add(query);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return String.format("AnalysisResult[%s: %d queries, %d templates, sources=%s]", name, records.size(),
                templateStats.size(), sourceFiles);
    }
}
