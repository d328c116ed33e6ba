package com.slowlog.analyzer.accumulator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.slowlog.analyzer.model.AnalyzedQuery;

/**
 * Left fold of analyzed records into per-template statistics and a global summary.
 * <p>
 * Not thread safe; every fold uses its own instance.
 */
public class Accumulator {

    private final Map<TemplateKey, TemplateStats> templateStats = new LinkedHashMap<>();
    private final GlobalSummary globalSummary;

    public Accumulator(double[] histogramBounds) {
        this.globalSummary = new GlobalSummary(histogramBounds);
    }

    public void accumulate(AnalyzedQuery query) {
        TemplateKey key = query.getKey();
        TemplateStats stats = templateStats.get(key);
        if (stats == null) {
            stats = new TemplateStats(query.getTemplate());
            templateStats.put(key, stats);
        }
        stats.addExecution(query.getRecord(), query.getTemplate());
        globalSummary.add(query);
    }

    public void accumulateAll(Iterable<AnalyzedQuery> queries) {
        for (AnalyzedQuery query : queries) {
            accumulate(query);
        }
    }

    /**
     * Folds the given record lists, in order, into a fresh accumulator. Statistics are always recomputed from
     * records, never added up from earlier results.
     */
    public static Accumulator combine(double[] histogramBounds, List<? extends List<AnalyzedQuery>> parts) {
        Accumulator accumulator = new Accumulator(histogramBounds);
        for (List<AnalyzedQuery> part : parts) {
            accumulator.accumulateAll(part);
        }
        return accumulator;
    }

    public TemplateStats getTemplateStats(TemplateKey key) {
        return templateStats.get(key);
    }

    public Map<TemplateKey, TemplateStats> getTemplateStats() {
        return Collections.unmodifiableMap(templateStats);
    }

    public GlobalSummary getGlobalSummary() {
        return globalSummary;
    }
}
