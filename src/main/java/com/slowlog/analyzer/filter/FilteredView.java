package com.slowlog.analyzer.filter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import com.slowlog.analyzer.accumulator.Accumulator;
import com.slowlog.analyzer.accumulator.GlobalSummary;
import com.slowlog.analyzer.accumulator.TemplateKey;
import com.slowlog.analyzer.accumulator.TemplateStats;
import com.slowlog.analyzer.model.AnalysisResult;
import com.slowlog.analyzer.model.AnalyzedQuery;

/**
 * Read-only subset of an analysis. Summaries over the subset are computed on first use.
 */
public class FilteredView {

    private final AnalysisResult source;
    private final FilterSpec spec;
    private final List<AnalyzedQuery> records;
    private final double[] histogramBounds;
    private Accumulator accumulator;

    public FilteredView(AnalysisResult source, FilterSpec spec, double[] histogramBounds) {
        this.source = source;
        this.spec = spec;
        this.records = Collections.unmodifiableList(RecordFilter.apply(source.getRecords(), spec));
        this.histogramBounds = histogramBounds.clone();
    }

    public AnalysisResult getSource() {
        return source;
    }

    public FilterSpec getSpec() {
        return spec;
    }

    public List<AnalyzedQuery> getRecords() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public Map<TemplateKey, TemplateStats> getTemplateStats() {
        return summaries().getTemplateStats();
    }

    public GlobalSummary getGlobalSummary() {
        return summaries().getGlobalSummary();
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

    /**
     * Records sorted by query time, slowest first; ties keep parse order.
     *
     * @param page 1-based page number
     */
    public RecordPage page(int page, int pageSize) {
        if (page < 1 || pageSize < 1) {
            throw new IllegalArgumentException("page and pageSize must be positive");
        }
        List<AnalyzedQuery> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparingDouble(AnalyzedQuery::getQueryTime).reversed());
        long from = (long) (page - 1) * pageSize;
        List<AnalyzedQuery> items;
        if (from >= sorted.size()) {
            items = Collections.emptyList();
        } else {
            items = new ArrayList<>(sorted.subList((int) from, (int) Math.min(from + pageSize, sorted.size())));
        }
        return new RecordPage(Collections.unmodifiableList(items), page, pageSize, sorted.size());
    }

    private synchronized Accumulator summaries() {
        if (accumulator == null) {
            accumulator = new Accumulator(histogramBounds);
            accumulator.accumulateAll(records);
        }
        return accumulator;
    }
}
