package com.slowlog.analyzer;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import com.slowlog.analyzer.model.AnalyzedQuery;

/**
 * Normalizes the SQL of one chunk of records.
 */
public class NormalizerTask implements Callable<ParsedChunk<AnalyzedQuery>> {

    private final int index;
    private final List<SlowQuery> recordsChunk;

    public NormalizerTask(int index, List<SlowQuery> recordsChunk) {
        this.index = index;
        this.recordsChunk = recordsChunk;
    }

    @Override
    public ParsedChunk<AnalyzedQuery> call() {
        List<AnalyzedQuery> analyzed = new ArrayList<>(recordsChunk.size());
        for (SlowQuery record : recordsChunk) {
            analyzed.add(AnalyzedQuery.of(record));
        }
        return new ParsedChunk<>(index, analyzed);
    }
}
