package com.slowlog.analyzer.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.slowlog.analyzer.InvalidMergeException;
import com.slowlog.analyzer.ParseDiagnostics;
import com.slowlog.analyzer.accumulator.TemplateKey;
import com.slowlog.analyzer.config.AnalyzerConfig;
import com.slowlog.analyzer.model.AnalysisMetadata;
import com.slowlog.analyzer.model.AnalysisMetadata.MergeInfo;
import com.slowlog.analyzer.model.AnalysisMetadata.SourceDetail;
import com.slowlog.analyzer.model.AnalysisResult;
import com.slowlog.analyzer.model.AnalyzedQuery;

/**
 * Combines several analyses into one by concatenating their records and folding them again.
 * <p>
 * Statistics of the inputs are never added together; the merged template statistics and summary are exactly those
 * of a fresh analysis over the concatenated records.
 */
public class MergeService {

    private static final Logger logger = LoggerFactory.getLogger(MergeService.class);

    private final AnalyzerConfig config;

    public MergeService(AnalyzerConfig config) {
        this.config = config;
    }

    /**
     * @throws InvalidMergeException when fewer than two inputs are given or an input is missing
     */
    public AnalysisResult merge(List<AnalysisResult> inputs, String newName) {
        if (inputs == null || inputs.size() < 2) {
            throw new InvalidMergeException("At least two analyses are required for a merge, got "
                    + (inputs == null ? 0 : inputs.size()));
        }
        List<String> names = new ArrayList<>();
        for (int i = 0; i < inputs.size(); i++) {
            AnalysisResult input = inputs.get(i);
            if (input == null || input.getRecords() == null) {
                throw new InvalidMergeException("Merge input " + (i + 1) + " has no record data");
            }
            names.add(input.getName());
        }
        return combine(inputs, newName, names);
    }

    /**
     * Merges without the input count check, for callers that already dropped unusable inputs.
     */
    AnalysisResult combine(List<AnalysisResult> inputs, String newName, List<String> mergedFrom) {
        if (newName == null || newName.trim().isEmpty()) {
            throw new InvalidMergeException("A name is required for the merged analysis");
        }
        long start = System.currentTimeMillis();

        List<AnalyzedQuery> records = new ArrayList<>();
        List<String> sourceFiles = new ArrayList<>();
        List<ParseDiagnostics> diagnostics = new ArrayList<>();
        List<SourceDetail> details = new ArrayList<>();
        for (AnalysisResult input : inputs) {
            records.addAll(input.getRecords());
            sourceFiles.addAll(input.getSourceFiles());
            diagnostics.add(input.getDiagnostics());
            details.add(new SourceDetail(input.getName(), input.getTotalQueries(), input.getTotalTemplates()));
        }

        String now = Instant.now().toString();
        Set<TemplateKey> keys = new HashSet<>();
        records.forEach(q -> keys.add(q.getKey()));
        MergeInfo mergeInfo = new MergeInfo(mergedFrom, now, details);
        AnalysisMetadata metadata = new AnalysisMetadata("Merged from: " + String.join(", ", mergedFrom), now,
                records.size(), keys.size(), mergeInfo);

        AnalysisResult merged = AnalysisResult.fromRecords(newName, records, sourceFiles,
                ParseDiagnostics.combine(diagnostics), metadata, config.getHistogramBounds());
        logger.info("Merged {} analyses into '{}': {} queries, {} templates in {} ms", inputs.size(), newName,
                merged.getTotalQueries(), merged.getTotalTemplates(), System.currentTimeMillis() - start);
        return merged;
    }
}
