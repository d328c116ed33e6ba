package com.slowlog.analyzer.service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.slowlog.analyzer.FileParseException;
import com.slowlog.analyzer.InvalidMergeException;
import com.slowlog.analyzer.NormalizerTask;
import com.slowlog.analyzer.ParsedChunk;
import com.slowlog.analyzer.SlowLogException;
import com.slowlog.analyzer.SlowLogParser;
import com.slowlog.analyzer.SlowLogReader;
import com.slowlog.analyzer.SlowQuery;
import com.slowlog.analyzer.accumulator.TemplateKey;
import com.slowlog.analyzer.config.AnalyzerConfig;
import com.slowlog.analyzer.filter.FilterSpec;
import com.slowlog.analyzer.filter.FilteredView;
import com.slowlog.analyzer.model.AnalysisMetadata;
import com.slowlog.analyzer.model.AnalysisResult;
import com.slowlog.analyzer.model.AnalyzedQuery;
import com.slowlog.analyzer.store.AnalysisStore;

/**
 * Runs the parse, normalize and aggregate pipeline and exposes merge and filter over its results.
 * <p>
 * Holds configuration only; every call works on its own readers, worker pool and accumulator.
 */
public class AnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisService.class);

    private final AnalyzerConfig config;
    private final SlowLogParser parser;
    private final MergeService mergeService;
    private final AnalysisStore store;

    public AnalysisService(AnalyzerConfig config) {
        this(config, null);
    }

    public AnalysisService(AnalyzerConfig config, AnalysisStore store) {
        this.config = config;
        this.parser = new SlowLogParser(config);
        this.mergeService = new MergeService(config);
        this.store = store;
    }

    public AnalyzerConfig getConfig() {
        return config;
    }

    public AnalysisResult parse(String text, String name, String sourceId) {
        try {
            return parse(new StringReader(text), name, sourceId, true);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Parses one log file; names ending in .gz are decompressed.
     */
    public AnalysisResult parse(Path file, String name) throws FileParseException {
        return parseFile(file, name, true);
    }

    /**
     * Parses the files concurrently, one task per file. A file that cannot be read is reported in
     * {@link ParseOutcome#getFailures()} and does not affect the others.
     */
    public ParseOutcome parseAll(List<Path> files) throws InterruptedException {
        if (files.isEmpty()) {
            return new ParseOutcome(Collections.emptyList(), Collections.emptyList());
        }
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(config.getThreads(), files.size()));
        CompletionService<ParsedChunk<Object>> completionService = new ExecutorCompletionService<>(executor);
        try {
            for (int i = 0; i < files.size(); i++) {
                final int index = i;
                final Path file = files.get(i);
                completionService.submit(() -> {
                    Object outcome;
                    try {
                        outcome = parseFile(file, sourceIdOf(file), false);
                    } catch (FileParseException e) {
                        outcome = e;
                    }
                    return new ParsedChunk<>(index, Collections.singletonList(outcome));
                });
            }

            Object[] outcomes = new Object[files.size()];
            for (int i = 0; i < files.size(); i++) {
                ParsedChunk<Object> chunk = take(completionService);
                outcomes[chunk.getIndex()] = chunk.getItems().get(0);
            }

            List<AnalysisResult> results = new ArrayList<>();
            List<FileParseException> failures = new ArrayList<>();
            for (int i = 0; i < outcomes.length; i++) {
                if (outcomes[i] instanceof AnalysisResult) {
                    results.add((AnalysisResult) outcomes[i]);
                } else {
                    FileParseException failure = (FileParseException) outcomes[i];
                    logger.error("Failed to process {}: {}", failure.getSource(), failure.getCause().getMessage());
                    failures.add(failure);
                }
            }
            return new ParseOutcome(results, failures);
        } finally {
            cleanup(executor);
        }
    }

    public AnalysisResult merge(List<AnalysisResult> inputs, String newName) {
        return mergeService.merge(inputs, newName);
    }

    /**
     * Loads the named analyses from the store and merges them. Analyses that cannot be loaded are logged and left
     * out.
     *
     * @throws InvalidMergeException when fewer than two names are given or none of them could be loaded
     */
    public AnalysisResult mergeStored(List<String> names, String newName) {
        if (store == null) {
            throw new IllegalStateException("No analysis store configured");
        }
        if (names == null || names.size() < 2) {
            throw new InvalidMergeException("At least two analyses are required for a merge");
        }
        List<AnalysisResult> loaded = new ArrayList<>();
        for (String name : names) {
            try {
                loaded.add(store.load(name));
            } catch (IOException | SlowLogException | IllegalArgumentException e) {
                logger.warn("Skipping analysis '{}' in merge: {}", name, e.getMessage());
            }
        }
        if (loaded.isEmpty()) {
            throw new InvalidMergeException("no valid input data");
        }
        return mergeService.combine(loaded, newName, names);
    }

    public FilteredView filter(AnalysisResult result, FilterSpec spec) {
        return new FilteredView(result, spec, config.getHistogramBounds());
    }

    private AnalysisResult parseFile(Path file, String name, boolean parallelNormalize) throws FileParseException {
        String sourceId = sourceIdOf(file);
        try (BufferedReader in = SlowLogParser.createReader(file)) {
            return parse(in, name, sourceId, parallelNormalize);
        } catch (IOException | UncheckedIOException e) {
            throw new FileParseException(sourceId, e);
        }
    }

    private AnalysisResult parse(Reader in, String name, String sourceId, boolean parallelNormalize)
            throws IOException {
        long start = System.currentTimeMillis();
        List<SlowQuery> records = new ArrayList<>();
        SlowLogReader reader = parser.open(in, sourceId);
        try {
            reader.forEachRemaining(records::add);
        } finally {
            reader.close();
        }

        List<AnalyzedQuery> analyzed = parallelNormalize ? normalizeAll(records) : normalizeSequential(records);

        Set<TemplateKey> keys = new HashSet<>();
        analyzed.forEach(q -> keys.add(q.getKey()));
        AnalysisMetadata metadata = new AnalysisMetadata(sourceId, Instant.now().toString(), analyzed.size(),
                keys.size(), null);
        AnalysisResult result = AnalysisResult.fromRecords(name, analyzed, Collections.singletonList(sourceId),
                reader.getDiagnostics(), metadata, config.getHistogramBounds());

        logger.info("[{}] Parsing complete - Duration: {}ms | {} queries, {} templates | {}", sourceId,
                System.currentTimeMillis() - start, result.getTotalQueries(), result.getTotalTemplates(),
                reader.getDiagnostics());
        return result;
    }

    private List<AnalyzedQuery> normalizeSequential(List<SlowQuery> records) {
        return new NormalizerTask(0, records).call().getItems();
    }

    /**
     * Normalizes in fixed-size chunks on a worker pool and reassembles the chunks in record order.
     */
    List<AnalyzedQuery> normalizeAll(List<SlowQuery> records) {
        int chunkSize = config.getChunkSize();
        if (records.size() <= chunkSize || config.getThreads() == 1) {
            return normalizeSequential(records);
        }
        int chunks = (records.size() + chunkSize - 1) / chunkSize;
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(config.getThreads(), chunks));
        CompletionService<ParsedChunk<AnalyzedQuery>> completionService = new ExecutorCompletionService<>(executor);
        try {
            for (int i = 0; i < chunks; i++) {
                List<SlowQuery> chunk = records.subList(i * chunkSize, Math.min((i + 1) * chunkSize, records.size()));
                completionService.submit(new NormalizerTask(i, new ArrayList<>(chunk)));
            }

            List<List<AnalyzedQuery>> ordered = new ArrayList<>(Collections.<List<AnalyzedQuery>>nCopies(chunks, null));
            for (int i = 0; i < chunks; i++) {
                ParsedChunk<AnalyzedQuery> done = take(completionService);
                ordered.set(done.getIndex(), done.getItems());
            }

            List<AnalyzedQuery> result = new ArrayList<>(records.size());
            ordered.forEach(result::addAll);
            logger.debug("Normalized {} records in {} chunks", records.size(), chunks);
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SlowLogException("Interrupted while normalizing queries", e);
        } finally {
            cleanup(executor);
        }
    }

    private static <T> T take(CompletionService<T> completionService) throws InterruptedException {
        try {
            return completionService.take().get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new SlowLogException("Task execution failed", cause);
        }
    }

    private static void cleanup(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
                logger.warn("Executor did not terminate gracefully");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            logger.warn("Executor interrupted");
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static String sourceIdOf(Path file) {
        Path fileName = file.getFileName();
        return fileName != null ? fileName.toString() : file.toString();
    }

    /**
     * Per-file results of {@link AnalysisService#parseAll(List)}, in the order the files were given.
     */
    public static class ParseOutcome {

        private final List<AnalysisResult> results;
        private final List<FileParseException> failures;

        public ParseOutcome(List<AnalysisResult> results, List<FileParseException> failures) {
            this.results = Collections.unmodifiableList(results);
            this.failures = Collections.unmodifiableList(failures);
        }

        public List<AnalysisResult> getResults() {
            return results;
        }

        public List<FileParseException> getFailures() {
            return failures;
        }

        public boolean hasFailures() {
            return !failures.isEmpty();
        }
    }
}
