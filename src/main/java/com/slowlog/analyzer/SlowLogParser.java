package com.slowlog.analyzer;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPInputStream;

import com.slowlog.analyzer.config.AnalyzerConfig;

/**
 * Entry point for turning slow query log text into records.
 */
public class SlowLogParser {

    private static final int BUFFER_SIZE = 1024 * 1024;

    private final long maxRecords;
    private final int maxLineLength;

    public SlowLogParser() {
        this(AnalyzerConfig.loadDefaults());
    }

    public SlowLogParser(AnalyzerConfig config) {
        this.maxRecords = config.getMaxRecords();
        this.maxLineLength = config.getMaxLineLength();
    }

    /**
     * Opens a scan over the given reader. The caller owns the returned reader and must close it.
     */
    public SlowLogReader open(Reader reader, String sourceId) {
        return new SlowLogReader(reader, sourceId, maxRecords, maxLineLength);
    }

    /**
     * Lazy view of the records in the given text. Every call to {@code iterator()} scans the text again from the
     * beginning.
     */
    public Iterable<SlowQuery> records(String text, String sourceId) {
        return () -> open(new StringReader(text), sourceId);
    }

    public List<SlowQuery> parse(String text, String sourceId) {
        List<SlowQuery> result = new ArrayList<>();
        records(text, sourceId).forEach(result::add);
        return result;
    }

    /**
     * Opens a log file for reading, decompressing it when the name ends with .gz.
     */
    public static BufferedReader createReader(Path file) throws IOException {
        InputStream in = Files.newInputStream(file);
        try {
            if (file.getFileName().toString().toLowerCase().endsWith(".gz")) {
                in = new GZIPInputStream(in);
            }
        } catch (IOException e) {
            in.close();
            throw e;
        }
        return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8), BUFFER_SIZE);
    }
}
