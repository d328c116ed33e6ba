package com.slowlog.analyzer.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tunables of the analysis pipeline, loaded from properties.
 * <p>
 * Defaults come from {@code slowlog-analyzer.properties} on the classpath. Supported keys:
 * <ul>
 * <li>histogram.bounds: comma-separated, ascending upper bounds in seconds of the execution time buckets</li>
 * <li>grade.thresholds: four ascending bounds in seconds for excellent/good/average/poor</li>
 * <li>parser.maxRecords: stop each file after this many records, 0 for no limit</li>
 * <li>parser.maxLineLength: longer log lines are truncated</li>
 * <li>normalizer.chunkSize: records per normalization task</li>
 * <li>workers.threads: worker pool size, 0 for the number of processors</li>
 * </ul>
 */
public class AnalyzerConfig {

    private static final Logger logger = LoggerFactory.getLogger(AnalyzerConfig.class);

    public static final String DEFAULTS_RESOURCE = "slowlog-analyzer.properties";

    private double[] histogramBounds = { 1, 10, 30, 60 };
    private double[] gradeThresholds = { 1, 5, 10, 30 };
    private long maxRecords = 0;
    private int maxLineLength = 1024 * 1024;
    private int chunkSize = 5000;
    private int threads = 0;

    /**
     * Built-in defaults overlaid with the classpath defaults file, when present.
     */
    public static AnalyzerConfig loadDefaults() {
        AnalyzerConfig config = new AnalyzerConfig();
        try (InputStream in = AnalyzerConfig.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                Properties props = new Properties();
                props.load(in);
                config.loadFromProperties(props);
            }
        } catch (IOException e) {
            logger.warn("Could not read {} from classpath, using built-in defaults", DEFAULTS_RESOURCE);
        }
        return config;
    }

    /**
     * Defaults overridden by the given properties file.
     */
    public static AnalyzerConfig load(Path configFile) throws IOException {
        AnalyzerConfig config = loadDefaults();
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(configFile)) {
            props.load(in);
        }
        config.loadFromProperties(props);
        logger.info("Loaded analyzer configuration from: {}", configFile);
        return config;
    }

    public void loadFromProperties(Properties props) {
        String bounds = props.getProperty("histogram.bounds");
        if (bounds != null && !bounds.trim().isEmpty()) {
            setHistogramBounds(parseBounds("histogram.bounds", bounds));
        }

        String grades = props.getProperty("grade.thresholds");
        if (grades != null && !grades.trim().isEmpty()) {
            setGradeThresholds(parseBounds("grade.thresholds", grades));
        }

        maxRecords = parseLong(props, "parser.maxRecords", maxRecords);
        maxLineLength = parseInt(props, "parser.maxLineLength", maxLineLength);
        chunkSize = parseInt(props, "normalizer.chunkSize", chunkSize);
        threads = parseInt(props, "workers.threads", threads);

        if (maxRecords < 0 || maxLineLength <= 0 || chunkSize <= 0 || threads < 0) {
            throw new IllegalArgumentException("Invalid analyzer configuration: " + this);
        }
    }

    private static double[] parseBounds(String key, String list) {
        String[] parts = list.split(",");
        double[] values = new double[parts.length];
        for (int i = 0; i < parts.length; i++) {
            try {
                values[i] = Double.parseDouble(parts[i].trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number '" + parts[i].trim() + "' in " + key, e);
            }
        }
        return values;
    }

    private static long parseLong(Properties props, String key, long defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number '" + value.trim() + "' for " + key, e);
        }
    }

    private static int parseInt(Properties props, String key, int defaultValue) {
        long value = parseLong(props, key, defaultValue);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Value " + value + " for " + key + " is out of range");
        }
        return (int) value;
    }

    private static void checkAscending(String name, double[] values) {
        if (values.length == 0) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
        for (int i = 0; i < values.length; i++) {
            if (values[i] <= 0 || (i > 0 && values[i] <= values[i - 1])) {
                throw new IllegalArgumentException(name + " must be positive and strictly ascending: "
                        + Arrays.toString(values));
            }
        }
    }

    public double[] getHistogramBounds() {
        return histogramBounds.clone();
    }

    public void setHistogramBounds(double[] histogramBounds) {
        checkAscending("histogram.bounds", histogramBounds);
        this.histogramBounds = histogramBounds.clone();
    }

    public double[] getGradeThresholds() {
        return gradeThresholds.clone();
    }

    public void setGradeThresholds(double[] gradeThresholds) {
        checkAscending("grade.thresholds", gradeThresholds);
        if (gradeThresholds.length != 4) {
            throw new IllegalArgumentException("grade.thresholds needs exactly 4 values: "
                    + Arrays.toString(gradeThresholds));
        }
        this.gradeThresholds = gradeThresholds.clone();
    }

    public long getMaxRecords() {
        return maxRecords;
    }

    public void setMaxRecords(long maxRecords) {
        if (maxRecords < 0) {
            throw new IllegalArgumentException("maxRecords must not be negative");
        }
        this.maxRecords = maxRecords;
    }

    public int getMaxLineLength() {
        return maxLineLength;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        this.chunkSize = chunkSize;
    }

    public int getThreads() {
        return threads > 0 ? threads : Runtime.getRuntime().availableProcessors();
    }

    public void setThreads(int threads) {
        this.threads = threads;
    }

    @Override
    public String toString() {
        return String.format("histogram.bounds=%s grade.thresholds=%s parser.maxRecords=%d parser.maxLineLength=%d "
                + "normalizer.chunkSize=%d workers.threads=%d", Arrays.toString(histogramBounds),
                Arrays.toString(gradeThresholds), maxRecords, maxLineLength, chunkSize, threads);
    }
}
