package com.slowlog.analyzer.config;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class AnalyzerConfigTest {

    @TempDir
    Path tempDir;

    @Test
    public void testDefaults() {
        AnalyzerConfig config = AnalyzerConfig.loadDefaults();
        assertArrayEquals(new double[] { 1, 10, 30, 60 }, config.getHistogramBounds());
        assertArrayEquals(new double[] { 1, 5, 10, 30 }, config.getGradeThresholds());
        assertEquals(0, config.getMaxRecords());
        assertEquals(1024 * 1024, config.getMaxLineLength());
        assertEquals(5000, config.getChunkSize());
        assertEquals(Runtime.getRuntime().availableProcessors(), config.getThreads());
    }

    @Test
    public void testLoadFromFile() throws IOException {
        Path file = tempDir.resolve("analyzer.properties");
        Files.writeString(file, "histogram.bounds=0.5, 2, 5\nparser.maxRecords=100\nworkers.threads=3\n");

        AnalyzerConfig config = AnalyzerConfig.load(file);
        assertArrayEquals(new double[] { 0.5, 2, 5 }, config.getHistogramBounds());
        assertEquals(100, config.getMaxRecords());
        assertEquals(3, config.getThreads());
        assertEquals(5000, config.getChunkSize());
    }

    @Test
    public void testInvalidValues() {
        AnalyzerConfig config = new AnalyzerConfig();
        assertThrows(IllegalArgumentException.class, () -> config.setHistogramBounds(new double[] { 10, 1 }));
        assertThrows(IllegalArgumentException.class, () -> config.setHistogramBounds(new double[0]));
        assertThrows(IllegalArgumentException.class, () -> config.setGradeThresholds(new double[] { 1, 2, 3 }));
        assertThrows(IllegalArgumentException.class, () -> config.setMaxRecords(-1));
        assertThrows(IllegalArgumentException.class, () -> config.setChunkSize(0));

        Properties props = new Properties();
        props.setProperty("normalizer.chunkSize", "lots");
        assertThrows(IllegalArgumentException.class, () -> config.loadFromProperties(props));

        Properties bounds = new Properties();
        bounds.setProperty("histogram.bounds", "1,x");
        assertThrows(IllegalArgumentException.class, () -> config.loadFromProperties(bounds));
    }

    @Test
    public void testIntegerValuesOutOfRange() {
        AnalyzerConfig config = new AnalyzerConfig();
        Properties props = new Properties();
        props.setProperty("parser.maxLineLength", "4294967297");
        assertThrows(IllegalArgumentException.class, () -> config.loadFromProperties(props));
        assertEquals(1024 * 1024, config.getMaxLineLength());

        Properties threads = new Properties();
        threads.setProperty("workers.threads", "2147483648");
        assertThrows(IllegalArgumentException.class, () -> config.loadFromProperties(threads));

        Properties max = new Properties();
        max.setProperty("normalizer.chunkSize", String.valueOf(Integer.MAX_VALUE));
        config.loadFromProperties(max);
        assertEquals(Integer.MAX_VALUE, config.getChunkSize());
    }

    @Test
    public void testBoundsAreCopied() {
        AnalyzerConfig config = new AnalyzerConfig();
        double[] bounds = { 1, 2 };
        config.setHistogramBounds(bounds);
        bounds[0] = 100;
        assertEquals(1, config.getHistogramBounds()[0]);
        config.getHistogramBounds()[1] = 50;
        assertEquals(2, config.getHistogramBounds()[1]);
    }
}
