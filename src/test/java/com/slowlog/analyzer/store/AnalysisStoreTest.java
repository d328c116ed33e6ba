package com.slowlog.analyzer.store;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.slowlog.analyzer.SlowLogException;
import com.slowlog.analyzer.SlowLogFixtures;
import com.slowlog.analyzer.config.AnalyzerConfig;
import com.slowlog.analyzer.model.AnalysisResult;
import com.slowlog.analyzer.service.AnalysisService;

public class AnalysisStoreTest {

    @TempDir
    Path dataDir;

    private AnalyzerConfig config;
    private AnalysisService service;
    private AnalysisStore store;

    @BeforeEach
    public void setUp() {
        config = new AnalyzerConfig();
        store = new AnalysisStore(dataDir, config);
        service = new AnalysisService(config, store);
    }

    @Test
    public void testSaveAndLoad() throws IOException {
        AnalysisResult original = service.parse(SlowLogFixtures.fixtureText(SlowLogFixtures.MARIADB), "maria",
                "mariadb-slow.log");
        Path file = store.save(original);
        assertEquals(dataDir.resolve("maria.json"), file);
        assertTrue(store.exists("maria"));

        AnalysisResult loaded = store.load("maria");
        assertEquals("maria", loaded.getName());
        assertEquals(original.getRecords(), loaded.getRecords());
        assertEquals(original.getTemplateStats(), loaded.getTemplateStats());
        assertEquals(original.getGlobalSummary(), loaded.getGlobalSummary());
        assertEquals(original.getSourceFiles(), loaded.getSourceFiles());
        assertEquals(original.getMetadata(), loaded.getMetadata());
        assertEquals(original.getDiagnostics().getEntries(), loaded.getDiagnostics().getEntries());
    }

    @Test
    public void testMergedMetadataSurvivesRoundTrip() throws IOException {
        AnalysisResult merged = service.merge(Arrays.asList(
                service.parse(SlowLogFixtures.log(3), "a", "a.log"),
                service.parse(SlowLogFixtures.log(2), "b", "b.log")), "ab");
        store.save(merged);

        AnalysisResult loaded = store.load("ab");
        assertTrue(loaded.getMetadata().isMerged());
        assertEquals(merged.getMetadata(), loaded.getMetadata());
        assertEquals(5, loaded.getTotalQueries());
    }

    @Test
    public void testListNewestFirst() throws IOException {
        store.save(service.parse(SlowLogFixtures.log(1), "old", "old.log"));
        store.save(service.parse(SlowLogFixtures.log(1), "new", "new.log"));
        store.save(service.parse(SlowLogFixtures.log(1), "also-new", "also.log"));
        Files.setLastModifiedTime(dataDir.resolve("old.json"), FileTime.fromMillis(1_000_000L));
        Files.setLastModifiedTime(dataDir.resolve("new.json"), FileTime.fromMillis(2_000_000L));
        Files.setLastModifiedTime(dataDir.resolve("also-new.json"), FileTime.fromMillis(2_000_000L));
        Files.writeString(dataDir.resolve("notes.txt"), "ignored");

        assertEquals(Arrays.asList("also-new", "new", "old"), store.list());
    }

    @Test
    public void testListOfMissingDirectory() throws IOException {
        assertEquals(Collections.emptyList(), new AnalysisStore(dataDir.resolve("none"), config).list());
    }

    @Test
    public void testDelete() throws IOException {
        store.save(service.parse(SlowLogFixtures.log(1), "gone", "gone.log"));
        assertTrue(store.delete("gone"));
        assertFalse(store.exists("gone"));
        assertFalse(store.delete("gone"));
    }

    @Test
    public void testLoadMissing() {
        AnalysisNotFoundException e = assertThrows(AnalysisNotFoundException.class, () -> store.load("nothing"));
        assertEquals("nothing", e.getName());
    }

    @Test
    public void testInvalidNames() {
        assertThrows(IllegalArgumentException.class, () -> store.load("../etc"));
        assertThrows(IllegalArgumentException.class, () -> store.exists(""));
        assertThrows(IllegalArgumentException.class, () -> store.load(".hidden"));
        assertThrows(IllegalArgumentException.class, () -> store.delete("a\\b"));
    }

    @Test
    public void testCachedSummariesAreIgnored() throws IOException {
        AnalysisResultCodec codec = new AnalysisResultCodec(config);
        AnalysisResult original = service.parse(SlowLogFixtures.log(4), "x", "x.log");
        ObjectNode json = codec.toJson(original, true);
        json.putArray("templateStats").addObject().put("normalizedText", "bogus").put("count", 999);
        json.putObject("globalSummary").put("totalQueries", 999);

        AnalysisResult loaded = codec.fromJson(json);
        assertEquals(original.getTemplateStats(), loaded.getTemplateStats());
        assertEquals(4, loaded.getGlobalSummary().getTotalQueries());
    }

    @Test
    public void testArtifactWithoutRecordsIsRejected() throws IOException {
        AnalysisResultCodec codec = new AnalysisResultCodec(config);
        ObjectNode json = new ObjectMapper().createObjectNode().put("name", "empty");
        assertThrows(SlowLogException.class, () -> codec.fromJson(json));

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        codec.write(service.parse("", "nothing", "nothing.log"), out);
        AnalysisResult loaded = codec.read(new ByteArrayInputStream(out.toString(StandardCharsets.UTF_8)
                .getBytes(StandardCharsets.UTF_8)));
        assertEquals(0, loaded.getTotalQueries());
    }
}
