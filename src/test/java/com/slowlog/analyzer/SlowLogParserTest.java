package com.slowlog.analyzer;

import static com.slowlog.analyzer.SlowLogFixtures.fixtureText;
import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Properties;

import org.junit.jupiter.api.Test;

import com.slowlog.analyzer.config.AnalyzerConfig;

public class SlowLogParserTest {

    private final SlowLogParser parser = new SlowLogParser(new AnalyzerConfig());

    @Test
    public void testParsesMysqlLog() throws IOException {
        List<SlowQuery> records = parser.parse(fixtureText(SlowLogFixtures.MYSQL57), "mysql57-slow.log");

        assertEquals(4, records.size());

        SlowQuery first = records.get(0);
        assertEquals("mysql57-slow.log", first.getSourceId());
        assertEquals("2024-03-01T10:00:00.123456Z", first.getTime());
        assertEquals(Long.valueOf(1709287200L), first.getTimestamp());
        assertEquals("app", first.getUser());
        assertEquals("localhost", first.getHost());
        assertEquals(Long.valueOf(12), first.getConnectionId());
        assertEquals(2.0, first.getQueryTime());
        assertEquals(0.0001, first.getLockTime(), 1e-9);
        assertEquals(1, first.getRowsSent());
        assertEquals(1000, first.getRowsExamined());
        assertEquals("shop", first.getDb());
        assertEquals("SELECT * FROM orders WHERE id = 42;", first.getSql());
        assertFalse(first.isIncomplete());
    }

    @Test
    public void testUserHostWithoutTimeStartsNewEntry() throws IOException {
        List<SlowQuery> records = parser.parse(fixtureText(SlowLogFixtures.MYSQL57), "mysql57-slow.log");

        SlowQuery second = records.get(1);
        assertEquals("report", second.getUser());
        assertEquals("10.0.0.5", second.getHost());
        assertEquals(12.0, second.getQueryTime());
        // carried forward from the previous entry
        assertEquals("2024-03-01T10:00:00.123456Z", second.getTime());
        assertNull(second.getDb());
        assertEquals("SELECT * FROM orders WHERE id = 7;", second.getSql());
    }

    @Test
    public void testMultiLineSqlAndPreambleInsideFile() throws IOException {
        List<SlowQuery> records = parser.parse(fixtureText(SlowLogFixtures.MYSQL57), "mysql57-slow.log");

        assertEquals("UPDATE users\n   SET last_login = '2024-03-01 10:05:00'\n WHERE id = 99;",
                records.get(2).getSql());

        SlowQuery last = records.get(3);
        assertEquals("batch", last.getUser());
        assertEquals("worker1", last.getHost());
        assertEquals(35.25, last.getQueryTime());
        assertTrue(last.getSql().startsWith("INSERT INTO audit_log"));
    }

    @Test
    public void testMariaDbExtensions() throws IOException {
        List<SlowQuery> records = parser.parse(fixtureText(SlowLogFixtures.MARIADB), "mariadb-slow.log");

        assertEquals(2, records.size());
        SlowQuery first = records.get(0);
        assertEquals("240301 10:00:00", first.getTime());
        assertEquals(Long.valueOf(8), first.getThreadId());
        assertEquals("shop", first.getSchema());
        assertEquals("No", first.getQcHit());
        assertEquals(Long.valueOf(0), first.getRowsAffected());
        assertEquals(Long.valueOf(1024), first.getBytesSent());
        assertNull(first.getConnectionId());
        assertEquals(1.5, first.getQueryTime());
        assertEquals(10, first.getRowsSent());
        assertEquals(200, first.getRowsExamined());

        assertEquals(Long.valueOf(1), records.get(1).getRowsAffected());
    }

    @Test
    public void testIncompleteAndSkippedEntriesAreCounted() throws IOException {
        SlowLogReader reader = parser.open(new StringReader(fixtureText(SlowLogFixtures.INCOMPLETE)), "bad.log");
        List<SlowQuery> records = new ArrayList<>();
        reader.forEachRemaining(records::add);

        assertEquals(2, records.size());

        SlowQuery noMetrics = records.get(0);
        assertTrue(noMetrics.isIncomplete());
        assertEquals(0.0, noMetrics.getQueryTime());
        assertEquals("SELECT 1;", noMetrics.getSql());

        SlowQuery badNumber = records.get(1);
        assertTrue(badNumber.isIncomplete());
        assertEquals(0.0, badNumber.getQueryTime());
        assertEquals(3, badNumber.getRowsExamined());

        ParseDiagnostics diagnostics = reader.getDiagnostics();
        assertEquals(2, diagnostics.getEntries());
        assertEquals(1, diagnostics.getSkippedEntries());
        assertEquals(2, diagnostics.getIncompleteEntries());
        assertTrue(diagnostics.getWarnings() >= 3);
        assertFalse(diagnostics.isTruncated());
    }

    @Test
    public void testTextWithoutMarkersYieldsNoRecords() {
        assertTrue(parser.parse("", "empty.log").isEmpty());
        assertTrue(parser.parse("SELECT 1;\nSELECT 2;\n", "plain.log").isEmpty());
    }

    @Test
    public void testLinesBeforeFirstMarkerAreIgnored() {
        String text = "garbage line\nSELECT 'not a query';\n" + SlowLogFixtures.entry("app", 1.0, 5, "SELECT 1");
        List<SlowQuery> records = parser.parse(text, "x.log");
        assertEquals(1, records.size());
        assertEquals("SELECT 1;", records.get(0).getSql());
    }

    @Test
    public void testMetadataKeysInAnyOrder() {
        String text = "# Time: 2024-01-01T00:00:00Z\n"
                + "# User@Host: app[app] @ localhost []\n"
                + "# Rows_examined: 77  Query_time: 3.5 Rows_sent: 2  Lock_time: 0.5\n"
                + "SELECT 1;\n";
        SlowQuery record = parser.parse(text, "x.log").get(0);
        assertEquals(3.5, record.getQueryTime());
        assertEquals(0.5, record.getLockTime());
        assertEquals(2, record.getRowsSent());
        assertEquals(77, record.getRowsExamined());
        assertFalse(record.isIncomplete());
    }

    @Test
    public void testRecordsIterableIsRestartable() {
        Iterable<SlowQuery> records = parser.records(SlowLogFixtures.log(3), "x.log");
        int first = 0;
        for (SlowQuery ignored : records) {
            first++;
        }
        int second = 0;
        for (SlowQuery ignored : records) {
            second++;
        }
        assertEquals(3, first);
        assertEquals(3, second);
    }

    @Test
    public void testRecordLimitTruncates() throws IOException {
        AnalyzerConfig config = new AnalyzerConfig();
        config.setMaxRecords(2);
        SlowLogParser limited = new SlowLogParser(config);

        try (SlowLogReader reader = limited.open(new StringReader(SlowLogFixtures.log(5)), "x.log")) {
            List<SlowQuery> records = new ArrayList<>();
            reader.forEachRemaining(records::add);
            assertEquals(2, records.size());
            assertEquals(1.0, records.get(0).getQueryTime());
            assertEquals(2.0, records.get(1).getQueryTime());
            assertTrue(reader.getDiagnostics().isTruncated());
            assertEquals(2, reader.getDiagnostics().getEntries());
        }
    }

    @Test
    public void testRecordLimitNotTruncatedWhenInputEndsExactly() throws IOException {
        AnalyzerConfig config = new AnalyzerConfig();
        config.setMaxRecords(3);
        try (SlowLogReader reader = new SlowLogParser(config).open(new StringReader(SlowLogFixtures.log(3)), "x")) {
            reader.forEachRemaining(r -> { });
            assertFalse(reader.getDiagnostics().isTruncated());
        }
    }

    @Test
    public void testOverlongLineIsTruncated() {
        AnalyzerConfig config = new AnalyzerConfig();
        Properties props = new Properties();
        props.setProperty("parser.maxLineLength", "40");
        config.loadFromProperties(props);

        String longSql = "SELECT * FROM t WHERE a = '" + "x".repeat(200) + "'";
        SlowLogReader reader = new SlowLogParser(config).open(
                new StringReader(SlowLogFixtures.entry("app", 1.0, 1, longSql)), "x.log");
        SlowQuery record = reader.next();

        assertEquals(40, record.getSql().length());
        assertTrue(reader.getDiagnostics().getWarnings() > 0);
        assertFalse(reader.hasNext());
    }

    @Test
    public void testIteratorContract() {
        Iterator<SlowQuery> it = parser.records("", "x.log").iterator();
        assertFalse(it.hasNext());
        assertThrows(java.util.NoSuchElementException.class, it::next);
    }
}
