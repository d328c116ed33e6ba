package com.slowlog.analyzer;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Line oriented scanner that turns the text of one slow query log into {@link SlowQuery} records, in file order.
 * <p>
 * Malformed entries never fail the scan: they are skipped or emitted with defaulted fields, and every such
 * decision is counted in {@link #getDiagnostics()}. Not thread safe.
 */
public class SlowLogReader implements Iterator<SlowQuery>, Closeable {

    private static final Logger logger = LoggerFactory.getLogger(SlowLogReader.class);

    private static final int MAX_LOGGED_WARNINGS = 3;

    static final String TIME_MARKER = "# Time:";
    static final String USER_HOST_MARKER = "# User@Host:";
    private static final String ADMIN_COMMAND = "# administrator command:";

    private static final Pattern USER_HOST = Pattern.compile(
            "^# User@Host:\\s*([^\\[\\s]*)\\s*\\[([^\\]]*)\\]\\s*@\\s*([^\\[\\s]*)\\s*\\[([^\\]]*)\\](?:\\s+Id:\\s*(\\d+))?.*$");

    private static final Pattern HEADER_KEY = Pattern.compile("(?:^|\\s)([A-Za-z_]+):(?=\\s|$)");

    private static final Pattern USE_DB = Pattern.compile("^use\\s+`?([^`;\\s]+)`?\\s*;$", Pattern.CASE_INSENSITIVE);

    private static final Pattern SET_TIMESTAMP = Pattern.compile("^SET\\s+timestamp\\s*=\\s*(\\d+)\\s*;$",
            Pattern.CASE_INSENSITIVE);

    // Written by the server on startup and on log rotation, anywhere in the file
    private static final Pattern PREAMBLE = Pattern.compile(
            "^(?:.*mysqld(?:\\.exe)?, Version: .*|Tcp port: .*|Time\\s+Id\\s+Command\\s+Argument)$");

    private final BufferedReader in;
    private final String sourceId;
    private final long maxRecords;
    private final int maxLineLength;
    private final ParseDiagnostics diagnostics = new ParseDiagnostics();

    private String pushedBack;
    private String lastTime;
    private long lineNumber;
    private long emitted;
    private SlowQuery next;
    private boolean finished;

    public SlowLogReader(Reader reader, String sourceId, long maxRecords, int maxLineLength) {
        this.in = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        this.sourceId = sourceId;
        this.maxRecords = maxRecords;
        this.maxLineLength = maxLineLength;
    }

    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (finished) {
            return false;
        }
        try {
            if (maxRecords > 0 && emitted >= maxRecords) {
                finished = true;
                if (hasRemainingInput()) {
                    diagnostics.markTruncated();
                    logger.info("[{}] Reached record limit of {}, stopping parsing at line {}", sourceId, maxRecords,
                            lineNumber);
                }
                return false;
            }
            next = readEntry();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed reading slow log " + sourceId, e);
        }
        return next != null;
    }

    @Override
    public SlowQuery next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        SlowQuery result = next;
        next = null;
        emitted++;
        return result;
    }

    public ParseDiagnostics getDiagnostics() {
        return diagnostics;
    }

    public String getSourceId() {
        return sourceId;
    }

    @Override
    public void close() throws IOException {
        in.close();
    }

    private SlowQuery readEntry() throws IOException {
        Entry entry = null;
        String line;
        while ((line = nextLine()) != null) {
            line = line.stripTrailing();
            if (PREAMBLE.matcher(line).matches()) {
                continue;
            }

            if (line.startsWith(TIME_MARKER)) {
                if (entry != null) {
                    pushedBack = line;
                    SlowQuery completed = complete(entry);
                    entry = null;
                    if (completed != null) {
                        return completed;
                    }
                    continue;
                }
                entry = new Entry();
                lastTime = line.substring(TIME_MARKER.length()).trim();
                entry.time = lastTime;
                continue;
            }

            if (line.startsWith(USER_HOST_MARKER)) {
                // MySQL omits "# Time:" when it has not changed since the previous entry
                if (entry != null && (entry.hasUserHost || entry.hasSql())) {
                    pushedBack = line;
                    SlowQuery completed = complete(entry);
                    entry = null;
                    if (completed != null) {
                        return completed;
                    }
                    continue;
                }
                if (entry == null) {
                    entry = new Entry();
                    entry.time = lastTime;
                }
                parseUserHost(entry, line);
                continue;
            }

            if (entry == null) {
                continue;
            }
            handleBodyLine(entry, line);
        }

        finished = true;
        return entry != null ? complete(entry) : null;
    }

    private void handleBodyLine(Entry entry, String line) {
        if (line.startsWith("#") && !entry.hasSql() && !line.startsWith(ADMIN_COMMAND)) {
            parseHeader(entry, line);
            return;
        }

        String trimmed = line.trim();
        Matcher m = SET_TIMESTAMP.matcher(trimmed);
        if (m.matches()) {
            try {
                entry.timestamp = Long.parseLong(m.group(1));
            } catch (NumberFormatException e) {
                warn("invalid timestamp '" + m.group(1) + "'");
            }
            return;
        }
        m = USE_DB.matcher(trimmed);
        if (m.matches()) {
            entry.db = m.group(1);
            return;
        }

        if (!entry.hasSql() && trimmed.isEmpty()) {
            return;
        }
        entry.sqlLines.add(line);
    }

    private void parseUserHost(Entry entry, String line) {
        entry.hasUserHost = true;
        Matcher m = USER_HOST.matcher(line);
        if (!m.matches()) {
            warn("unrecognized User@Host line: " + abbreviate(line));
            return;
        }
        entry.user = !m.group(2).isEmpty() ? m.group(2) : m.group(1);
        entry.host = !m.group(3).isEmpty() ? m.group(3) : m.group(4);
        if (m.group(5) != null) {
            entry.connectionId = Long.valueOf(m.group(5));
        }
    }

    private void parseHeader(Entry entry, String line) {
        String body = line.substring(1);
        Matcher m = HEADER_KEY.matcher(body);
        List<String> keys = new ArrayList<>();
        List<int[]> bounds = new ArrayList<>();
        while (m.find()) {
            keys.add(m.group(1));
            bounds.add(new int[] { m.start(), m.end() });
        }
        if (keys.isEmpty()) {
            logger.debug("[{}] Ignoring comment line {}: {}", sourceId, lineNumber, abbreviate(line));
            return;
        }
        for (int i = 0; i < keys.size(); i++) {
            int valueEnd = i + 1 < keys.size() ? bounds.get(i + 1)[0] : body.length();
            String value = body.substring(bounds.get(i)[1], valueEnd).trim();
            applyHeader(entry, keys.get(i), value);
        }
    }

    private void applyHeader(Entry entry, String key, String value) {
        try {
            switch (key) {
            case "Query_time":
                entry.queryTime = Double.parseDouble(value);
                entry.hasQueryTime = true;
                break;
            case "Lock_time":
                entry.lockTime = Double.parseDouble(value);
                break;
            case "Rows_sent":
                entry.rowsSent = Long.parseLong(value);
                break;
            case "Rows_examined":
                entry.rowsExamined = Long.parseLong(value);
                break;
            case "Rows_affected":
                entry.rowsAffected = Long.valueOf(value);
                break;
            case "Bytes_sent":
                entry.bytesSent = Long.valueOf(value);
                break;
            case "Thread_id":
                entry.threadId = Long.valueOf(value);
                break;
            case "Schema":
                entry.schema = value.isEmpty() ? null : value;
                break;
            case "QC_hit":
                entry.qcHit = value.isEmpty() ? null : value;
                break;
            default:
                break;
            }
        } catch (NumberFormatException e) {
            entry.incomplete = true;
            warn("invalid value '" + value + "' for " + key);
        }
    }

    private SlowQuery complete(Entry entry) {
        if (!entry.hasSql() && !entry.hasQueryTime) {
            diagnostics.entrySkipped();
            warn("skipping entry without SQL text or metrics (time " + entry.time + ")");
            return null;
        }
        if (!entry.hasQueryTime) {
            warn("entry has no Query_time line, defaulting metrics to 0");
        }
        if (!entry.hasSql()) {
            warn("entry has no SQL text");
        }
        boolean incomplete = entry.incomplete || !entry.hasQueryTime || !entry.hasSql();

        List<String> lines = entry.sqlLines;
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isBlank()) {
            lines.remove(lines.size() - 1);
        }

        diagnostics.entryEmitted(incomplete);
        return SlowQuery.builder(sourceId)
                .time(entry.time)
                .timestamp(entry.timestamp)
                .user(entry.user)
                .host(entry.host)
                .connectionId(entry.connectionId)
                .threadId(entry.threadId)
                .schema(entry.schema)
                .qcHit(entry.qcHit)
                .queryTime(entry.queryTime)
                .lockTime(entry.lockTime)
                .rowsSent(entry.rowsSent)
                .rowsExamined(entry.rowsExamined)
                .rowsAffected(entry.rowsAffected)
                .bytesSent(entry.bytesSent)
                .db(entry.db)
                .sql(String.join("\n", lines))
                .incomplete(incomplete)
                .build();
    }

    private boolean hasRemainingInput() throws IOException {
        String line;
        while ((line = nextLine()) != null) {
            if (!line.isBlank()) {
                return true;
            }
        }
        return false;
    }

    private String nextLine() throws IOException {
        if (pushedBack != null) {
            String line = pushedBack;
            pushedBack = null;
            return line;
        }
        String line = readLineSafe();
        if (line != null) {
            lineNumber++;
            diagnostics.lineRead();
        }
        return line;
    }

    /**
     * Reads a line, keeping at most maxLineLength characters of it. The rest of an overlong line is skipped.
     */
    private String readLineSafe() throws IOException {
        StringBuilder sb = null;
        boolean overflow = false;
        int ch;
        while ((ch = in.read()) != -1) {
            if (sb == null) {
                sb = new StringBuilder(128);
            }
            if (ch == '\n') {
                break;
            }
            if (ch == '\r') {
                in.mark(1);
                int following = in.read();
                if (following != '\n' && following != -1) {
                    in.reset();
                }
                break;
            }
            if (sb.length() < maxLineLength) {
                sb.append((char) ch);
            } else {
                overflow = true;
            }
        }
        if (sb == null) {
            return null;
        }
        if (overflow) {
            warn(String.format("line exceeds %d chars, truncated", maxLineLength));
        }
        return sb.toString();
    }

    private void warn(String detail) {
        diagnostics.warning();
        if (diagnostics.getWarnings() <= MAX_LOGGED_WARNINGS) {
            logger.warn("[{}] line {}: {}", sourceId, lineNumber, detail);
        } else {
            logger.debug("[{}] line {}: {}", sourceId, lineNumber, detail);
        }
    }

    private static String abbreviate(String line) {
        return line.length() > 200 ? line.substring(0, 200) + "..." : line;
    }

    private static class Entry {
        String time;
        Long timestamp;
        String user;
        String host;
        Long connectionId;
        Long threadId;
        String schema;
        String qcHit;
        double queryTime;
        double lockTime;
        long rowsSent;
        long rowsExamined;
        Long rowsAffected;
        Long bytesSent;
        String db;
        boolean hasUserHost;
        boolean hasQueryTime;
        boolean incomplete;
        final List<String> sqlLines = new ArrayList<>();

        boolean hasSql() {
            return !sqlLines.isEmpty();
        }
    }
}
