package com.slowlog.analyzer;

/**
 * Counters describing what the parser did with the entries of one or more log files.
 */
public class ParseDiagnostics {

    private long entries;
    private long skippedEntries;
    private long incompleteEntries;
    private long warnings;
    private long linesRead;
    private boolean truncated;

    public ParseDiagnostics() {
    }

    public ParseDiagnostics(long entries, long skippedEntries, long incompleteEntries, long warnings,
            long linesRead, boolean truncated) {
        this.entries = entries;
        this.skippedEntries = skippedEntries;
        this.incompleteEntries = incompleteEntries;
        this.warnings = warnings;
        this.linesRead = linesRead;
        this.truncated = truncated;
    }

    void entryEmitted(boolean incomplete) {
        entries++;
        if (incomplete) {
            incompleteEntries++;
        }
    }

    void entrySkipped() {
        skippedEntries++;
    }

    void warning() {
        warnings++;
    }

    void lineRead() {
        linesRead++;
    }

    void markTruncated() {
        truncated = true;
    }

    /**
     * Sums the counters of several parses, used when results are merged.
     */
    public static ParseDiagnostics combine(Iterable<ParseDiagnostics> parts) {
        ParseDiagnostics total = new ParseDiagnostics();
        for (ParseDiagnostics p : parts) {
            if (p == null) {
                continue;
            }
            total.entries += p.entries;
            total.skippedEntries += p.skippedEntries;
            total.incompleteEntries += p.incompleteEntries;
            total.warnings += p.warnings;
            total.linesRead += p.linesRead;
            total.truncated |= p.truncated;
        }
        return total;
    }

    /** Records emitted, incomplete ones included. */
    public long getEntries() {
        return entries;
    }

    public long getSkippedEntries() {
        return skippedEntries;
    }

    public long getIncompleteEntries() {
        return incompleteEntries;
    }

    public long getWarnings() {
        return warnings;
    }

    public long getLinesRead() {
        return linesRead;
    }

    /** True when a record cap stopped the parse before the end of the input. */
    public boolean isTruncated() {
        return truncated;
    }

    @Override
    public String toString() {
        return String.format("entries=%d skipped=%d incomplete=%d warnings=%d lines=%d truncated=%s",
                entries, skippedEntries, incompleteEntries, warnings, linesRead, truncated);
    }
}
