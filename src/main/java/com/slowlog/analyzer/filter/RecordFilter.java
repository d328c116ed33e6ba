package com.slowlog.analyzer.filter;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import com.slowlog.analyzer.SlowQuery;
import com.slowlog.analyzer.filter.FilterSpec.MatchMode;
import com.slowlog.analyzer.model.AnalyzedQuery;

/**
 * Applies a {@link FilterSpec} to analyzed records.
 */
public class RecordFilter {

    public static List<AnalyzedQuery> apply(List<AnalyzedQuery> records, FilterSpec spec) {
        return records.stream()
                .filter(query -> matches(query, spec))
                .collect(Collectors.toList());
    }

    public static boolean matches(AnalyzedQuery query, FilterSpec spec) {
        SlowQuery record = query.getRecord();
        if (spec.getStatementType() != null && query.getStatementType() != spec.getStatementType()) {
            return false;
        }
        if (spec.getMinQueryTime() != null && record.getQueryTime() < spec.getMinQueryTime()) {
            return false;
        }
        if (spec.getMaxQueryTime() != null && record.getQueryTime() > spec.getMaxQueryTime()) {
            return false;
        }
        if (spec.getMinRowsExamined() != null && record.getRowsExamined() < spec.getMinRowsExamined()) {
            return false;
        }
        MatchMode mode = spec.getMatchMode();
        if (spec.getUser() != null && !textMatches(record.getUser(), spec.getUser(), mode)) {
            return false;
        }
        if (spec.getSqlKeyword() != null
                && !textMatches(query.getTemplate().getNormalizedText(), spec.getSqlKeyword(), mode)) {
            return false;
        }
        if (!spec.getTableNames().isEmpty()) {
            return anyTableMatches(query, spec.getTableNames(), mode);
        }
        return true;
    }

    private static boolean anyTableMatches(AnalyzedQuery query, List<String> names, MatchMode mode) {
        for (String table : query.getTemplate().getTables()) {
            for (String name : names) {
                if (textMatches(table, name, mode)) {
                    return true;
                }
            }
        }
        return false;
    }

    static boolean textMatches(String value, String wanted, MatchMode mode) {
        if (value == null) {
            return false;
        }
        if (mode == MatchMode.EXACT) {
            return value.equals(wanted);
        }
        return value.toLowerCase(Locale.ROOT).contains(wanted.toLowerCase(Locale.ROOT));
    }
}
