package com.slowlog.analyzer.filter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.slowlog.analyzer.sql.StatementType;

/**
 * Predicate over analyzed records. Unset criteria match everything; set criteria are combined with AND.
 */
public class FilterSpec {

    private static final Logger logger = LoggerFactory.getLogger(FilterSpec.class);

    public enum MatchMode {
        /** Case-insensitive containment. */
        SUBSTRING,
        /** Case-sensitive equality. */
        EXACT
    }

    private StatementType statementType;
    private Double minQueryTime;
    private Double maxQueryTime;
    private Long minRowsExamined;
    private List<String> tableNames = Collections.emptyList();
    private String user;
    private String sqlKeyword;
    private MatchMode matchMode = MatchMode.SUBSTRING;

    public static FilterSpec all() {
        return new FilterSpec();
    }

    /**
     * Reads a predicate in the form the web layer submits it, e.g.
     * {@code {"statement_type": "SELECT", "min_query_time": 1.5, "table_name": "orders,users"}}. Empty strings
     * and nulls leave a criterion unset.
     */
    public static FilterSpec fromJson(String json) {
        JSONObject jo;
        try {
            jo = new JSONObject(json);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Invalid filter JSON: " + e.getMessage(), e);
        }
        FilterSpec spec = new FilterSpec();
        for (String key : jo.keySet()) {
            String value = jo.isNull(key) ? "" : String.valueOf(jo.get(key)).trim();
            if (value.isEmpty()) {
                continue;
            }
            switch (key) {
            case "statement_type":
                spec.statementType(StatementType.fromName(value));
                break;
            case "min_query_time":
                spec.minQueryTime(parseDouble(key, value));
                break;
            case "max_query_time":
                spec.maxQueryTime(parseDouble(key, value));
                break;
            case "min_rows_examined":
                spec.minRowsExamined(parseLong(key, value));
                break;
            case "table_name":
                spec.tableNames(value);
                break;
            case "user":
                spec.user(value);
                break;
            case "sql_keyword":
                spec.sqlKeyword(value);
                break;
            case "match":
                spec.matchMode(MatchMode.valueOf(value.toUpperCase(Locale.ROOT)));
                break;
            default:
                logger.debug("Ignoring unknown filter key: {}", key);
            }
        }
        return spec;
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + value, e);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    public FilterSpec statementType(StatementType statementType) {
        this.statementType = statementType;
        return this;
    }

    public FilterSpec minQueryTime(Double minQueryTime) {
        this.minQueryTime = minQueryTime;
        return this;
    }

    public FilterSpec maxQueryTime(Double maxQueryTime) {
        this.maxQueryTime = maxQueryTime;
        return this;
    }

    public FilterSpec minRowsExamined(Long minRowsExamined) {
        this.minRowsExamined = minRowsExamined;
        return this;
    }

    /**
     * @param tableNames comma separated; a record matches when any of its tables matches any of the names
     */
    public FilterSpec tableNames(String tableNames) {
        List<String> names = new ArrayList<>();
        if (tableNames != null) {
            for (String name : tableNames.split(",")) {
                if (!name.trim().isEmpty()) {
                    names.add(name.trim());
                }
            }
        }
        this.tableNames = Collections.unmodifiableList(names);
        return this;
    }

    public FilterSpec user(String user) {
        this.user = user;
        return this;
    }

    /**
     * @param sqlKeyword matched against the normalized template text, so literals and comments are not searched
     */
    public FilterSpec sqlKeyword(String sqlKeyword) {
        this.sqlKeyword = sqlKeyword;
        return this;
    }

    public FilterSpec matchMode(MatchMode matchMode) {
        this.matchMode = matchMode;
        return this;
    }

    public StatementType getStatementType() {
        return statementType;
    }

    public Double getMinQueryTime() {
        return minQueryTime;
    }

    public Double getMaxQueryTime() {
        return maxQueryTime;
    }

    public Long getMinRowsExamined() {
        return minRowsExamined;
    }

    public List<String> getTableNames() {
        return tableNames;
    }

    public String getUser() {
        return user;
    }

    public String getSqlKeyword() {
        return sqlKeyword;
    }

    public MatchMode getMatchMode() {
        return matchMode;
    }

    @Override
    public String toString() {
        return String.format("FilterSpec[type=%s, queryTime=%s..%s, minRowsExamined=%s, tables=%s, user=%s, "
                + "sqlKeyword=%s, match=%s]", statementType, minQueryTime, maxQueryTime, minRowsExamined, tableNames,
                user, sqlKeyword, matchMode);
    }
}
