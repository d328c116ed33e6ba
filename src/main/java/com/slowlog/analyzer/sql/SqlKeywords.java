package com.slowlog.analyzer.sql;

import java.util.Locale;
import java.util.Set;

/**
 * Keyword sets used to tell identifiers from SQL syntax.
 */
final class SqlKeywords {

    // Reserved words and clause keywords that never name a table or alias
    private static final Set<String> RESERVED = Set.of(
        "ALL", "AND", "AS", "ASC", "BETWEEN", "BINARY", "BY", "CASE", "CHARACTER", "CHARSET", "COLLATE",
        "CROSS", "DEFAULT", "DELAYED", "DELETE", "DESC", "DISTINCT", "DISTINCTROW", "DIV", "DUAL", "DUMPFILE",
        "DUPLICATE", "ELSE", "END", "ESCAPE", "EXCEPT", "EXISTS", "FALSE", "FETCH", "FOR", "FORCE", "FROM",
        "FULL", "GROUP", "HAVING", "HIGH_PRIORITY", "IGNORE", "IN", "INDEX", "INNER", "INSERT", "INTERSECT",
        "INTERVAL", "INTO", "IS", "JOIN", "KEY", "LATERAL", "LEFT", "LIKE", "LIMIT", "LOCK", "LOW_PRIORITY",
        "MOD", "NATURAL", "NOT", "NOWAIT", "NULL", "OFFSET", "ON", "OR", "ORDER", "OUTER", "OUTFILE", "OVER",
        "PARTITION", "QUICK", "REGEXP", "REPLACE", "RETURNING", "RIGHT", "RLIKE", "SELECT", "SET", "SHARE",
        "SKIP", "SOUNDS", "SQL_BIG_RESULT", "SQL_BUFFER_RESULT", "SQL_CALC_FOUND_ROWS", "SQL_NO_CACHE",
        "SQL_SMALL_RESULT", "STRAIGHT_JOIN", "TABLE", "THEN", "TRUE", "UNION", "UPDATE", "USE", "USING",
        "VALUE", "VALUES", "WHEN", "WHERE", "WINDOW", "WITH", "XOR"
    );

    // Words allowed between INSERT/UPDATE/DELETE/REPLACE ... INTO/FROM/UPDATE and the table name
    private static final Set<String> TABLE_MODIFIERS = Set.of(
        "LOW_PRIORITY", "HIGH_PRIORITY", "DELAYED", "IGNORE", "QUICK", "ONLY"
    );

    // Functions whose argument syntax uses FROM without naming a table
    private static final Set<String> FROM_FUNCTIONS = Set.of(
        "EXTRACT", "TRIM", "SUBSTRING", "SUBSTR", "POSITION", "OVERLAY"
    );

    private SqlKeywords() {
    }

    static boolean isReserved(String word) {
        return RESERVED.contains(word.toUpperCase(Locale.ROOT));
    }

    static boolean isTableModifier(String word) {
        return TABLE_MODIFIERS.contains(word.toUpperCase(Locale.ROOT));
    }

    static boolean isFromFunction(String word) {
        return word != null && FROM_FUNCTIONS.contains(word.toUpperCase(Locale.ROOT));
    }
}
