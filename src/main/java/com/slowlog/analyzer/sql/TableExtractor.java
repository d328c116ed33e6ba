package com.slowlog.analyzer.sql;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import com.slowlog.analyzer.sql.SqlToken.Type;

/**
 * Heuristic table name extraction from a token stream.
 * <p>
 * Names following FROM, JOIN, INTO and UPDATE are collected; FROM and UPDATE accept comma separated lists.
 * Aliases and modifiers such as IGNORE are skipped, {@code db.table} is reduced to {@code table} and backticks
 * are removed. Unquoted reserved words, DUAL included, are never reported. A FROM inside EXTRACT, TRIM,
 * SUBSTRING or POSITION does not introduce a table.
 */
public final class TableExtractor {

    private final List<SqlToken> sig = new ArrayList<>();
    private final SortedSet<String> tables = new TreeSet<>();

    private TableExtractor(List<SqlToken> tokens) {
        for (SqlToken token : tokens) {
            if (token.isSignificant()) {
                sig.add(token);
            }
        }
    }

    public static SortedSet<String> extract(String sql) {
        return extract(SqlLexer.tokenize(sql));
    }

    public static SortedSet<String> extract(List<SqlToken> tokens) {
        TableExtractor extractor = new TableExtractor(tokens);
        extractor.scan();
        return extractor.tables;
    }

    private void scan() {
        Deque<String> parenOwners = new ArrayDeque<>();
        for (int i = 0; i < sig.size(); i++) {
            SqlToken token = sig.get(i);
            if (token.isPunctuation('(')) {
                SqlToken prev = at(i - 1);
                parenOwners.push(prev != null && prev.getType() == Type.WORD ? prev.upper() : "");
                continue;
            }
            if (token.isPunctuation(')')) {
                parenOwners.poll();
                continue;
            }
            if (token.getType() != Type.WORD) {
                continue;
            }
            switch (token.upper()) {
            case "FROM":
                if (!SqlKeywords.isFromFunction(parenOwners.peek())) {
                    readTables(i + 1, true);
                }
                break;
            case "JOIN":
            case "INTO":
                readTables(i + 1, false);
                break;
            case "UPDATE":
                SqlToken prev = at(i - 1);
                // ON DUPLICATE KEY UPDATE, SELECT ... FOR UPDATE
                if (prev == null || !(prev.isWord("KEY") || prev.isWord("FOR"))) {
                    readTables(i + 1, true);
                }
                break;
            default:
                break;
            }
        }
    }

    private void readTables(int j, boolean allowList) {
        while (true) {
            while (at(j) != null && at(j).getType() == Type.WORD && SqlKeywords.isTableModifier(at(j).getText())) {
                j++;
            }
            SqlToken first = at(j);
            if (!isName(first)) {
                return;
            }
            String name = unquote(first);
            j++;
            while (at(j) != null && at(j).isPunctuation('.') && isName(at(j + 1))) {
                name = unquote(at(j + 1));
                j += 2;
            }
            if (!name.isEmpty()) {
                tables.add(name);
            }
            if (at(j) != null && at(j).isWord("AS")) {
                j++;
            }
            if (isName(at(j))) {
                j++;
            }
            if (allowList && at(j) != null && at(j).isPunctuation(',')) {
                j++;
                continue;
            }
            return;
        }
    }

    private static boolean isName(SqlToken token) {
        if (token == null) {
            return false;
        }
        if (token.getType() == Type.QUOTED_IDENTIFIER) {
            return true;
        }
        return token.getType() == Type.WORD && !SqlKeywords.isReserved(token.getText());
    }

    private static String unquote(SqlToken token) {
        String text = token.getText();
        if (token.getType() != Type.QUOTED_IDENTIFIER) {
            return text;
        }
        int end = text.length() > 1 && text.endsWith("`") ? text.length() - 1 : text.length();
        return text.substring(1, end).replace("``", "`");
    }

    private SqlToken at(int i) {
        return i >= 0 && i < sig.size() ? sig.get(i) : null;
    }
}
